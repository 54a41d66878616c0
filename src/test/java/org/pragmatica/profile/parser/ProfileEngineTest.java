package org.pragmatica.profile.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.profile.ProfileParser;

import static org.junit.jupiter.api.Assertions.*;

class ProfileEngineTest {

    @Test
    void defaultConfig_collectsDocs() {
        var profile = ProfileParser.parse("// doc\nprovide a").unwrap();

        assertEquals(1, profile.provided().get(0).docs().comments().size());
    }

    @Test
    void docsDisabled_commentsSkippedButNotRecorded() {
        var config = new ParserConfig(ParserConfig.DEFAULT_MAX_INPUT_LENGTH, false);

        var profile = ProfileParser.parse("// doc\nprovide a\n// more\nrequire b", config).unwrap();

        assertEquals(2, profile.declarations().size());
        assertTrue(profile.provided().get(0).docs().isEmpty());
        assertTrue(profile.required().get(0).docs().isEmpty());
    }

    @Test
    void builder_createsConfiguredEngine() {
        var engine = ProfileParser.builder()
                                  .maxInputLength(64)
                                  .docs(false)
                                  .build();

        assertEquals(new ParserConfig(64, false), engine.config());
        assertTrue(engine.parse("// doc\nextend base").isSuccess());
    }

    @Test
    void oversizedInput_rejected() {
        var engine = ProfileParser.builder()
                                  .maxInputLength(8)
                                  .build();

        assertThrows(IllegalArgumentException.class, () -> engine.parse("provide something-long"));
    }

    @Test
    void negativeLimit_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(-1, true));
    }

    @Test
    void engine_isReusableAcrossParses() {
        var engine = ProfileEngine.create(ParserConfig.DEFAULT);

        assertTrue(engine.parse("provide").isFailure());
        assertEquals(1, engine.parse("provide a").unwrap().declarations().size());
    }
}
