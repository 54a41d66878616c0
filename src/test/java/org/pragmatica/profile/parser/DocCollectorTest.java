package org.pragmatica.profile.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.profile.lexer.TokenKind;
import org.pragmatica.profile.lexer.Tokenizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocCollectorTest {

    @Test
    void collect_contiguousComments_inSourceOrder() {
        var tokens = Tokenizer.of("// first line\n// second line\nprovide foo");

        var docs = DocCollector.collect(tokens, true);

        assertThat(docs.comments()).containsExactly("// first line", "// second line");
    }

    @Test
    void collect_blankLinesDoNotBreakRun() {
        var tokens = Tokenizer.of("// one\n\n\n/* two */\n\n// three\nrequire x");

        var docs = DocCollector.collect(tokens, true);

        assertThat(docs.comments()).containsExactly("// one", "/* two */", "// three");
    }

    @Test
    void collect_leavesCursorAtEndOfLastComment() {
        var tokens = Tokenizer.of("// doc\n   provide foo");

        DocCollector.collect(tokens, true);

        assertEquals(6, tokens.location().offset());
        assertEquals(TokenKind.PROVIDE, tokens.next().orElseThrow().kind());
    }

    @Test
    void collect_noComments_leavesCursorUntouched() {
        var tokens = Tokenizer.of("  provide foo");

        var docs = DocCollector.collect(tokens, true);

        assertTrue(docs.isEmpty());
        assertEquals(0, tokens.location().offset());
    }

    @Test
    void collect_stopsAtFirstNonComment() {
        var tokens = Tokenizer.of("provide a // trailing");

        var docs = DocCollector.collect(tokens, true);

        assertTrue(docs.isEmpty());
        assertEquals(TokenKind.PROVIDE, tokens.next().orElseThrow().kind());
    }

    @Test
    void collect_withoutRecording_stillSkipsComments() {
        var tokens = Tokenizer.of("// skipped\nprovide foo");

        var docs = DocCollector.collect(tokens, false);

        assertTrue(docs.isEmpty());
        assertEquals(10, tokens.location().offset());
    }

    @Test
    void collect_commentsUpToEndOfInput() {
        var tokens = Tokenizer.of("// only\n// comments\n");

        var docs = DocCollector.collect(tokens, true);

        assertEquals(2, docs.comments().size());
        assertTrue(tokens.next().isEmpty());
    }
}
