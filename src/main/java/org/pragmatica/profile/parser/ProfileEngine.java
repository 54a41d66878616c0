package org.pragmatica.profile.parser;

import org.pragmatica.profile.error.ParseException;
import org.pragmatica.profile.lexer.Tokenizer;
import org.pragmatica.profile.tree.Declaration;
import org.pragmatica.profile.tree.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Drives a single parse: docs, then one declaration, until input runs out.
 * Stops at the first error.
 */
public final class ProfileEngine {
    private static final Logger log = LoggerFactory.getLogger(ProfileEngine.class);

    private final ParserConfig config;

    private ProfileEngine(ParserConfig config) {
        this.config = config;
    }

    public static ProfileEngine create(ParserConfig config) {
        return new ProfileEngine(config);
    }

    public ParserConfig config() {
        return config;
    }

    public ParseResult<Profile> parse(String input) {
        if (input.length() > config.maxInputLength()) {
            throw new IllegalArgumentException(
            "Profile input exceeds maximum size of " + config.maxInputLength() + " characters");
        }
        try{
            var profile = parseProfile(Tokenizer.of(input));
            log.debug("Parsed {} declarations from {} characters", profile.declarations().size(), input.length());
            return ParseResult.success(profile);
        } catch (ParseException e) {
            log.debug("Profile parse failed at {}: {}", e.error().span(), e.getMessage());
            return ParseResult.failure(e.error());
        }
    }

    private Profile parseProfile(Tokenizer tokens) {
        var declarations = new ArrayList<Declaration>();

        while (tokens.peek().isPresent()) {
            var docs = DocCollector.collect(tokens, config.collectDocs());
            var declaration = DeclarationParser.parse(tokens, docs);
            log.trace("Parsed {} at {}", declaration.getClass().getSimpleName(), declaration.span());
            declarations.add(declaration);
        }

        return new Profile(declarations);
    }
}
