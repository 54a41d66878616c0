package org.pragmatica.profile;

import org.pragmatica.profile.parser.ParseResult;
import org.pragmatica.profile.parser.ParserConfig;
import org.pragmatica.profile.parser.ProfileEngine;
import org.pragmatica.profile.tree.Profile;

/**
 * Entry point for parsing profile descriptions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var profile = ProfileParser.parse("""
 *     extend "base"
 *     // The clock every component sees
 *     provide wasi-clock
 *     implement "wasi-clock" with "monotonic"
 *     """).unwrap();
 *
 * profile.provided().get(0).docs().comments(); // ["// The clock every component sees"]
 * }</pre>
 *
 * <p>Parsing never throws for malformed input: the first error is returned as a
 * failed {@link ParseResult}.
 */
public final class ProfileParser {
    private static final ProfileEngine DEFAULT_ENGINE = ProfileEngine.create(ParserConfig.DEFAULT);

    private ProfileParser() {}

    /**
     * Parse profile text with the default configuration.
     */
    public static ParseResult<Profile> parse(String input) {
        return DEFAULT_ENGINE.parse(input);
    }

    /**
     * Parse profile text with custom configuration.
     */
    public static ParseResult<Profile> parse(String input, ParserConfig config) {
        return ProfileEngine.create(config)
                            .parse(input);
    }

    /**
     * Create a builder for a reusable, configured parser.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxInputLength = ParserConfig.DEFAULT_MAX_INPUT_LENGTH;
        private boolean collectDocs = true;

        private Builder() {}

        public Builder maxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
            return this;
        }

        public Builder docs(boolean collect) {
            this.collectDocs = collect;
            return this;
        }

        public ProfileEngine build() {
            return ProfileEngine.create(new ParserConfig(maxInputLength, collectDocs));
        }
    }
}
