package org.pragmatica.profile.parser;

/**
 * Parser configuration options.
 *
 * @param maxInputLength longest accepted input, in characters
 * @param collectDocs    whether comments preceding a declaration are recorded as its docs
 */
public record ParserConfig(
    int maxInputLength,
    boolean collectDocs
) {
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1_000_000;

    public static final ParserConfig DEFAULT = new ParserConfig(
        DEFAULT_MAX_INPUT_LENGTH,
        true
    );

    public ParserConfig {
        if (maxInputLength < 0) {
            throw new IllegalArgumentException("maxInputLength must not be negative: " + maxInputLength);
        }
    }
}
