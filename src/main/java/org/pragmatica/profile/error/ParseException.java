package org.pragmatica.profile.error;

/**
 * Carries a {@link ParseError} out of the tokenizer and declaration parsers. The engine
 * turns it into a failed result, so it never escapes the public API.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
