package org.pragmatica.profile.error;

import org.pragmatica.profile.tree.SourceSpan;

/**
 * Parse error with the span of the offending text. Lexical and syntactic failures
 * share the same "expected ..., found ..." message shape.
 */
public sealed interface ParseError {
    String END_OF_INPUT = "end of input";

    SourceSpan span();

    String expected();

    String found();

    default String message() {
        return "expected " + expected() + ", found " + found();
    }

    default Diagnostic toDiagnostic() {
        return Diagnostic.error(message(), span());
    }

    /**
     * A token of the wrong kind.
     */
    record UnexpectedToken(SourceSpan span, String expected, String found) implements ParseError {}

    /**
     * Input ended where a token was required. The span is empty and sits at the end of input.
     */
    record UnexpectedEof(SourceSpan span, String expected) implements ParseError {
        @Override
        public String found() {
            return END_OF_INPUT;
        }
    }

    /**
     * A character that cannot start any token.
     */
    record InvalidCharacter(SourceSpan span, int codePoint) implements ParseError {
        @Override
        public String expected() {
            return "whitespace, a comment, an identifier, a string literal or a keyword";
        }

        @Override
        public String found() {
            return "character '" + new String(Character.toChars(codePoint)) + "'";
        }
    }

    /**
     * A string literal without its closing quote. The span covers the literal up to end of input.
     */
    record UnterminatedString(SourceSpan span) implements ParseError {
        @Override
        public String expected() {
            return "closing `\"`";
        }

        @Override
        public String found() {
            return END_OF_INPUT;
        }
    }

    /**
     * A block comment without its closing marker.
     */
    record UnterminatedComment(SourceSpan span) implements ParseError {
        @Override
        public String expected() {
            return "`*/`";
        }

        @Override
        public String found() {
            return END_OF_INPUT;
        }
    }

    /**
     * A malformed escape inside a string literal. The span covers the escape sequence.
     */
    record InvalidEscape(SourceSpan span, String sequence) implements ParseError {
        @Override
        public String expected() {
            return "a valid escape sequence";
        }

        @Override
        public String found() {
            return "`" + sequence + "`";
        }
    }
}
