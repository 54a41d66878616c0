package org.pragmatica.profile.lexer;

import org.pragmatica.profile.error.ParseError;
import org.pragmatica.profile.error.ParseException;
import org.pragmatica.profile.tree.SourceLocation;
import org.pragmatica.profile.tree.SourceSpan;

import java.util.Map;
import java.util.Optional;

/**
 * On-demand lexer for profile source text.
 *
 * <p>A tokenizer is a cursor over an immutable input. Lookahead never mutates the
 * committed cursor: callers {@link #fork()} a copy, read ahead on it and, if they
 * want to keep what they read, {@link #syncTo(Tokenizer)} the original to it.
 */
public final class Tokenizer {
    private static final int MAX_UNICODE_ESCAPE_DIGITS = 6;
    private static final Map<Character, Character> SIMPLE_ESCAPES = Map.of('"', '"',
                                                                            '\'', '\'',
                                                                            '\\', '\\',
                                                                            'n', '\n',
                                                                            't', '\t',
                                                                            'r', '\r',
                                                                            '0', '\0');

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Tokenizer(String input, int pos, int line, int column) {
        this.input = input;
        this.pos = pos;
        this.line = line;
        this.column = column;
    }

    public static Tokenizer of(String input) {
        return new Tokenizer(input, 0, 1, 1);
    }

    /**
     * Independent cursor at the same position.
     */
    public Tokenizer fork() {
        return new Tokenizer(input, pos, line, column);
    }

    /**
     * Move this cursor to where {@code fork} is.
     */
    public void syncTo(Tokenizer fork) {
        if (fork.input != input) {
            throw new IllegalArgumentException("Cannot sync tokenizers over different inputs");
        }
        this.pos = fork.pos;
        this.line = fork.line;
        this.column = fork.column;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    /**
     * Next token, whitespace and comments included. Empty at end of input.
     */
    public Optional<Token> nextRaw() {
        if (isAtEnd()) {
            return Optional.empty();
        }
        var start = location();
        int c = input.codePointAt(pos);

        if (isWhitespace(c)) {
            while (!isAtEnd() && isWhitespace(peekChar())) {
                advance();
            }
            return token(start, TokenKind.WHITESPACE);
        }
        if (c == '/' && lookingAt("//")) {
            while (!isAtEnd() && peekChar() != '\n' && peekChar() != '\r') {
                advance();
            }
            return token(start, TokenKind.COMMENT);
        }
        if (c == '/' && lookingAt("/*")) {
            return scanBlockComment(start);
        }
        if (c == '"') {
            return scanStringLiteral(start);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        advance(Character.charCount(c));
        throw new ParseException(new ParseError.InvalidCharacter(span(start), c));
    }

    /**
     * Next token that is neither whitespace nor a comment. Empty at end of input.
     */
    public Optional<Token> next() {
        while (true) {
            var token = nextRaw();
            if (token.isEmpty() || !token.get().kind().isTrivia()) {
                return token;
            }
        }
    }

    /**
     * The token {@link #next()} would return, without moving this cursor.
     */
    public Optional<Token> peek() {
        return fork().next();
    }

    /**
     * Consume the next non-trivia token, which must be of the given kind.
     *
     * @return span of the consumed token
     */
    public SourceSpan expect(TokenKind kind) {
        var token = next();
        if (token.isPresent() && token.get().is(kind)) {
            return token.get().span();
        }
        throw expected(kind.description(), token);
    }

    public String slice(SourceSpan span) {
        return span.extract(input);
    }

    /**
     * Contents of a string literal token with the quotes stripped and escapes resolved.
     * Escapes were validated when the literal was scanned.
     */
    public String parseString(SourceSpan span) {
        var sb = new StringBuilder(span.length());
        int end = span.end().offset() - 1;
        int i = span.start().offset() + 1;

        while (i < end) {
            char c = input.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            char escaped = input.charAt(i + 1);
            if (escaped == 'u') {
                int close = input.indexOf('}', i);
                sb.appendCodePoint(Integer.parseInt(input.substring(i + 3, close), 16));
                i = close + 1;
            } else {
                sb.append(SIMPLE_ESCAPES.get(escaped));
                i += 2;
            }
        }
        return sb.toString();
    }

    /**
     * Error for finding {@code found} (or end of input, if empty) where {@code expected}
     * was required.
     */
    public ParseException expected(String expected, Optional<Token> found) {
        ParseError error = found.isPresent()
                           ? new ParseError.UnexpectedToken(found.get().span(), expected, found.get().kind().description())
                           : new ParseError.UnexpectedEof(endOfInput(), expected);
        return new ParseException(error);
    }

    /**
     * Empty span at the very end of the input.
     */
    public SourceSpan endOfInput() {
        int endLine = line;
        int endColumn = column;
        for (int i = pos; i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                endLine++;
                endColumn = 1;
            } else {
                endColumn++;
            }
        }
        return SourceSpan.at(SourceLocation.at(endLine, endColumn, input.length()));
    }

    private Optional<Token> scanBlockComment(SourceLocation start) {
        advance(2);
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw new ParseException(new ParseError.UnterminatedComment(span(start)));
            }
            if (lookingAt("/*")) {
                advance(2);
                depth++;
            } else if (lookingAt("*/")) {
                advance(2);
                depth--;
            } else {
                advance();
            }
        }
        return token(start, TokenKind.COMMENT);
    }

    private Optional<Token> scanStringLiteral(SourceLocation start) {
        advance();
        // skip opening quote
        while (true) {
            if (isAtEnd()) {
                throw new ParseException(new ParseError.UnterminatedString(span(start)));
            }
            char c = peekChar();
            if (c == '"') {
                advance();
                return token(start, TokenKind.STR_LIT);
            }
            if (c == '\\') {
                scanEscapeSequence(start);
            } else {
                advance();
            }
        }
    }

    private void scanEscapeSequence(SourceLocation literalStart) {
        var escapeStart = location();
        advance();
        // skip backslash
        if (isAtEnd()) {
            throw new ParseException(new ParseError.UnterminatedString(span(literalStart)));
        }
        char c = peekChar();
        if (SIMPLE_ESCAPES.containsKey(c)) {
            advance();
            return;
        }
        if (c != 'u') {
            advance(Character.charCount(input.codePointAt(pos)));
            throw invalidEscape(escapeStart);
        }
        advance();
        if (isAtEnd() || peekChar() != '{') {
            throw invalidEscape(escapeStart);
        }
        advance();
        int digits = 0;
        while (!isAtEnd() && isHexDigit(peekChar())) {
            advance();
            digits++;
        }
        if (isAtEnd()) {
            throw new ParseException(new ParseError.UnterminatedString(span(literalStart)));
        }
        if (digits > MAX_UNICODE_ESCAPE_DIGITS) {
            if (peekChar() == '}') {
                advance();
            }
            throw invalidEscape(escapeStart);
        }
        if (digits == 0) {
            throw invalidEscape(escapeStart);
        }
        if (peekChar() != '}') {
            throw invalidEscape(escapeStart);
        }
        int codePoint = Integer.parseInt(input.substring(escapeStart.offset() + 3, pos), 16);
        advance();
        // skip closing brace
        if (!Character.isValidCodePoint(codePoint)
            || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            throw invalidEscape(escapeStart);
        }
    }

    private ParseException invalidEscape(SourceLocation escapeStart) {
        var span = span(escapeStart);
        return new ParseException(new ParseError.InvalidEscape(span, slice(span)));
    }

    private Optional<Token> scanIdentifier(SourceLocation start) {
        while (!isAtEnd()) {
            int c = input.codePointAt(pos);
            if (!isIdentifierPart(c)) {
                break;
            }
            advance(Character.charCount(c));
        }
        var span = span(start);
        var kind = TokenKind.keyword(slice(span))
                            .orElse(TokenKind.ID);
        return Optional.of(new Token(span, kind));
    }

    private Optional<Token> token(SourceLocation start, TokenKind kind) {
        return Optional.of(new Token(span(start), kind));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peekChar() {
        return input.charAt(pos);
    }

    private boolean lookingAt(String prefix) {
        return input.startsWith(prefix, pos);
    }

    private void advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location());
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isIdentifierStart(int c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(int c) {
        return c == '-' || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
