package org.pragmatica.profile.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.profile.error.ParseError;
import org.pragmatica.profile.error.ParseException;
import org.pragmatica.profile.lexer.Tokenizer;
import org.pragmatica.profile.tree.Identifier;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierParserTest {

    @Test
    void parse_bareIdentifier_usesSourceText() {
        var tokens = Tokenizer.of("  wasi-clock");

        var id = IdentifierParser.parse(tokens);

        assertInstanceOf(Identifier.Bare.class, id);
        assertEquals("wasi-clock", id.name());
        assertEquals(2, id.span().start().offset());
        assertEquals(12, id.span().end().offset());
    }

    @Test
    void parse_stringLiteral_isDecoded() {
        var tokens = Tokenizer.of("\"wasi:clock\\tnow\"");

        var id = IdentifierParser.parse(tokens);

        assertInstanceOf(Identifier.Quoted.class, id);
        assertEquals("wasi:clock\tnow", id.name());
        assertEquals(17, id.span().length());
    }

    @Test
    void parse_keyword_rejected() {
        var tokens = Tokenizer.of("with");

        var error = assertThrows(ParseException.class, () -> IdentifierParser.parse(tokens)).error();

        assertEquals("expected an identifier or string, found keyword `with`", error.message());
        assertEquals(0, error.span().start().offset());
        assertEquals(4, error.span().end().offset());
    }

    @Test
    void parse_endOfInput_rejected() {
        var tokens = Tokenizer.of("   ");

        var error = assertThrows(ParseException.class, () -> IdentifierParser.parse(tokens)).error();

        assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals("expected an identifier or string, found end of input", error.message());
        assertEquals(3, error.span().start().offset());
    }
}
