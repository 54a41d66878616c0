package org.pragmatica.profile.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.profile.ProfileParser;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final String SOURCE = "provide foo\nimplement foo with \"comp\"\n";

    @Test
    void format_underlinesOffendingToken() {
        var error = ProfileParser.parse(SOURCE).error().orElseThrow();

        var expected = "error: expected a string literal, found an identifier\n"
                       + "  --> world.profile:2:11\n"
                       + "  |\n"
                       + "2 | implement foo with \"comp\"\n"
                       + "  | " + " ".repeat(10) + "^^^\n"
                       + "  |\n";
        assertEquals(expected, error.toDiagnostic().format(SOURCE, "world.profile"));
    }

    @Test
    void format_withHelp_appendsNote() {
        var diagnostic = ProfileParser.parse(SOURCE)
                                      .error()
                                      .orElseThrow()
                                      .toDiagnostic()
                                      .withHelp("both operands of `implement` must be quoted");

        var formatted = diagnostic.format(SOURCE, null);

        assertTrue(formatted.contains("  --> 2:11\n"));
        assertTrue(formatted.endsWith("  = help: both operands of `implement` must be quoted\n"));
    }

    @Test
    void format_endOfInput_pointsPastLastCharacter() {
        var source = "provide";
        var error = ProfileParser.parse(source).error().orElseThrow();

        var formatted = error.toDiagnostic().format(source, "p");

        assertTrue(formatted.contains("1 | provide\n  | " + " ".repeat(7) + "^\n"));
    }

    @Test
    void format_multiLineSpan_underlinesEachLine() {
        var source = "provide \"ab\ncd";
        var error = ProfileParser.parse(source).error().orElseThrow();

        var formatted = error.toDiagnostic().format(source, "p");

        assertInstanceOf(ParseError.UnterminatedString.class, error);
        assertTrue(formatted.contains("1 | provide \"ab\n  | " + " ".repeat(8) + "^^^\n"));
        assertTrue(formatted.contains("2 | cd\n  | ^^\n"));
    }

    @Test
    void formatSimple_singleLine() {
        var error = ProfileParser.parse(SOURCE).error().orElseThrow();

        assertEquals("world.profile:2:11: error: expected a string literal, found an identifier",
                     error.toDiagnostic().formatSimple("world.profile"));
        assertEquals("input:2:11: error: expected a string literal, found an identifier",
                     error.toDiagnostic().formatSimple(null));
    }
}
