package org.pragmatica.profile.error;

import org.pragmatica.profile.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a parse failure against its source text.
 *
 * <p>Example output:
 * <pre>
 * error: expected a string literal, found an identifier
 *   --> world.profile:3:11
 *    |
 *  3 | implement foo with "comp"
 *    |           ^^^
 *    |
 *    = help: both operands of `implement` must be quoted
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(String message, SourceSpan span, List<String> notes) {

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending source lines underlined.
     *
     * @param source   The source text the span points into
     * @param filename Optional filename for display, may be {@code null}
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = stripCarriageReturn(lines[lineNum - 1]);
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);

            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ");
            sb.append(underline(lineNum, lineContent));
            sb.append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Single-line format: {@code file:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error: %s",
                             filename == null ? "input" : filename, loc.line(), loc.column(), message);
    }

    private String underline(int lineNum, String lineContent) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 1;
        int endCol = span.end().line() == lineNum
                     ? span.end().column()
                     : lineContent.length() + 1;

        return " ".repeat(startCol - 1) + "^".repeat(Math.max(1, endCol - startCol));
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
