package org.pragmatica.profile.lexer;

import org.pragmatica.profile.tree.SourceSpan;

/**
 * A token is just its kind and where it sits; text is recovered from the source.
 */
public record Token(SourceSpan span, TokenKind kind) {

    public boolean is(TokenKind other) {
        return kind == other;
    }
}
