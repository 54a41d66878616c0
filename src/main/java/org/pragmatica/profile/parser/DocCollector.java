package org.pragmatica.profile.parser;

import org.pragmatica.profile.lexer.TokenKind;
import org.pragmatica.profile.lexer.Tokenizer;
import org.pragmatica.profile.tree.Docs;

import java.util.ArrayList;

/**
 * Gathers the comments in front of the next declaration.
 */
final class DocCollector {
    private DocCollector() {}

    /**
     * Consume the run of comments (and whitespace between them) ahead of the cursor.
     * The cursor is left right after the last comment, so the first token that is
     * neither whitespace nor a comment is still unread. Blank lines do not end the run.
     *
     * @param record whether to keep the comment texts or only skip them
     */
    static Docs collect(Tokenizer tokens, boolean record) {
        var comments = new ArrayList<String>();
        var lookahead = tokens.fork();

        while (true) {
            var token = lookahead.nextRaw();
            if (token.isEmpty()) {
                break;
            }
            var kind = token.get().kind();
            if (kind == TokenKind.WHITESPACE) {
                continue;
            }
            if (kind != TokenKind.COMMENT) {
                break;
            }
            if (record) {
                comments.add(tokens.slice(token.get().span()));
            }
            tokens.syncTo(lookahead);
        }

        return comments.isEmpty() ? Docs.EMPTY : new Docs(comments);
    }
}
