package org.pragmatica.profile.tree;

import java.util.List;

/**
 * Comments immediately preceding a declaration, verbatim and in source order.
 */
public record Docs(List<String> comments) {
    public static final Docs EMPTY = new Docs(List.of());

    public Docs {
        comments = List.copyOf(comments);
    }

    public boolean isEmpty() {
        return comments.isEmpty();
    }
}
