package org.pragmatica.profile.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed profile: its declarations in file order.
 */
public record Profile(List<Declaration> declarations) {

    public Profile {
        declarations = List.copyOf(declarations);
    }

    public boolean isEmpty() {
        return declarations.isEmpty();
    }

    public List<Declaration.Extend> extended() {
        return ofKind(Declaration.Extend.class);
    }

    public List<Declaration.Provide> provided() {
        return ofKind(Declaration.Provide.class);
    }

    public List<Declaration.Require> required() {
        return ofKind(Declaration.Require.class);
    }

    public List<Declaration.Implement> implementations() {
        return ofKind(Declaration.Implement.class);
    }

    private <T extends Declaration> List<T> ofKind(Class<T> kind) {
        return declarations.stream()
                           .filter(kind::isInstance)
                           .map(kind::cast)
                           .collect(Collectors.toUnmodifiableList());
    }
}
