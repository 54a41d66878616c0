package org.pragmatica.profile.tree;

/**
 * Top-level profile declarations. Every span runs from the leading keyword to the
 * end of the last token the declaration consumed.
 */
public sealed interface Declaration {
    SourceSpan span();

    Docs docs();

    /**
     * {@code extend <profile>}. Extend statements carry no docs.
     */
    record Extend(SourceSpan span, Identifier profile) implements Declaration {
        @Override
        public Docs docs() {
            return Docs.EMPTY;
        }
    }

    /**
     * {@code provide <interface>}
     */
    record Provide(Docs docs, SourceSpan span, Identifier iface) implements Declaration {}

    /**
     * {@code require <interface>}
     */
    record Require(Docs docs, SourceSpan span, Identifier iface) implements Declaration {}

    /**
     * {@code implement "<interface>" with "<component>"}. Both operands are decoded
     * string literals.
     */
    record Implement(Docs docs, SourceSpan span, String iface, String component) implements Declaration {}
}
