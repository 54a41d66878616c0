package org.pragmatica.profile.tree;

/**
 * A name referenced by a declaration, written either as a bare identifier or as a
 * quoted string.
 */
public sealed interface Identifier {
    SourceSpan span();

    String name();

    /**
     * Bare identifier: the name is the source text under the span.
     */
    record Bare(SourceSpan span, String name) implements Identifier {}

    /**
     * String literal: the name is the literal with quotes removed and escapes resolved.
     */
    record Quoted(SourceSpan span, String name) implements Identifier {}
}
