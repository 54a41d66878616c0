package org.pragmatica.profile.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Token kinds of the profile language.
 */
public enum TokenKind {
    WHITESPACE("whitespace"),
    COMMENT("a comment"),
    ID("an identifier"),
    STR_LIT("a string literal"),
    EXTEND("keyword `extend`"),
    PROVIDE("keyword `provide`"),
    REQUIRE("keyword `require`"),
    IMPLEMENT("keyword `implement`"),
    WITH("keyword `with`");

    private static final Map<String, TokenKind> KEYWORDS = Map.of("extend", EXTEND,
                                                                  "provide", PROVIDE,
                                                                  "require", REQUIRE,
                                                                  "implement", IMPLEMENT,
                                                                  "with", WITH);

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /**
     * Description used in "expected ..., found ..." messages.
     */
    public String description() {
        return description;
    }

    /**
     * Whitespace and comments: skipped by syntax-level parsing.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }

    public static Optional<TokenKind> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }
}
