package org.pragmatica.profile.parser;

import org.pragmatica.profile.lexer.Tokenizer;
import org.pragmatica.profile.tree.Identifier;

final class IdentifierParser {
    static final String EXPECTED = "an identifier or string";

    private IdentifierParser() {}

    static Identifier parse(Tokenizer tokens) {
        var token = tokens.next();
        if (token.isPresent()) {
            var span = token.get().span();
            switch (token.get().kind()) {
                case ID:
                    return new Identifier.Bare(span, tokens.slice(span));
                case STR_LIT:
                    return new Identifier.Quoted(span, tokens.parseString(span));
                default:
                    break;
            }
        }
        throw tokens.expected(EXPECTED, token);
    }
}
