package org.pragmatica.profile.parser;

import org.pragmatica.profile.lexer.TokenKind;
import org.pragmatica.profile.lexer.Tokenizer;
import org.pragmatica.profile.tree.Declaration;
import org.pragmatica.profile.tree.Docs;

/**
 * Parsers for the four declaration kinds, plus keyword dispatch between them.
 */
final class DeclarationParser {
    static final String EXPECTED_DECLARATION = "`extend`, `provide`, `require`, or `implement`";

    private DeclarationParser() {}

    /**
     * Parse the declaration introduced by the next keyword.
     */
    static Declaration parse(Tokenizer tokens, Docs docs) {
        var lookahead = tokens.peek();
        if (lookahead.isPresent()) {
            switch (lookahead.get().kind()) {
                case EXTEND:
                    return parseExtend(tokens);
                case PROVIDE:
                    return parseProvide(tokens, docs);
                case REQUIRE:
                    return parseRequire(tokens, docs);
                case IMPLEMENT:
                    return parseImplement(tokens, docs);
                default:
                    break;
            }
        }
        throw tokens.expected(EXPECTED_DECLARATION, lookahead);
    }

    static Declaration.Extend parseExtend(Tokenizer tokens) {
        var keyword = tokens.expect(TokenKind.EXTEND);
        var profile = IdentifierParser.parse(tokens);

        return new Declaration.Extend(keyword.through(profile.span()), profile);
    }

    static Declaration.Provide parseProvide(Tokenizer tokens, Docs docs) {
        var keyword = tokens.expect(TokenKind.PROVIDE);
        var iface = IdentifierParser.parse(tokens);

        return new Declaration.Provide(docs, keyword.through(iface.span()), iface);
    }

    static Declaration.Require parseRequire(Tokenizer tokens, Docs docs) {
        var keyword = tokens.expect(TokenKind.REQUIRE);
        var iface = IdentifierParser.parse(tokens);

        return new Declaration.Require(docs, keyword.through(iface.span()), iface);
    }

    /**
     * {@code implement "iface" with "component"}: unlike the other kinds, both operands
     * must be string literals.
     */
    static Declaration.Implement parseImplement(Tokenizer tokens, Docs docs) {
        var keyword = tokens.expect(TokenKind.IMPLEMENT);
        var iface = tokens.expect(TokenKind.STR_LIT);
        tokens.expect(TokenKind.WITH);
        var component = tokens.expect(TokenKind.STR_LIT);

        return new Declaration.Implement(docs,
                                         keyword.through(component),
                                         tokens.parseString(iface),
                                         tokens.parseString(component));
    }
}
