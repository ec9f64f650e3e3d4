package org.gathermine.table.parser;

import org.gathermine.table.lexer.Token;
import org.gathermine.table.lexer.TokenType;

/**
 * A number, string or name literal.
 *
 * @param token The token the literal was read from.
 */
public record ScalarNode(Token token) implements ValueNode {

    @Override
    public int line() {
        return token.line();
    }

    /**
     * @return {@code true} if the literal is a number token
     */
    public boolean isNumber() {
        return token.type() == TokenType.NUMBER;
    }

    /**
     * @return the string content for string literals, otherwise the source text
     */
    public String text() {
        return token.type() == TokenType.STRING ? token.value() : token.text();
    }
}
