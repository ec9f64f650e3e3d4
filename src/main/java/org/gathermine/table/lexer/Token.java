package org.gathermine.table.lexer;

/**
 * Represents a single token extracted from a table document by the {@link TableLexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The processed value: the unescaped content of a string, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param start The offset of the first character in the source.
 * @param end The offset after the last character in the source.
 */
public record Token(
        TokenType type,
        String text,
        String value,
        int line,
        int start,
        int end
) {
}
