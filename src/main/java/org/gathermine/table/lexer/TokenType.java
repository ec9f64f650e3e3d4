package org.gathermine.table.lexer;

/**
 * Defines the different types of tokens that the {@link TableLexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '{' character, opening a table constructor. */
    LEFT_BRACE,
    /** The '}' character, closing a table constructor. */
    RIGHT_BRACE,
    /** The '[' character, opening a bracketed key. */
    LEFT_BRACKET,
    /** The ']' character, closing a bracketed key. */
    RIGHT_BRACKET,
    /** The '=' character. */
    EQUALS,
    /** The ',' field separator. */
    COMMA,
    /** The ';' field separator. */
    SEMICOLON,

    // Literals.
    /** A name such as a table name, {@code true}, {@code false} or {@code nil}. */
    IDENTIFIER,
    /** A numeric literal, possibly negative or fractional. */
    NUMBER,
    /** A quoted string literal. */
    STRING,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE,
    /** Represents an unexpected or unknown character. */
    UNEXPECTED
}
