package org.gathermine.table.lexer;

import org.gathermine.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the text of a SavedVariables style document into a sequence of tokens.
 * <p>
 * Only the subset of Lua that table dumps use is recognized: names, numbers, quoted strings,
 * table punctuation and {@code --} comments (line and {@code --[[ ]]} block form).
 */
public class TableLexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String sourceName;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    /**
     * Creates a new lexer.
     * @param source The document text.
     * @param diagnostics The engine for reporting errors.
     */
    public TableLexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<document>");
    }

    /**
     * Creates a new lexer with an explicit source name.
     * @param source The document text.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The name used in diagnostics, usually the file name.
     */
    public TableLexer(String source, DiagnosticsEngine diagnostics, String sourceName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
    }

    /**
     * Tokenizes the entire document.
     * @return the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '=': addToken(TokenType.EQUALS); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '[':
                if (peek() == '[' || peek() == '=') {
                    unexpected("Long bracket strings are not supported");
                } else {
                    addToken(TokenType.LEFT_BRACKET);
                }
                break;
            case '"', '\'':
                string(c);
                break;
            case '-':
                if (peek() == '-') {
                    comment();
                } else if (isDigit(peek()) || (peek() == '.' && isDigit(peekNext()))) {
                    number();
                } else {
                    unexpected("Unexpected character: " + c);
                }
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    unexpected("Unexpected character: " + c);
                }
                break;
        }
    }

    private void comment() {
        advance();
        if (peek() == '[' && peekNext() == '[') {
            int opened = line;
            while (!isAtEnd() && !(peek() == ']' && peekNext() == ']')) {
                if (advance() == '\n') line++;
            }
            if (isAtEnd()) {
                diagnostics.reportError("Unterminated block comment", sourceName, opened);
                return;
            }
            advance();
            advance();
            return;
        }
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        if (previous() == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
            if (peek() == '.') {
                advance();
                while (isDigit(peek())) advance();
            }
            if (peek() == 'e' || peek() == 'E') {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }
        addToken(TokenType.NUMBER);
    }

    private void string(char quote) {
        int opened = line;
        StringBuilder value = new StringBuilder();
        while (peek() != quote && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                diagnostics.reportError("Unterminated string", sourceName, opened);
                line++;
                addToken(TokenType.UNEXPECTED);
                return;
            }
            if (c == '\\' && !isAtEnd()) {
                value.append(escape(advance()));
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            diagnostics.reportError("Unterminated string", sourceName, opened);
            addToken(TokenType.UNEXPECTED);
            return;
        }

        // The closing quote
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private String escape(char c) {
        switch (c) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case '\n':
                line++;
                return "\n";
            default:
                if (isDigit(c)) {
                    int code = c - '0';
                    for (int i = 0; i < 2 && isDigit(peek()); i++) {
                        code = code * 10 + (advance() - '0');
                    }
                    return String.valueOf((char) code);
                }
                // \\ \" \' and everything Lua would reject are taken literally
                return String.valueOf(c);
        }
    }

    private void unexpected(String message) {
        diagnostics.reportError(message, sourceName, line);
        addToken(TokenType.UNEXPECTED);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, String value) {
        tokens.add(new Token(type, source.substring(start, current), value, line, start, current));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
