package org.gathermine.table.parser;

import org.gathermine.diagnostics.Diagnostic;
import org.gathermine.diagnostics.DiagnosticsEngine;
import org.gathermine.table.lexer.TableLexer;
import org.gathermine.table.lexer.Token;
import org.gathermine.table.lexer.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for table documents. It consumes the tokens of a {@link TableLexer}
 * and produces one {@link Section} per top-level assignment.
 * <p>
 * Each section is parsed on its own. When a section is malformed the error is reported, the
 * section is kept without a value, and parsing resumes at the next assignment found at brace
 * depth zero, so broken content never hides the sections around it.
 *
 * <pre>
 * document := { section }
 * section  := NAME '=' value
 * value    := table | NUMBER | STRING | NAME
 * table    := '{' [ field { sep field } [ sep ] ] '}'
 * field    := '[' value ']' '=' value | NAME '=' value | value
 * sep      := ',' | ';'
 * </pre>
 */
public class TableParser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private int depth = 0;
    private String sectionName = "<document>";

    /**
     * Constructs a new parser.
     * @param tokens The tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public TableParser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Tokenizes and parses a document.
     * <p>
     * Lexical errors are reported under the section whose source lines contain them, or under
     * {@code <document>} when they lie outside every section.
     *
     * @param source the document text
     * @param diagnostics the engine for reporting errors and warnings
     * @return the sections by name in source order; a repeated name keeps the last assignment
     */
    public static Map<String, Section> parseDocument(String source, DiagnosticsEngine diagnostics) {
        DiagnosticsEngine lexing = new DiagnosticsEngine();
        List<Token> tokens = new TableLexer(source, lexing).scanTokens();
        DiagnosticsEngine parsing = new DiagnosticsEngine();
        List<Section> parsed = new TableParser(tokens, parsing).parse();

        for (Diagnostic diagnostic : lexing.getDiagnostics()) {
            report(diagnostics, diagnostic, enclosingSection(parsed, source, diagnostic.lineNumber(), diagnostic.section()));
        }
        for (Diagnostic diagnostic : parsing.getDiagnostics()) {
            report(diagnostics, diagnostic, diagnostic.section());
        }

        Map<String, Section> sections = new LinkedHashMap<>();
        for (Section section : parsed) {
            sections.remove(section.name());
            sections.put(section.name(), section);
        }
        return sections;
    }

    private static String enclosingSection(List<Section> sections, String source, int line, String fallback) {
        for (Section section : sections) {
            if (line >= section.line() && line <= section.endLine(source)) {
                return section.name();
            }
        }
        return fallback;
    }

    private static void report(DiagnosticsEngine diagnostics, Diagnostic diagnostic, String section) {
        if (diagnostic.type() == Diagnostic.Type.ERROR) {
            diagnostics.reportError(diagnostic.message(), section, diagnostic.lineNumber());
        } else {
            diagnostics.reportWarning(diagnostic.message(), section, diagnostic.lineNumber());
        }
    }

    /**
     * Parses the entire token stream.
     * @return the top-level sections in source order
     */
    public List<Section> parse() {
        List<Section> sections = new ArrayList<>();
        while (!isAtEnd()) {
            Section section = section();
            if (section != null) {
                sections.add(section);
            }
        }
        return sections;
    }

    private Section section() {
        Token name = peek();
        if (name.type() != TokenType.IDENTIFIER || !checkNext(TokenType.EQUALS)) {
            diagnostics.reportError("Expected a top-level assignment, but got '" + name.text() + "'.", sectionName, name.line());
            advance();
            synchronize();
            return null;
        }
        sectionName = name.text();
        advance();
        advance();
        depth = 0;
        try {
            ValueNode value = value();
            return new Section(name.text(), value, name.line(), name.start(), previous().end());
        } catch (ParseError e) {
            synchronize();
            return new Section(name.text(), null, name.line(), name.start(), previous().end());
        } finally {
            sectionName = "<document>";
        }
    }

    private ValueNode value() {
        if (check(TokenType.LEFT_BRACE)) {
            return table();
        }
        if (match(TokenType.NUMBER, TokenType.STRING, TokenType.IDENTIFIER)) {
            return new ScalarNode(previous());
        }
        throw error(peek(), "Expected a value");
    }

    private TableNode table() {
        Token open = consume(TokenType.LEFT_BRACE, "Expected '{'");
        depth++;
        List<FieldNode> fields = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            fields.add(field());
            if (!match(TokenType.COMMA, TokenType.SEMICOLON)) {
                break;
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close the table opened on line " + open.line());
        depth--;
        return new TableNode(fields, open.line());
    }

    private FieldNode field() {
        Token first = peek();
        if (match(TokenType.LEFT_BRACKET)) {
            ValueNode key = value();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after key");
            consume(TokenType.EQUALS, "Expected '=' after key");
            return new FieldNode(key, value(), first.line());
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
            ScalarNode key = new ScalarNode(advance());
            advance();
            return new FieldNode(key, value(), first.line());
        }
        return new FieldNode(null, value(), first.line());
    }

    /**
     * Skips tokens until the next assignment at brace depth zero.
     */
    private void synchronize() {
        while (!isAtEnd()) {
            if (depth <= 0 && check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
                return;
            }
            Token token = advance();
            if (token.type() == TokenType.LEFT_BRACE) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_BRACE) {
                depth = Math.max(0, depth - 1);
            }
        }
    }

    private ParseError error(Token token, String message) {
        String found = token.type() == TokenType.END_OF_FILE ? "end of file" : "'" + token.text() + "'";
        diagnostics.reportError(message + ", but got " + found + ".", sectionName, token.line());
        return new ParseError();
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
