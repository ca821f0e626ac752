package org.dxworks.declframe.analyzer.cpp;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits C-family source text into identifier, keyword, literal and operator tokens.
 * <p>
 * The lexer never fails: characters it cannot classify are dropped, and unterminated string
 * literals or block comments simply run to the end of the input. Operators are always single
 * characters, so {@code <<} comes out as two {@code <} tokens.
 */
public final class CppLexer {

    private static final String OPERATORS = "{}[]()=<>!+-*/%&|^~?:.,;";

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private int startPos;
    private int startLine;
    private int startColumn;

    private CppLexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    public static List<Token> tokenize(String source) {
        if (source == null || source.isEmpty()) {
            return new ArrayList<>();
        }
        return new CppLexer(source).scanTokens();
    }

    private List<Token> scanTokens() {
        while (!isAtEnd()) {
            startPos = pos;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = peek();

        if (Character.isWhitespace(c)) {
            advance();
            return;
        }
        if (isIdentifierStart(c)) {
            scanWord();
            return;
        }
        if (isDigit(c)) {
            scanNumber();
            return;
        }
        if (c == '"' || c == '\'') {
            scanQuoted(c);
            return;
        }
        if (c == '/' && peekNext() == '/') {
            skipLineComment();
            return;
        }
        if (c == '/' && peekNext() == '*') {
            skipBlockComment();
            return;
        }
        if (OPERATORS.indexOf(c) >= 0) {
            advance();
            addToken(TokenKind.OPERATOR);
            return;
        }

        // Unclassifiable (preprocessor '#', '@', '$', stray backslashes, non-ASCII...)
        advance();
    }

    private void scanWord() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(startPos, pos);
        addToken(CppKeywords.isKeyword(text) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER);
    }

    /**
     * Hex prefixes, suffixes, exponents and even malformed runs like {@code 1.2.3abc} all end
     * up in one literal; the text is never evaluated.
     */
    private void scanNumber() {
        while (!isAtEnd() && (isAsciiLetterOrDigit(peek()) || peek() == '.')) {
            advance();
        }
        addToken(TokenKind.LITERAL);
    }

    private void scanQuoted(char quote) {
        advance(); // opening quote
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                if (!isAtEnd()) {
                    advance();
                }
                continue;
            }
            if (c == quote) {
                break;
            }
        }
        addToken(TokenKind.LITERAL);
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void skipBlockComment() {
        advance();
        advance();
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
    }

    private void addToken(TokenKind kind) {
        tokens.add(new Token(kind, source.substring(startPos, pos), startLine, startColumn, startPos));
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < length ? source.charAt(pos + 1) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c);
    }
}
