package org.dxworks.declframe.analyzer.cpp;

/**
 * A classified slice of C-family source text. Whitespace and comments never become tokens.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int line;   // 1-based
    private final int column; // 1-based
    private final int offset; // index of the first character in the source

    public Token(TokenKind kind, String text, int line, int column, int offset) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return offset + text.length();
    }

    public boolean isOperator(String symbol) {
        return kind == TokenKind.OPERATOR && text.equals(symbol);
    }

    public boolean isWord() {
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.KEYWORD;
    }

    @Override
    public String toString() {
        return kind + " '" + text + "' (" + line + ":" + column + ")";
    }
}
