package org.dxworks.declframe.analyzer.cpp;

public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    LITERAL,
    OPERATOR
}
