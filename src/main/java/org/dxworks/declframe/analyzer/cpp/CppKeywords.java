package org.dxworks.declframe.analyzer.cpp;

import java.util.Set;

/**
 * The closed set of words the lexer classifies as keywords, fixed-width unsigned typedefs included.
 */
public final class CppKeywords {

    public static final Set<String> KEYWORDS = Set.of(
            // types
            "int", "float", "double", "char", "void", "bool", "auto",
            "uint8_t", "uint16_t", "uint32_t", "uint64_t",
            // storage and qualifiers
            "const", "static", "unsigned", "signed",
            // class-like
            "class", "struct", "enum", "namespace", "template",
            // control flow
            "if", "else", "for", "while", "switch", "case", "return", "break",
            // access and inheritance
            "public", "private", "protected", "virtual", "override"
    );

    /** Modifiers consumed in front of a declaration's base type. */
    public static final Set<String> DECLARATION_MODIFIERS = Set.of("static", "const", "unsigned", "signed");

    private CppKeywords() {}

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }
}
