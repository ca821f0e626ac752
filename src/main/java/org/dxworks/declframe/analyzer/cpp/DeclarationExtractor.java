package org.dxworks.declframe.analyzer.cpp;

import org.dxworks.declframe.model.Declaration;
import org.dxworks.declframe.model.Scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.StringJoiner;

/**
 * Finds variable declarations in a token stream without a grammar.
 * <p>
 * Walks the tokens once, keeping a stack of brace-delimited scopes. At every identifier or
 * keyword it tries to match
 * {@code [modifiers] type [*|&]... name ['[' ... ']'] ['=' initializer] (';' | ',')}.
 * A failed attempt restores the saved cursor and leaves nothing behind, so anything the matcher
 * does not understand just yields fewer declarations.
 * <p>
 * An extractor is single-use and not thread-safe; create one per token list.
 */
public final class DeclarationExtractor {

    private final List<Token> tokens;
    private final int size;
    private final Scope globalScope = Scope.global();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final List<Declaration> declarations = new ArrayList<>();

    private int pos = 0;
    private boolean done = false;

    // No terminator (resp. no ']') exists at or after these indexes
    private int noTerminatorFrom;
    private int noClosingBracketFrom;
    // Attempts starting inside the modifier run that ends here are known to fail
    private int failedModifierRunEnd = -1;

    public DeclarationExtractor(List<Token> tokens) {
        this.tokens = tokens;
        this.size = tokens.size();
        this.noTerminatorFrom = size + 1;
        this.noClosingBracketFrom = size + 1;
        scopes.push(globalScope);
    }

    public static List<Declaration> extract(List<Token> tokens) {
        return new DeclarationExtractor(tokens).run();
    }

    /**
     * Same single pass as {@link #extract(List)}, returning the implicit global scope with every
     * nested block scope and the declarations each one holds directly.
     */
    public static Scope extractScopes(List<Token> tokens) {
        DeclarationExtractor extractor = new DeclarationExtractor(tokens);
        extractor.run();
        return extractor.getGlobalScope();
    }

    /**
     * @return all declarations in source order, across all scopes
     */
    public List<Declaration> run() {
        if (done) {
            return declarations;
        }
        while (pos < size) {
            Token token = tokens.get(pos);
            if (token.isOperator("{")) {
                enterScope(token);
            } else if (token.isOperator("}")) {
                exitScope(token);
            } else if (token.isWord()) {
                tryDeclaration();
            }
            pos++;
        }
        done = true;
        return declarations;
    }

    public Scope getGlobalScope() {
        return globalScope;
    }

    private void enterScope(Token brace) {
        Scope block = Scope.block(brace.getLine());
        scopes.peek().children.add(block);
        scopes.push(block);
    }

    private void exitScope(Token brace) {
        // A stray '}' never pops the global scope
        if (scopes.size() > 1) {
            scopes.pop().endLine = brace.getLine();
        }
    }

    /**
     * On success the cursor is left on the token before the terminator; on failure it is back
     * at the starting position. Either way the main loop's own advance follows.
     */
    private void tryDeclaration() {
        int start = pos;
        if (start < failedModifierRunEnd) {
            return;
        }

        boolean isStatic = false;
        boolean isConst = false;
        List<String> signedness = new ArrayList<>(1);

        while (pos < size && CppKeywords.DECLARATION_MODIFIERS.contains(current().getText())) {
            String modifier = current().getText();
            switch (modifier) {
                case "static" -> isStatic = true;
                case "const" -> isConst = true;
                default -> {
                    if (!signedness.contains(modifier)) {
                        signedness.add(modifier);
                    }
                }
            }
            pos++;
        }
        int typeIndex = pos;

        if (pos >= size || !isTypeToken(current())) {
            rejectAttempt(start, typeIndex);
            return;
        }
        StringBuilder type = new StringBuilder();
        for (String word : signedness) {
            type.append(word).append(' ');
        }
        type.append(current().getText());
        pos++;

        while (pos < size && (current().isOperator("*") || current().isOperator("&"))) {
            type.append(current().getText());
            pos++;
        }

        if (pos >= size || current().getKind() != TokenKind.IDENTIFIER) {
            rejectAttempt(start, typeIndex);
            return;
        }
        Token name = current();
        pos++;

        if (pos < size && current().isOperator("[") && skipArraySuffix()) {
            type.append("[]");
        }

        String initializer = "";
        if (pos < size && current().isOperator("=")) {
            pos++;
            initializer = captureInitializer();
        }

        if (pos >= size || !isTerminator(current())) {
            rejectAttempt(start, typeIndex);
            return;
        }

        Declaration declaration = new Declaration(
                name.getText(), type.toString(), initializer, name.getLine(), isStatic, isConst);
        scopes.peek().declarations.add(declaration);
        declarations.add(declaration);
        pos--;
    }

    /**
     * Rewinds to {@code start}. Everything after the modifiers is matched the same way whichever
     * modifiers were consumed, so a later attempt starting inside the same modifier run would
     * fail as well.
     */
    private void rejectAttempt(int start, int typeIndex) {
        pos = start;
        if (typeIndex > start + 1) {
            failedModifierRunEnd = Math.max(failedModifierRunEnd, typeIndex);
        }
    }

    /**
     * Moves past {@code [ ... ]} up to the first {@code ]}, without nesting. With no {@code ]}
     * ahead the cursor stays on the {@code [}.
     */
    private boolean skipArraySuffix() {
        for (int i = pos + 1; i < size; i++) {
            if (i >= noClosingBracketFrom) {
                break;
            }
            if (tokens.get(i).isOperator("]")) {
                pos = i + 1;
                return true;
            }
        }
        noClosingBracketFrom = Math.min(noClosingBracketFrom, pos + 1);
        return false;
    }

    private String captureInitializer() {
        int from = pos;
        StringJoiner value = new StringJoiner(" ");
        while (pos < size && !isTerminator(current())) {
            if (pos >= noTerminatorFrom) {
                pos = size;
                break;
            }
            value.add(current().getText());
            pos++;
        }
        if (pos >= size) {
            // ran off the end; the terminator check will reject this attempt
            noTerminatorFrom = Math.min(noTerminatorFrom, from);
        }
        return value.toString();
    }

    private Token current() {
        return tokens.get(pos);
    }

    private static boolean isTypeToken(Token token) {
        return token.isWord() || CppKeywords.isKeyword(token.getText());
    }

    private static boolean isTerminator(Token token) {
        return token.isOperator(";") || token.isOperator(",");
    }
}
