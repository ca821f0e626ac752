package org.dxworks.declframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A lexical region delimited by braces. The global scope is implicit and has no braces.
 * Holds only the declarations found directly inside it; nested blocks are in {@link #children}.
 */
public class Scope {
    public ScopeKind kind;
    public int startLine;
    public int endLine; // 0 while the closing brace has not been seen
    public List<Declaration> declarations = new ArrayList<>();
    public List<Scope> children = new ArrayList<>();

    public static Scope global() {
        Scope scope = new Scope();
        scope.kind = ScopeKind.GLOBAL;
        scope.startLine = 1;
        return scope;
    }

    public static Scope block(int startLine) {
        Scope scope = new Scope();
        scope.kind = ScopeKind.BLOCK;
        scope.startLine = startLine;
        return scope;
    }
}
