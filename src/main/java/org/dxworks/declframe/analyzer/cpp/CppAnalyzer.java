package org.dxworks.declframe.analyzer.cpp;

import org.dxworks.declframe.analyzer.LanguageAnalyzer;
import org.dxworks.declframe.model.Analysis;
import org.dxworks.declframe.model.Declaration;
import org.dxworks.declframe.model.DeclarationFileAnalysis;
import org.dxworks.declframe.model.Scope;
import org.dxworks.declframe.model.ScopeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fuzzy declaration analysis for C and C++ files: {@link CppLexer} followed by
 * {@link DeclarationExtractor}. Works on fragments and broken code; never throws on bad input.
 */
public class CppAnalyzer implements LanguageAnalyzer {

    private final String languageName;
    private final boolean includeScopes;

    public CppAnalyzer(String languageName, boolean includeScopes) {
        this.languageName = languageName;
        this.includeScopes = includeScopes;
    }

    public static List<Declaration> analyzeCode(String sourceCode) {
        return DeclarationExtractor.extract(CppLexer.tokenize(sourceCode));
    }

    @Override
    public Analysis analyze(String filePath, String sourceCode) {
        DeclarationFileAnalysis analysis = new DeclarationFileAnalysis();
        analysis.filePath = filePath;
        analysis.language = languageName;

        DeclarationExtractor extractor = new DeclarationExtractor(CppLexer.tokenize(sourceCode));
        analysis.declarations = extractor.run();
        if (includeScopes) {
            analysis.scopes = flattenScopes(extractor.getGlobalScope());
        }
        return analysis;
    }

    /**
     * Pre-order walk of the scope tree, which is the order the opening braces were met.
     * Iterative, since nesting can run thousands of levels deep.
     */
    static List<ScopeRecord> flattenScopes(Scope globalScope) {
        List<ScopeRecord> records = new ArrayList<>();
        Deque<Scope> pending = new ArrayDeque<>();
        Deque<ScopeRecord> pendingParents = new ArrayDeque<>();
        pending.push(globalScope);

        while (!pending.isEmpty()) {
            Scope scope = pending.pop();
            ScopeRecord parent = scope == globalScope ? null : pendingParents.pop();

            ScopeRecord record = new ScopeRecord();
            record.id = records.size();
            record.parentId = parent == null ? null : parent.id;
            record.depth = parent == null ? 0 : parent.depth + 1;
            record.kind = scope.kind;
            record.startLine = scope.startLine;
            record.endLine = scope.endLine;
            record.declarations = scope.declarations;
            records.add(record);

            for (int i = scope.children.size() - 1; i >= 0; i--) {
                pending.push(scope.children.get(i));
                pendingParents.push(record);
            }
        }
        return records;
    }
}
