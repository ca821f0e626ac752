package org.dxworks.declframe.analyzer;

import org.dxworks.declframe.model.Analysis;

public interface LanguageAnalyzer {
    Analysis analyze(String filePath, String sourceCode);
}
