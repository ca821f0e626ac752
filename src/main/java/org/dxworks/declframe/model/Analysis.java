package org.dxworks.declframe.model;

/**
 * One JSONL record describing a single analyzed source file. C and C++ files both produce a
 * {@link DeclarationFileAnalysis}; the language name tells which dialect the file was read as.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
