package org.dxworks.declframe;

import org.dxworks.declframe.analyzer.LanguageAnalyzer;
import org.dxworks.declframe.analyzer.cpp.CppAnalyzer;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public class LanguageRegistry {

    public static Optional<Language> detectLanguage(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String lowerCaseName = fileName.toString().toLowerCase();
        for (Language lang : Language.values()) {
            if (lang.matchesFileName(lowerCaseName)) {
                return Optional.of(lang);
            }
        }
        return Optional.empty();
    }

    /**
     * True when any directory between {@code root} and {@code file} is hidden (starts with a dot)
     * or named in the configured exclusions.
     */
    public static boolean isInExcludedDirectory(Path root, Path file, DeclframeConfig config) {
        Path relative = root.equals(file) ? file.getFileName() : root.relativize(file);
        if (relative == null) {
            return false;
        }
        int directoryCount = relative.getNameCount() - 1;
        for (int i = 0; i < directoryCount; i++) {
            String directory = relative.getName(i).toString();
            if (directory.equals(".") || directory.equals("..")) {
                continue;
            }
            if (directory.startsWith(".") || config.isExcludedDirectory(directory)) {
                return true;
            }
        }
        return false;
    }

    public static Map<Language, LanguageAnalyzer> buildAnalyzers(DeclframeConfig config) {
        Map<Language, LanguageAnalyzer> analyzers = new EnumMap<>(Language.class);
        for (Language lang : Language.values()) {
            analyzers.put(lang, createAnalyzer(lang, config));
        }
        return Collections.unmodifiableMap(analyzers);
    }

    private static LanguageAnalyzer createAnalyzer(Language lang, DeclframeConfig config) {
        return switch (lang) {
            case C, CPP -> new CppAnalyzer(lang.getName(), config.isIncludeScopes());
        };
    }
}
