package org.dxworks.declframe;

import java.util.List;

public enum Language {
    C("c", List.of(".c")),
    CPP("cpp", List.of(".cpp", ".cc", ".cxx", ".h", ".hpp", ".hh", ".hxx"));

    private final String name;
    private final List<String> extensions;

    Language(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String lowerCaseFileName) {
        for (String extension : extensions) {
            if (lowerCaseFileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
