package org.dxworks.declframe.model;

import java.util.ArrayList;
import java.util.List;

public class DeclarationFileAnalysis implements Analysis {
    public String filePath;
    public String language;
    public List<Declaration> declarations = new ArrayList<>();
    public List<ScopeRecord> scopes; // nullable, only filled when scopes are requested

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
