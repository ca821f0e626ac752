package org.dxworks.declframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class DeclframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "declframe-config.yml";
    private static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of("third-party", "vendor", "build", "scripts");
    private static final boolean DEFAULT_INCLUDE_SCOPES = false;

    private final int maxFileLines;
    private final Set<String> excludedDirectories;
    private final boolean includeScopes;

    private DeclframeConfig(int maxFileLines, Set<String> excludedDirectories, boolean includeScopes) {
        this.maxFileLines = maxFileLines;
        this.excludedDirectories = Collections.unmodifiableSet(excludedDirectories);
        this.includeScopes = includeScopes;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public Set<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public boolean isExcludedDirectory(String directoryName) {
        return excludedDirectories.contains(directoryName);
    }

    /**
     * Whether each file record also carries the nested scope tree, not just the flat list.
     */
    public boolean isIncludeScopes() {
        return includeScopes;
    }

    public static DeclframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static DeclframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                List<String> effectiveExcludes = yamlConfig.excludedDirectories != null
                        ? yamlConfig.excludedDirectories
                        : DEFAULT_EXCLUDED_DIRECTORIES;
                boolean effectiveIncludeScopes = yamlConfig.includeScopes != null
                        ? yamlConfig.includeScopes
                        : DEFAULT_INCLUDE_SCOPES;

                return new DeclframeConfig(effectiveMaxFileLines, normalize(effectiveExcludes), effectiveIncludeScopes);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static DeclframeConfig defaults() {
        return new DeclframeConfig(DEFAULT_MAX_FILE_LINES, normalize(DEFAULT_EXCLUDED_DIRECTORIES), DEFAULT_INCLUDE_SCOPES);
    }

    public static DeclframeConfig with(int maxFileLines, List<String> excludedDirectories, boolean includeScopes) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new DeclframeConfig(effectiveMaxFileLines, normalize(excludedDirectories), includeScopes);
    }

    private static Set<String> normalize(List<String> directories) {
        Set<String> result = new LinkedHashSet<>();
        if (directories == null) {
            return result;
        }
        for (String directory : directories) {
            if (directory != null && !directory.isBlank()) {
                result.add(directory.trim());
            }
        }
        return result;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<String> excludedDirectories;
        public Boolean includeScopes;
    }
}
