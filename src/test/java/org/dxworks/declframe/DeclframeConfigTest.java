package org.dxworks.declframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeclframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        DeclframeConfig config = DeclframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Set.of("third-party", "vendor", "build", "scripts"), config.getExcludedDirectories());
        assertFalse(config.isIncludeScopes());
    }

    @Test
    void readsAllKeys() throws IOException {
        Path file = tempDir.resolve("declframe-config.yml");
        Files.writeString(file, "maxFileLines: 500\n"
                + "excludedDirectories:\n"
                + "  - generated\n"
                + "  - ' external '\n"
                + "includeScopes: true\n");

        DeclframeConfig config = DeclframeConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals(Set.of("generated", "external"), config.getExcludedDirectories());
        assertTrue(config.isExcludedDirectory("generated"));
        assertFalse(config.isExcludedDirectory("vendor"));
        assertTrue(config.isIncludeScopes());
    }

    @Test
    void partialFileKeepsDefaultsForMissingKeys() throws IOException {
        Path file = tempDir.resolve("declframe-config.yml");
        Files.writeString(file, "maxFileLines: -3\n");

        DeclframeConfig config = DeclframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.isExcludedDirectory("vendor"));
        assertFalse(config.isIncludeScopes());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("declframe-config.yml");
        Files.writeString(file, "maxFileLines: [not, a, number\n");

        DeclframeConfig config = DeclframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.isExcludedDirectory("build"));
    }

    @Test
    void programmaticConfigIgnoresBlankEntries() {
        DeclframeConfig config = DeclframeConfig.with(0, List.of("out", " ", ""), true);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Set.of("out"), config.getExcludedDirectories());
        assertTrue(config.isIncludeScopes());
    }
}
