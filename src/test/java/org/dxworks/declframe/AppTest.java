package org.dxworks.declframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.declframe.model.DeclarationFileAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void runWritesFramedJsonlForEveryAcceptedFile() throws IOException {
        write("src/engine.cpp", "int speed = 3;\nstatic const int kMax = 8;\n");
        Files.write(tempDir.resolve("src/util.c"),
                "/* Café */ int counter = 3;\n".getBytes(StandardCharsets.ISO_8859_1));
        write("src/big.h", "int line;\n".repeat(20));
        write("vendor/lib.c", "int hidden = 1;\n");
        write(".cache/tmp.h", "int cached = 1;\n");
        write("README.md", "int notCode = 1;\n");

        Path output = tempDir.resolve("out/result.jsonl");
        DeclframeConfig config = DeclframeConfig.with(10, List.of("vendor"), false);

        App.RunSummary summary = App.run(tempDir, output, config);

        assertEquals(2, summary.filesAnalyzed);
        assertEquals(0, summary.filesWithErrors);
        assertEquals(3, summary.declarationsFound);

        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            records.add(MAPPER.readTree(line));
        }
        assertEquals(4, records.size());

        JsonNode header = records.get(0);
        assertEquals("run", header.get("kind").asText());
        assertEquals(2, header.get("total_files").asInt());

        JsonNode trailer = records.get(3);
        assertEquals("done", trailer.get("kind").asText());
        assertEquals(2, trailer.get("files_analyzed").asInt());
        assertEquals(0, trailer.get("files_with_errors").asInt());
        assertEquals(3, trailer.get("declarations_found").asInt());

        List<String> names = new ArrayList<>();
        for (JsonNode record : records.subList(1, 3)) {
            assertFalse(record.has("scopes"));
            record.get("declarations").forEach(d -> names.add(d.get("name").asText()));
        }
        names.sort(null);
        assertEquals(List.of("counter", "kMax", "speed"), names);
    }

    @Test
    void runIncludesScopeTreeWhenConfigured() throws IOException {
        write("main.c", "int g;\nvoid f() {\n  int local = 1;\n}\n");
        Path output = tempDir.resolve("result.jsonl");

        App.run(tempDir.resolve("main.c"), output, DeclframeConfig.with(0, List.of(), true));

        JsonNode record = MAPPER.readTree(Files.readAllLines(output, StandardCharsets.UTF_8).get(1));
        assertEquals("c", record.get("language").asText());
        JsonNode scopes = record.get("scopes");
        assertEquals(2, scopes.size());

        JsonNode global = scopes.get(0);
        assertEquals("GLOBAL", global.get("kind").asText());
        assertFalse(global.has("parentId"));
        assertEquals("g", global.get("declarations").get(0).get("name").asText());

        JsonNode body = scopes.get(1);
        assertEquals(0, body.get("parentId").asInt());
        assertEquals(1, body.get("depth").asInt());
        assertEquals(2, body.get("startLine").asInt());
        assertEquals(4, body.get("endLine").asInt());
        assertEquals("local", body.get("declarations").get(0).get("name").asText());
    }

    @Test
    void deeplyNestedScopesAreWrittenWithoutError() throws IOException {
        int depth = 5_000;
        write("deep.c", "{".repeat(depth) + "\nint deep = 1;\n" + "}".repeat(depth) + "\nint after = 2;\n");
        Path output = tempDir.resolve("result.jsonl");

        App.RunSummary summary = App.run(tempDir.resolve("deep.c"), output, DeclframeConfig.with(0, List.of(), true));

        assertEquals(1, summary.filesAnalyzed);
        assertEquals(0, summary.filesWithErrors);
        assertEquals(2, summary.declarationsFound);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        JsonNode record = MAPPER.readTree(lines.get(1));
        assertFalse(record.has("kind"));
        assertEquals(2, record.get("declarations").size());

        JsonNode scopes = record.get("scopes");
        assertEquals(depth + 1, scopes.size());
        JsonNode innermost = scopes.get(depth);
        assertEquals(depth, innermost.get("depth").asInt());
        assertEquals(depth - 1, innermost.get("parentId").asInt());
        assertEquals("deep", innermost.get("declarations").get(0).get("name").asText());
        assertEquals("after", scopes.get(0).get("declarations").get(0).get("name").asText());
    }

    @Test
    void collectSkipsUnsupportedSingleFile() throws IOException {
        Path notes = write("notes.txt", "int x = 1;\n");

        assertTrue(App.collectSourceFiles(notes, DeclframeConfig.defaults()).isEmpty());
    }

    @Test
    void collectReturnsSortedSourceFiles() throws IOException {
        write("b/second.hpp", "int b;\n");
        write("a/first.cc", "int a;\n");

        List<String> collected = App.collectSourceFiles(tempDir, DeclframeConfig.defaults()).stream()
                .map(p -> tempDir.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toList());

        assertEquals(List.of("a/first.cc", "b/second.hpp"), collected);
    }

    @Test
    void readSourceFallsBackToLatin1() throws IOException {
        Path file = Paths.get("src/test/resources/samples/cpp/Latin1.c");

        String source = App.readSource(file);

        assertTrue(source.contains("Café"));
        DeclarationFileAnalysis analysis = (DeclarationFileAnalysis) App.analyzeFile(file, Language.C);
        assertEquals("c", analysis.getLanguage());
        assertEquals(1, analysis.declarations.size());
        assertEquals("counter", analysis.declarations.get(0).name);
        assertEquals(2, analysis.declarations.get(0).line);
    }

    @Test
    void readSourceDropsByteOrderMark() throws IOException {
        Path file = write("bom.cpp", "\uFEFFint x = 1;");

        assertEquals("int x = 1;", App.readSource(file));
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
