package org.dxworks.declframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.declframe.analyzer.LanguageAnalyzer;
import org.dxworks.declframe.model.Analysis;
import org.dxworks.declframe.model.DeclarationFileAnalysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar declframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to source code directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported languages: C, C++");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        DeclframeConfig config = DeclframeConfig.load();

        System.out.println("Starting declaration analysis...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("Excluding: " + config.getExcludedDirectories());

        RunSummary summary = run(input, jsonlOutput, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + summary.filesAnalyzed + " files");
        System.out.println("Declarations found: " + summary.declarationsFound);
        if (summary.filesWithErrors > 0) {
            System.out.println("Errors: " + summary.filesWithErrors);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Analyzes every C-family file under {@code input} and writes one JSONL record per file,
     * framed by a {@code run} header and a {@code done} trailer. A file that cannot be read
     * produces an {@code error} record; the run carries on.
     */
    public static RunSummary run(Path input, Path jsonlOutput, DeclframeConfig config) throws IOException {
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        Map<Language, LanguageAnalyzer> analyzers = LanguageRegistry.buildAnalyzers(config);
        List<Path> files = collectSourceFiles(input, config);
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger declarationCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Each file gets its own lexer and extractor, so workers share nothing but the writer
            files.parallelStream().forEach(file -> {
                Language language = LanguageRegistry.detectLanguage(file).orElseThrow();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing "
                            + language.getName() + ": " + file.getFileName());
                }

                try {
                    Analysis analysis = analyzeFile(file, language, analyzers);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                    if (analysis instanceof DeclarationFileAnalysis fileAnalysis) {
                        declarationCount.addAndGet(fileAnalysis.declarations.size());
                    }
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("language", language.getName());
                    error.put("error", String.valueOf(e.getMessage()));

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("declarations_found", declarationCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        return new RunSummary(successCount.get(), errorCount.get(), declarationCount.get());
    }

    static List<Path> collectSourceFiles(Path input, DeclframeConfig config) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> LanguageRegistry.detectLanguage(p).isPresent())
                      .filter(p -> !LanguageRegistry.isInExcludedDirectory(input, p, config))
                      .filter(p -> withinMaxLines(p, config.getMaxFileLines()))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (LanguageRegistry.detectLanguage(input).isPresent()
                    && withinMaxLines(input, config.getMaxFileLines())) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        // any byte sequence decodes as ISO-8859-1
        try (Stream<String> lines = Files.lines(path, StandardCharsets.ISO_8859_1)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException e) {
            return true;
        }
    }

    public static Analysis analyzeFile(Path filePath, Language language) throws IOException {
        return analyzeFile(filePath, language, LanguageRegistry.buildAnalyzers(DeclframeConfig.defaults()));
    }

    public static Analysis analyzeFile(Path filePath, Language language, Map<Language, LanguageAnalyzer> analyzers)
            throws IOException {
        LanguageAnalyzer analyzer = analyzers.get(language);
        if (analyzer == null) {
            throw new IllegalArgumentException("No analyzer available for: " + language);
        }
        return analyzer.analyze(filePath.toString(), readSource(filePath));
    }

    /**
     * Reads a file as UTF-8, retrying as ISO-8859-1 when the bytes are not valid UTF-8.
     * A leading byte order mark is dropped.
     */
    public static String readSource(Path filePath) throws IOException {
        String sourceCode;
        try {
            sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            sourceCode = Files.readString(filePath, StandardCharsets.ISO_8859_1);
        }

        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }
        return sourceCode;
    }

    public static final class RunSummary {
        public final int filesAnalyzed;
        public final int filesWithErrors;
        public final int declarationsFound;

        RunSummary(int filesAnalyzed, int filesWithErrors, int declarationsFound) {
            this.filesAnalyzed = filesAnalyzed;
            this.filesWithErrors = filesWithErrors;
            this.declarationsFound = declarationsFound;
        }
    }
}
