package org.dxworks.adaframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.adaframe.ast.AnalysisContext;
import org.dxworks.adaframe.ast.AnalysisUnit;
import org.dxworks.adaframe.model.UnitDump;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> ADA_EXTENSIONS = Set.of(".ads", ".adb", ".ada");

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar adaframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to an Ada source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Recognized extensions: " + String.join(", ", ADA_EXTENSIONS));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting Ada analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        AdaframeConfig config = AdaframeConfig.load();
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        int successCount = 0;
        int errorCount = 0;

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            // Write metadata header
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            int current = 0;
            for (Path file : files) {
                current++;
                System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());

                String record;
                String failure;
                try {
                    UnitDump dump = analyzeFile(config, file);
                    failure = dump.parsed ? null : String.join("; ", dump.diagnostics);
                    record = failure == null ? MAPPER.writeValueAsString(dump) : null;
                } catch (Exception e) {
                    failure = e.getMessage() != null ? e.getMessage() : e.toString();
                    record = null;
                }

                if (failure == null) {
                    successCount++;
                } else {
                    Map<String, Object> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("language", "ada");
                    error.put("error", failure);
                    record = MAPPER.writeValueAsString(error);
                    errorCount++;
                    System.err.println("  Error analyzing " + file.getFileName() + ": " + failure);
                }
                writer.write(record);
                writer.newLine();
                writer.flush();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount);
            doneInfo.put("files_with_errors", errorCount);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount + " files");
        if (errorCount > 0) {
            System.out.println("Errors: " + errorCount);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Analyzes one file in a context of its own, so nothing of the unit is
     * retained once the dump has been built.
     */
    public static UnitDump analyzeFile(AdaframeConfig config, Path filePath) {
        try (AnalysisContext context = AnalysisContext.create(config.getCharset(), config.getTabStop())) {
            return analyzeFile(context, filePath);
        }
    }

    public static UnitDump analyzeFile(AnalysisContext context, Path filePath) {
        AnalysisUnit unit = context.getUnitFromFile(filePath);
        return UnitDumper.dump(unit);
    }

    static boolean isAdaSource(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && ADA_EXTENSIONS.contains(name.substring(dot));
    }

    private static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                files.addAll(stream.filter(Files::isRegularFile)
                        .filter(App::isAdaSource)
                        .filter(p -> withinMaxLines(p, maxFileLines))
                        .sorted()
                        .collect(Collectors.toList()));
            }
        } else if (Files.isRegularFile(input)) {
            if (isAdaSource(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.ISO_8859_1)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException e) {
            return true;
        }
    }
}
