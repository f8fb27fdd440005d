package org.dxworks.sieveframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.sieveframe.converter.SieveScriptConverter;
import org.dxworks.sieveframe.model.SieveFileAnalysis;
import org.dxworks.sieveframe.model.SieveScript;
import org.dxworks.sieveframe.sieve.SieveParseException;
import org.dxworks.sieveframe.sieve.SieveParser;
import org.dxworks.sieveframe.store.FileScriptStore;
import org.dxworks.sieveframe.store.ScriptStore;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
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
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final SieveScriptConverter CONVERTER = new SieveScriptConverter();
    private static final ScriptStore STORE = new FileScriptStore();

    public static void main(String[] args) throws Exception {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) throws IOException {
        if (args.length < 2) {
            printUsage();
            return 2;
        }

        Path input = Paths.get(args[1]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        switch (args[0]) {
            case "analyze":
                if (args.length < 3) {
                    printUsage();
                    return 2;
                }
                analyze(input, Paths.get(args[2]), SieveframeConfig.load());
                return 0;
            case "format":
                writeOutput(formatFile(input), args.length > 2 ? Paths.get(args[2]) : null);
                return 0;
            case "model":
                writeOutput(modelFile(input, SieveframeConfig.load().isPrettyPrint()),
                        args.length > 2 ? Paths.get(args[2]) : null);
                return 0;
            case "emit":
                writeOutput(emitFile(input), args.length > 2 ? Paths.get(args[2]) : null);
                return 0;
            case "check":
                return check(input);
            default:
                System.err.println("Unknown command: " + args[0]);
                printUsage();
                return 2;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar sieveframe.jar <command> <input> [output]");
        System.err.println("  analyze <input> <output.jsonl>  Read every script under <input> into rules (JSONL)");
        System.err.println("  format <script> [output]        Re-emit a script through the rule model");
        System.err.println("  model <script> [output]         Write the rule model of a script as JSON");
        System.err.println("  emit <model.json> [output]      Write the script text of a JSON rule model");
        System.err.println("  check <script>                  Report whether a script parses");
    }

    static void analyze(Path input, Path jsonlOutput, SieveframeConfig config) throws IOException {
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting script analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        ScriptDetector detector = new ScriptDetector(config);
        List<Path> files = collectScriptFiles(input, detector, config.getMaxScriptLines());
        System.out.println("Found " + files.size() + " script files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Reading " + file.getFileName());
                }

                try {
                    SieveFileAnalysis analysis = analyzeFile(file, detector);
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (IOException e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

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
                        System.err.println("  Error reading " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static List<Path> collectScriptFiles(Path input, ScriptDetector detector, int maxScriptLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(detector::isScript)
                      .filter(p -> withinMaxLines(p, maxScriptLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (detector.isScript(input) && withinMaxLines(input, maxScriptLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxScriptLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxScriptLines + 1L).count();
            return count <= maxScriptLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files are reported when they are analyzed
            return true;
        }
    }

    public static SieveFileAnalysis analyzeFile(Path filePath, ScriptDetector detector) throws IOException {
        String text = STORE.load(filePath);

        SieveFileAnalysis analysis = new SieveFileAnalysis();
        analysis.filePath = filePath.toString();
        analysis.script = CONVERTER.textToScript(text, detector.scriptName(filePath));
        return analysis;
    }

    public static String formatFile(Path scriptPath) throws IOException {
        String text = STORE.load(scriptPath);
        String name = new ScriptDetector(SieveframeConfig.defaults()).scriptName(scriptPath);
        return CONVERTER.scriptToText(CONVERTER.textToScript(text, name));
    }

    public static String emitFile(Path modelPath) throws IOException {
        SieveScript script = MAPPER.readValue(STORE.load(modelPath), SieveScript.class);
        return CONVERTER.scriptToText(script);
    }

    /** The rule model of a script as JSON, in the form {@code emit} reads back. */
    public static String modelFile(Path scriptPath, boolean prettyPrint) throws IOException {
        String text = STORE.load(scriptPath);
        String name = new ScriptDetector(SieveframeConfig.defaults()).scriptName(scriptPath);
        SieveScript script = CONVERTER.textToScript(text, name);
        return (prettyPrint ? PRETTY_MAPPER : MAPPER).writeValueAsString(script) + "\n";
    }

    private static int check(Path scriptPath) throws IOException {
        String text = STORE.load(scriptPath);
        try {
            new SieveParser().parse(text);
            System.out.println("OK");
            return 0;
        } catch (SieveParseException e) {
            System.out.println("ERROR " + e.getKind() + " at " + e.describePosition(text) + ": " + e.getMessage());
            return 1;
        }
    }

    private static void writeOutput(String text, Path output) throws IOException {
        if (output == null) {
            System.out.print(text);
            System.out.flush();
        } else {
            STORE.save(output, text);
            System.out.println("Output written to: " + output.toAbsolutePath());
        }
    }
}
