package com.raditha.optchain.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.optchain.analyzer.AnalysisReport;
import com.raditha.optchain.analyzer.OptionalChainAnalyzer;
import com.raditha.optchain.config.DetectorConfig;
import com.raditha.optchain.config.DetectorSettings;
import com.raditha.optchain.model.Diagnostic;
import com.raditha.optchain.model.ExpressionTree;
import com.raditha.optchain.parser.EstreeTreeReader;
import com.raditha.optchain.parser.ParsedTree;
import com.raditha.optchain.refactoring.DiffGenerator;
import com.raditha.optchain.refactoring.SuggestionApplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the optional chain detector.
 * <p>
 * Usage:
 * java -jar optchain.jar [options] &lt;ast.json&gt;...
 * <p>
 * Configuration priority: CLI arguments > config file > defaults
 */
@Command(name = "optchain", mixinStandardHelpOptions = true, version = "optchain v1.0.0",
        description = "Finds guard chains that can be written as optional chain expressions")
public class OptChainCLI implements Callable<Integer> {

    private static final String VERSION = "1.0.0";

    static final int EXIT_CLEAN = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;

    private static final ObjectMapper JSON = new ObjectMapper();

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<ast.json>", description = "ESTree JSON files to analyze")
    private List<Path> inputs = new ArrayList<>();

    @Option(names = "--source", description = "Source text of a single input (default: the JSON path without .json)", paramLabel = "<file>")
    private Path source;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--preset", description = "Configuration preset: default or nullish-only", paramLabel = "<name>")
    private String preset;

    @Option(names = "--require-nullish", description = "Accept loose guards only for nullable types")
    private boolean requireNullish = false;

    @Option(names = "--no-check-any", description = "Do not accept `any` operands as loose guards")
    private boolean noCheckAny = false;

    @Option(names = "--no-check-unknown", description = "Do not accept `unknown` operands as loose guards")
    private boolean noCheckUnknown = false;

    @Option(names = "--no-check-string", description = "Do not accept `string` operands as loose guards")
    private boolean noCheckString = false;

    @Option(names = "--no-check-number", description = "Do not accept `number` operands as loose guards")
    private boolean noCheckNumber = false;

    @Option(names = "--no-check-boolean", description = "Do not accept `boolean` operands as loose guards")
    private boolean noCheckBoolean = false;

    @Option(names = "--no-check-bigint", description = "Do not accept `bigint` operands as loose guards")
    private boolean noCheckBigInt = false;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}", paramLabel = "<format>", converter = ReportFormatConverter.class)
    private ReportFormat format = ReportFormat.TEXT;

    @Option(names = "--diff", description = "Preview suggested rewrites as a unified diff")
    private boolean diff = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return 0 when nothing was found, 1 when diagnostics were reported
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        DetectorConfig config = DetectorSettings.loadConfig(configFile, preset, cliOverrides());
        OptionalChainAnalyzer analyzer = new OptionalChainAnalyzer(config);
        EstreeTreeReader reader = new EstreeTreeReader();

        List<AnalysisReport> reports = new ArrayList<>();
        for (Path input : inputs) {
            ParsedTree parsed = reader.read(input, sourceFor(input));
            reports.add(analyzer.analyze(parsed.tree(), parsed.types(), input));
        }

        PrintWriter out = spec.commandLine().getOut();
        if (format == ReportFormat.JSON) {
            printJsonReport(reports, out);
        } else {
            printTextReport(reports, config, out);
        }
        if (diff) {
            printDiffs(reports, out);
        }
        out.flush();

        boolean found = reports.stream().anyMatch(AnalysisReport::hasDiagnostics);
        return found ? EXIT_DIAGNOSTICS : EXIT_CLEAN;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Build the command line with the exit code mapping used by {@link #main(String[])}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new OptChainCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_DIAGNOSTICS;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine commandLine = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            commandLine.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, commandLine.getErr());
            commandLine.getErr().print(commandLine.getUsageMessage(colorScheme));
            return EXIT_CONFIG; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (source != null && inputs.size() > 1) {
            throw new IllegalArgumentException("--source can only be used with a single input file");
        }
        if (source != null && !Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Source file not found: " + source);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (preset != null) {
            // fails fast on unknown names
            DetectorConfig.preset(preset);
        }
    }

    private Map<String, Boolean> cliOverrides() {
        Map<String, Boolean> overrides = new LinkedHashMap<>();
        disableIfSet(overrides, DetectorSettings.CHECK_ANY, noCheckAny);
        disableIfSet(overrides, DetectorSettings.CHECK_UNKNOWN, noCheckUnknown);
        disableIfSet(overrides, DetectorSettings.CHECK_STRING, noCheckString);
        disableIfSet(overrides, DetectorSettings.CHECK_NUMBER, noCheckNumber);
        disableIfSet(overrides, DetectorSettings.CHECK_BOOLEAN, noCheckBoolean);
        disableIfSet(overrides, DetectorSettings.CHECK_BIGINT, noCheckBigInt);
        if (requireNullish) {
            overrides.put(DetectorSettings.REQUIRE_NULLISH, true);
        }
        return overrides;
    }

    private static void disableIfSet(Map<String, Boolean> overrides, String key, boolean flag) {
        if (flag) {
            overrides.put(key, false);
        }
    }

    /**
     * Source text for an input: {@code --source}, else {@code foo.ts} next to {@code foo.ts.json}.
     */
    private Path sourceFor(Path input) {
        if (source != null) {
            return source;
        }
        String name = input.getFileName().toString();
        if (!name.endsWith(".json")) {
            return null;
        }
        Path sibling = input.resolveSibling(name.substring(0, name.length() - ".json".length()));
        return Files.isRegularFile(sibling) ? sibling : null;
    }

    private static void printTextReport(List<AnalysisReport> reports, DetectorConfig config, PrintWriter out) {
        int total = reports.stream().mapToInt(AnalysisReport::getDiagnosticCount).sum();

        out.println("=".repeat(80));
        out.println("OPTIONAL CHAIN REPORT");
        out.println("=".repeat(80));
        out.println();
        out.printf("Files analyzed: %d%n", reports.size());
        out.printf("Total diagnostics: %d%n", total);
        out.printf("Loose guards accepted for: %s%n", config.describe());
        out.println();

        if (total == 0) {
            out.println("No optional chain candidates found.");
            out.println();
            return;
        }

        for (AnalysisReport report : reports) {
            if (!report.hasDiagnostics()) {
                continue;
            }
            out.println("-".repeat(80));
            out.println("File: " + report.sourceFile());
            out.println("-".repeat(80));
            ExpressionTree tree = report.tree();
            for (Diagnostic diagnostic : report.diagnostics()) {
                out.printf("%s: %s [%s]%n",
                        tree.position(diagnostic.rangeStart()),
                        diagnostic.message(),
                        diagnostic.kind().id());
                String snippet = report.snippet(diagnostic);
                if (!snippet.isEmpty()) {
                    out.println("    " + snippet);
                }
                if (diagnostic.hasSuggestion()) {
                    out.println("    suggestion: " + diagnostic.suggestedRewrite());
                }
            }
            out.println();
            out.println(report.getSummary());
            out.println();
        }
    }

    private static void printJsonReport(List<AnalysisReport> reports, PrintWriter out) throws IOException {
        List<FileDTO> files = new ArrayList<>();
        int total = 0;
        for (AnalysisReport report : reports) {
            List<DiagnosticDTO> diagnostics = new ArrayList<>();
            for (Diagnostic diagnostic : report.diagnostics()) {
                ExpressionTree.Position position = report.tree().position(diagnostic.rangeStart());
                diagnostics.add(new DiagnosticDTO(
                        diagnostic.kind().id(),
                        diagnostic.message(),
                        diagnostic.rangeStart(),
                        diagnostic.rangeEnd(),
                        position.line(),
                        position.column(),
                        diagnostic.suggestedRewrite()));
            }
            total += diagnostics.size();
            files.add(new FileDTO(String.valueOf(report.sourceFile()), report.combinatorRuns(), diagnostics));
        }
        out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(new ReportDTO(VERSION, total, files)));
    }

    private void printDiffs(List<AnalysisReport> reports, PrintWriter out) {
        SuggestionApplier applier = new SuggestionApplier();
        DiffGenerator diffGenerator = new DiffGenerator();
        for (AnalysisReport report : reports) {
            String fileName = report.sourceFile() == null ? "input" : report.sourceFile().getFileName().toString();
            String original = report.tree().sourceText().orElse(null);
            if (original == null) {
                spec.commandLine().getErr().println("No source text for " + fileName + ", skipping diff");
                continue;
            }
            String diffText = diffGenerator.generateUnifiedDiff(fileName, original,
                    applier.apply(original, report.diagnostics()));
            if (!diffText.isEmpty()) {
                out.println(diffText);
            }
        }
    }

    /**
     * JSON shape of the whole run.
     */
    public record ReportDTO(String version, int totalDiagnostics, List<FileDTO> files) {}

    public record FileDTO(String file, int combinatorRuns, List<DiagnosticDTO> diagnostics) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DiagnosticDTO(
            String kind,
            String message,
            int rangeStart,
            int rangeEnd,
            int line,
            int column,
            String suggestedRewrite) {}

    /**
     * Converter for ReportFormat enum to support case-insensitive values.
     */
    public static class ReportFormatConverter implements ITypeConverter<ReportFormat> {
        @Override
        public ReportFormat convert(String value) throws Exception {
            return ReportFormat.fromString(value);
        }
    }
}
