package org.carball.profiler.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.config.ColumnProfilerOptions;
import org.carball.profiler.config.ConfigurationLoader;
import org.carball.profiler.config.ProfilerConfig;
import org.carball.profiler.io.RecordLoader;
import org.carball.profiler.io.SchemaLoader;
import org.carball.profiler.model.ProfileRequest;
import org.carball.profiler.model.event.ErrorEvent;
import org.carball.profiler.model.event.ProgressEvent;
import org.carball.profiler.model.profile.Profile;
import org.carball.profiler.model.profile.SuspiciousRankingEntry;
import org.carball.profiler.model.profile.SuspiciousReason;
import org.carball.profiler.output.OutputFormat;
import org.carball.profiler.output.ProfileReport;
import org.carball.profiler.runner.ProfileRun;
import org.carball.profiler.runner.ProfilingWorker;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

@Slf4j
public class ColumnProfilerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════╗
        ║          Column Profiler v%s           ║
        ╚═══════════════════════════════════════════╝
        """;

    private final PrintStream out;
    private final PrintStream err;

    public ColumnProfilerCLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new ColumnProfilerCLI(System.out, System.err).run(args));
    }

    /**
     * @return process exit code
     */
    public int run(String[] args) {
        out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            ColumnProfilerOptions options = parseArgs(args);
            if (options.isVerbose()) {
                enableDebugLogging();
            }

            ProfilerConfig config = new ConfigurationLoader().loadConfiguration(options.getConfigFile(), args);

            out.println("\n🔍 Starting profile...");
            out.println("   Records file: " + options.getRecordsFile());
            if (options.getSchemaFile() != null) {
                out.println("   Schema file: " + options.getSchemaFile());
            }
            out.println();

            // Step 1: Load input
            out.print("📥 Loading records... ");
            List<Map<String, Object>> records = new RecordLoader().load(options.getRecordsFile());
            JsonNode schema = options.getSchemaFile() != null ? new SchemaLoader().load(options.getSchemaFile()) : null;
            out.println("✓ (" + records.size() + ")");

            // Step 2: Profile on the worker thread
            out.print("📊 Profiling columns... ");
            Profile profile = runProfile(new ProfileRequest(records, schema, options.getTopK()), config, options);
            out.println("✓");

            // Step 3: Output results
            out.print("📝 Writing results... ");
            List<String> written = outputResults(profile, options);
            out.println("✓");

            printSummary(profile);

            out.println("\n✅ Profile complete!");
            out.println("   Output files:");
            written.forEach(file -> out.println("     - " + file));
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (ExecutionException e) {
            err.println("\n❌ Profiling failed: " + e.getCause().getMessage());
            log.debug("Profiling error details", e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("\n❌ Interrupted while profiling");
            return 1;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private Profile runProfile(ProfileRequest request, ProfilerConfig config, ColumnProfilerOptions options)
            throws ExecutionException, InterruptedException {
        try (ProfilingWorker worker = new ProfilingWorker(config)) {
            ProfileRun run = worker.submit(request, event -> {
                if (event instanceof ProgressEvent progress && options.isVerbose()) {
                    out.printf("%n     - %,d / %,d records", progress.processedRecords(), progress.totalRecords());
                } else if (event instanceof ErrorEvent error) {
                    log.debug("Run reported error: {}", error.message());
                }
            });
            return run.getResult().get();
        }
    }

    private boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("\nUsage: java -jar column-profiler.jar <records-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  records-file        JSON array of records, or JSON Lines (.jsonl, .ndjson)");
        out.println();
        out.println("Options:");
        out.println("  --schema, -s        Avro schema (.avsc) with logical types (optional)");
        out.println("  --top-k, -k         Frequent values kept per column (default: 10)");
        out.println("  --output, -o        Output file (default: profile.json)");
        out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        out.println("  --config, -c        YAML file with limits and scoring settings (optional)");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  java -jar column-profiler.jar records.json");
        out.println("  java -jar column-profiler.jar events.jsonl --schema events.avsc --top-k 20 -f both");
    }

    ColumnProfilerOptions parseArgs(String[] args) {
        ColumnProfilerOptions options = new ColumnProfilerOptions();
        options.setRecordsFile(Paths.get(args[0]));

        // Set defaults
        options.setOutputFile("profile.json");
        options.setOutputFormat(OutputFormat.JSON);
        options.setVerbose(false);

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--schema":
                case "-s":
                    options.setSchemaFile(Paths.get(requireValue(args, i++, "Schema file not specified")));
                    break;

                case "--top-k":
                case "-k":
                    String topK = requireValue(args, i++, "Top-K not specified");
                    try {
                        options.setTopK(Integer.parseInt(topK));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Top-K must be a number: " + topK);
                    }
                    break;

                case "--output":
                case "-o":
                    options.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        options.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--config":
                case "-c":
                    options.setConfigFile(Paths.get(requireValue(args, i++, "Config file not specified")));
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    String option = args[i];
                    if (option.startsWith("--limits.") || option.startsWith("--scoring.")) {
                        // Value handled by ConfigurationLoader
                        requireValue(args, i++, "Value not specified for " + option);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + option);
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(options.getOutputFile());
        options.setOutputFile(baseFileName + (options.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        validateOptions(options);
        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateOptions(ColumnProfilerOptions options) {
        if (!Files.exists(options.getRecordsFile())) {
            throw new IllegalArgumentException("Records file not found: " + options.getRecordsFile());
        }

        if (options.getSchemaFile() != null && !Files.exists(options.getSchemaFile())) {
            throw new IllegalArgumentException("Schema file not found: " + options.getSchemaFile());
        }

        if (options.getTopK() != null && options.getTopK() <= 0) {
            throw new IllegalArgumentException("Top-K must be positive: " + options.getTopK());
        }

        Path outputDir = Paths.get(options.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private List<String> outputResults(Profile profile, ColumnProfilerOptions options) throws IOException {
        ProfileReport report = new ProfileReport(profile, options.getRecordsFile().toString());
        String baseFileName = removeFileExtension(options.getOutputFile());
        OutputFormat format = options.getOutputFormat();

        if (format == OutputFormat.JSON) {
            Files.writeString(Paths.get(options.getOutputFile()), report.toJson());
            return List.of(options.getOutputFile());
        }
        if (format == OutputFormat.MARKDOWN) {
            Files.writeString(Paths.get(options.getOutputFile()), report.toMarkdown());
            return List.of(options.getOutputFile());
        }

        Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        return List.of(baseFileName + ".json", baseFileName + ".md");
    }

    private void printSummary(Profile profile) {
        out.println("\n" + "=".repeat(60));
        out.println("📊 PROFILE SUMMARY");
        out.println("=".repeat(60));

        out.println("\nRecords: " + profile.totalRecords());
        out.println("Columns: " + profile.columns().size());

        out.println("\n🎯 Most Suspicious Columns:");
        out.println("-".repeat(60));

        List<SuspiciousRankingEntry> flagged = profile.suspiciousRanking().stream()
                .filter(entry -> entry.score() > 0)
                .limit(5)
                .collect(Collectors.toList());

        for (SuspiciousRankingEntry entry : flagged) {
            out.printf("%-30s score %3d%n", entry.column(), entry.score());
            for (SuspiciousReason reason : entry.reasons()) {
                out.printf("  └─ %s%n", reason.message());
            }
        }

        if (flagged.isEmpty()) {
            out.println("\n💡 No suspicious columns found.");
        }
    }

    private static void enableDebugLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.profiler");
        logger.setLevel(Level.DEBUG);
    }
}
