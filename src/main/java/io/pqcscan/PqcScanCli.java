package io.pqcscan;

import io.pqcscan.audit.AuditEngine;
import io.pqcscan.audit.ConfigException;
import io.pqcscan.audit.SourceFile;
import io.pqcscan.detectors.PatternCatalog;
import io.pqcscan.model.AuditReport;
import io.pqcscan.model.Language;
import io.pqcscan.model.Severity;
import io.pqcscan.report.ConsoleReporter;
import io.pqcscan.report.JsonReporter;
import io.pqcscan.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the pqc-scan tool.
 */
@Command(
        name = "pqc-scan",
        mixinStandardHelpOptions = true,
        version = "pqc-scan " + AuditEngine.TOOL_VERSION,
        description = "Scans source trees for cryptography that is quantum-vulnerable or already deprecated.",
        footer = {
                "",
                "Examples:",
                "  pqc-scan /path/to/project",
                "  pqc-scan /path/to/project --output-format json --output-file report.json",
                "  pqc-scan src/ --severity-threshold high --fail-on critical",
                "  pqc-scan app.py --exclude md5-hash,sha1-hash"
        }
)
public class PqcScanCli implements Callable<Integer> {

    static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            ".git", ".hg", ".svn", "node_modules", "target", "build", "vendor", "dist", "__pycache__", ".venv");

    @Parameters(
            index = "0",
            description = "File or directory to scan"
    )
    private Path scanPath;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"--patterns"},
            description = "Additional pattern catalog YAML, merged over the built-in catalog"
    )
    private Path patternsFile;

    @Option(
            names = {"-s", "--severity-threshold"},
            description = "Minimum severity to report: critical, high, medium, low, info"
    )
    private String severityThreshold;

    @Option(
            names = {"--include"},
            description = "Only report these pattern ids",
            split = ","
    )
    private List<String> includePatterns;

    @Option(
            names = {"--exclude"},
            description = "Never report these pattern ids",
            split = ","
    )
    private List<String> excludePatterns;

    @Option(
            names = {"--max-file-size"},
            description = "Maximum file size in bytes (overrides the config file)"
    )
    private Long maxFileSize;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if findings at this severity or higher: critical, high, medium, low, info",
            defaultValue = "critical"
    )
    private String failOnLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-d", "--detailed"},
            description = "Show every finding, not just the summary"
    )
    private boolean detailed;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            if (!Files.exists(scanPath)) {
                System.err.println("Error: Path does not exist: " + scanPath);
                return 1;
            }

            Severity failLevel = parseSeverity(failOnLevel, "fail-on");
            if (failLevel == null) return 1;

            AuditConfig config = buildConfig();
            if (config == null) return 1;

            PatternCatalog catalog = PatternCatalog.loadDefault();
            if (patternsFile != null) {
                log("Loading patterns from: " + patternsFile);
                catalog = catalog.merge(PatternCatalog.loadFromFile(patternsFile));
            }

            AuditEngine engine = new AuditEngine(config, catalog);
            log("Loaded " + engine.patterns().size() + " patterns");

            log("Collecting source files...");
            List<SourceFile> files = collectFiles(scanPath);
            log("  Found " + files.size() + " source files");

            log("Auditing...");
            AuditReport report = engine.auditMany(files, Instant.now());
            log("  " + report.totalFindings() + " findings, risk "
                    + report.riskScore().riskLevel().label());

            Reporter reporter = createReporter();
            writeReport(report, reporter);

            if (report.hasFindingsAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to findings at " + failLevel.label() + " severity or higher.");
                }
                return 2;
            }
            return 0;

        } catch (ConfigException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private AuditConfig buildConfig() throws IOException {
        AuditConfig base = AuditConfig.defaults();
        if (configFile != null) {
            log("Loading configuration from: " + configFile);
            base = AuditConfig.load(configFile);
        }
        AuditConfig.Builder builder = base.toBuilder();
        if (severityThreshold != null) {
            Severity threshold = parseSeverity(severityThreshold, "severity-threshold");
            if (threshold == null) return null;
            builder.severityThreshold(threshold);
        }
        if (includePatterns != null) {
            builder.includePatterns(includePatterns);
        }
        if (excludePatterns != null) {
            builder.excludePatterns(excludePatterns);
        }
        if (maxFileSize != null) {
            builder.maxInputSize(maxFileSize);
        }
        return builder.build();
    }

    /**
     * Reads every file with a known source extension. Paths in the report are
     * relative to the scan root so they never contain "..".
     */
    List<SourceFile> collectFiles(Path root) throws IOException {
        List<SourceFile> files = new ArrayList<>();
        if (Files.isRegularFile(root)) {
            Path name = root.getFileName();
            files.add(SourceFile.fromBytes(Files.readAllBytes(root), name != null ? name.toString() : root.toString()));
            return files;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                Path name = dir.getFileName();
                if (!dir.equals(root) && name != null && SKIPPED_DIRECTORIES.contains(name.toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || Language.fromPath(file.toString()).isEmpty()) {
                    return FileVisitResult.CONTINUE;
                }
                String relative = root.relativize(file).toString().replace('\\', '/');
                try {
                    files.add(SourceFile.fromBytes(Files.readAllBytes(file), relative));
                } catch (IOException e) {
                    System.err.println("Warning: Could not read " + file + ": " + e.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                System.err.println("Warning: Could not access " + file + ": " + e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort((a, b) -> a.path().compareTo(b.path()));
        return files;
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor, detailed);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AuditReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            reporter.write(report, writer);
            writer.flush();
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private Severity parseSeverity(String value, String optionName) {
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --" + optionName + ": " + value);
            System.err.println("Valid values: critical, high, medium, low, info");
            return null;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PqcScanCli()).execute(args);
        System.exit(exitCode);
    }
}
