package io.pqcscan.audit;

import io.pqcscan.AuditConfig;
import io.pqcscan.detectors.CryptoPattern;
import io.pqcscan.detectors.Detection;
import io.pqcscan.detectors.DetectionException;
import io.pqcscan.detectors.PatternCatalog;
import io.pqcscan.detectors.PatternDetector;
import io.pqcscan.model.AuditReport;
import io.pqcscan.model.AuditSummary;
import io.pqcscan.model.FileError;
import io.pqcscan.model.Finding;
import io.pqcscan.model.Language;
import io.pqcscan.model.ReportMetadata;
import io.pqcscan.model.RiskScore;
import io.pqcscan.parser.ParsedFile;
import io.pqcscan.parser.SourceParseException;
import io.pqcscan.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs parser and detector over one or many inputs and assembles the report.
 * <p>
 * An engine validates its configuration and compiles the pattern catalog
 * once; it holds no other state and may be used from several threads.
 * Timestamps are never read from the clock: callers pass one or get null.
 */
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

    public static final String TOOL_VERSION = "1.0.0";

    static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::path)
            .thenComparingInt(Finding::line)
            .thenComparing(Finding::patternId)
            .thenComparingInt(f -> f.location().column());

    private final AuditConfig config;
    private final SourceParser parser;
    private final PatternDetector detector;
    private final InputValidator validator;
    private final FindingFactory findingFactory = new FindingFactory();
    private final RiskScorer riskScorer = new RiskScorer();
    private final SummaryBuilder summaryBuilder = new SummaryBuilder();

    /**
     * Creates an engine over the bundled pattern catalog.
     */
    public AuditEngine(AuditConfig config) throws ConfigException {
        this(config, PatternCatalog.loadDefault());
    }

    /**
     * Creates an engine over an explicit pattern catalog.
     *
     * @throws ConfigException if the configuration is invalid or a pattern cannot be compiled
     */
    public AuditEngine(AuditConfig config, PatternCatalog catalog) throws ConfigException {
        if (config == null) {
            throw new ConfigException(List.of("config cannot be null"));
        }
        if (catalog == null) {
            throw new ConfigException(List.of("pattern catalog cannot be null"));
        }
        List<String> problems = validate(config, catalog);
        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
        this.config = config;
        this.parser = new SourceParser(config.getMaxInputSize());
        this.validator = new InputValidator(config.getMaxInputSize());
        try {
            this.detector = PatternDetector.create(catalog.patterns(), config.getConfidence(),
                    config.isStripComments(), config.getMaxLineLength());
        } catch (DetectionException e) {
            throw new ConfigException(e.getMessage(), e);
        }
    }

    static List<String> validate(AuditConfig config, PatternCatalog catalog) {
        List<String> problems = new ArrayList<>();

        Set<String> overlap = new TreeSet<>(config.getIncludePatterns());
        overlap.retainAll(config.getExcludePatterns());
        if (!overlap.isEmpty()) {
            problems.add("patterns both included and excluded: " + overlap);
        }
        Set<String> unknown = new TreeSet<>();
        for (String id : config.getIncludePatterns()) {
            if (!catalog.contains(id)) {
                unknown.add(id);
            }
        }
        for (String id : config.getExcludePatterns()) {
            if (!catalog.contains(id)) {
                unknown.add(id);
            }
        }
        if (!unknown.isEmpty()) {
            problems.add("unknown pattern ids: " + unknown);
        }
        if (config.getMaxInputSize() <= 0) {
            problems.add("maxInputSize must be positive, got " + config.getMaxInputSize());
        }
        if (config.getMaxLineLength() <= 0) {
            problems.add("maxLineLength must be positive, got " + config.getMaxLineLength());
        }
        if (config.getParallelism() <= 0) {
            problems.add("parallelism must be positive, got " + config.getParallelism());
        }
        problems.addAll(config.getConfidence().violations());
        return problems;
    }

    public AuditConfig config() {
        return config;
    }

    public List<CryptoPattern> patterns() {
        return detector.patterns();
    }

    // ---- Single file ----

    public AuditReport auditOne(String content, String pathOrLanguage) throws AuditException {
        return auditOne(content, pathOrLanguage, null);
    }

    /**
     * Audits a single input.
     *
     * @param content        Source text; null is treated as empty
     * @param pathOrLanguage Path (language from extension) or explicit language name
     * @param timestamp      Scan time to record in the metadata, may be null
     * @throws AuditException INVALID_INPUT for a rejected path or oversized content,
     *                        INTERNAL for an unexpected failure
     */
    public AuditReport auditOne(String content, String pathOrLanguage, Instant timestamp) throws AuditException {
        String text = content != null ? content : "";
        validator.validate(text, pathOrLanguage);
        FileOutcome outcome;
        try {
            outcome = analyze(parser.parse(text, pathOrLanguage), pathOrLanguage);
        } catch (SourceParseException e) {
            throw AuditException.invalidInput(e.getMessage());
        } catch (RuntimeException e) {
            throw AuditException.internal("Audit of " + pathOrLanguage + " failed: " + e.getMessage(), e);
        }
        return assemble(new ArrayList<>(outcome.findings()), outcome.lines(), 1, List.of(), timestamp);
    }

    /**
     * Audits raw bytes, decoding them as UTF-8. Invalid sequences are replaced
     * rather than rejected.
     */
    public AuditReport auditOne(byte[] content, String pathOrLanguage, Instant timestamp) throws AuditException {
        byte[] bytes = content != null ? content : new byte[0];
        validator.validatePath(pathOrLanguage);
        validator.validateSize(bytes.length, pathOrLanguage);
        FileOutcome outcome;
        try {
            outcome = analyze(parser.parse(bytes, pathOrLanguage), pathOrLanguage);
        } catch (SourceParseException e) {
            throw AuditException.invalidInput(e.getMessage());
        } catch (RuntimeException e) {
            throw AuditException.internal("Audit of " + pathOrLanguage + " failed: " + e.getMessage(), e);
        }
        return assemble(new ArrayList<>(outcome.findings()), outcome.lines(), 1, List.of(), timestamp);
    }

    // ---- Batch ----

    public AuditReport auditMany(List<SourceFile> files) throws AuditException {
        return auditMany(files, null);
    }

    /**
     * Audits several inputs. Each distinct (content, language) pair is parsed
     * once and the groups are processed on up to {@code parallelism} worker
     * threads. A file that fails is recorded in the report metadata and does
     * not stop the rest of the batch.
     *
     * @param files     Inputs in caller order
     * @param timestamp Scan time to record in the metadata, may be null
     * @throws AuditException INVALID_INPUT if {@code files} is null,
     *                        INTERNAL if the calling thread is interrupted
     */
    public AuditReport auditMany(List<SourceFile> files, Instant timestamp) throws AuditException {
        if (files == null) {
            throw AuditException.invalidInput("files cannot be null");
        }
        FileOutcome[] outcomes = new FileOutcome[files.size()];
        FileError[] errors = new FileError[files.size()];

        ParsedFileArena arena = new ParsedFileArena();
        for (int i = 0; i < files.size(); i++) {
            SourceFile file = files.get(i);
            if (file == null) {
                errors[i] = new FileError("", AuditException.Kind.INVALID_INPUT.name(), "null entry at index " + i);
                continue;
            }
            try {
                validator.validate(file.content(), file.path());
                arena.add(i, file, Language.resolve(file.path()));
            } catch (AuditException e) {
                log.warn("Rejected {}: {}", file.path(), e.getMessage());
                errors[i] = new FileError(String.valueOf(file.path()), e.kind().name(), e.getMessage());
            }
        }

        if (arena.size() > 0) {
            runGroups(arena, outcomes, errors);
        }

        List<Finding> findings = new ArrayList<>();
        List<FileError> fileErrors = new ArrayList<>();
        long lines = 0;
        int scanned = 0;
        for (int i = 0; i < files.size(); i++) {
            if (outcomes[i] != null) {
                findings.addAll(outcomes[i].findings());
                lines += outcomes[i].lines();
                scanned++;
            } else if (errors[i] != null) {
                fileErrors.add(errors[i]);
            }
        }
        return assemble(findings, lines, scanned, fileErrors, timestamp);
    }

    private void runGroups(ParsedFileArena arena, FileOutcome[] outcomes, FileError[] errors) throws AuditException {
        int threads = Math.min(config.getParallelism(), arena.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        try {
            List<ParsedFileArena.Group> groups = new ArrayList<>(arena.groups());
            List<Future<List<FileOutcome>>> futures = new ArrayList<>(groups.size());
            for (ParsedFileArena.Group group : groups) {
                futures.add(executor.submit(() -> analyzeGroup(group)));
            }
            for (int g = 0; g < groups.size(); g++) {
                ParsedFileArena.Group group = groups.get(g);
                try {
                    List<FileOutcome> results = futures.get(g).get();
                    for (int m = 0; m < group.members().size(); m++) {
                        outcomes[group.members().get(m).index()] = results.get(m);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    String kind = cause instanceof SourceParseException
                            ? AuditException.Kind.INVALID_INPUT.name()
                            : AuditException.Kind.INTERNAL.name();
                    for (ParsedFileArena.Member member : group.members()) {
                        log.warn("Failed to audit {}: {}", member.file().path(), cause.toString());
                        errors[member.index()] = new FileError(member.file().path(), kind, String.valueOf(cause.getMessage()));
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AuditException.internal("Batch audit interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Parses a group once and runs detection for every member path.
     * The parsed file stays on the worker thread.
     */
    private List<FileOutcome> analyzeGroup(ParsedFileArena.Group group) throws SourceParseException {
        String firstPath = group.members().get(0).file().path();
        ParsedFile parsed = parser.parse(group.content(), firstPath);
        List<FileOutcome> results = new ArrayList<>(group.members().size());
        for (ParsedFileArena.Member member : group.members()) {
            log.debug("Auditing {} ({} lines, {})", member.file().path(), parsed.lineCount(), parsed.language().id());
            results.add(analyze(parsed, member.file().path()));
        }
        return results;
    }

    // ---- Shared steps ----

    private record FileOutcome(List<Finding> findings, long lines) {
    }

    private FileOutcome analyze(ParsedFile parsed, String path) {
        List<Finding> findings = new ArrayList<>();
        for (Detection detection : detector.detect(parsed, path)) {
            CryptoPattern pattern = detector.pattern(detection.patternId())
                    .orElseThrow(() -> new IllegalStateException("Unknown pattern: " + detection.patternId()));
            if (!config.admitsPattern(pattern.id())) {
                continue;
            }
            if (!pattern.severity().isAtLeast(config.getSeverityThreshold())) {
                continue;
            }
            findings.add(findingFactory.create(detection, pattern));
        }
        return new FileOutcome(findings, parsed.lineCount());
    }

    private AuditReport assemble(List<Finding> findings, long lines, int filesScanned,
                                 List<FileError> fileErrors, Instant timestamp) {
        findings.sort(REPORT_ORDER);
        RiskScore risk = riskScorer.score(findings, lines);
        AuditSummary summary = summaryBuilder.build(findings, risk, filesScanned, fileErrors.size(), lines);
        ReportMetadata metadata = new ReportMetadata(TOOL_VERSION, timestamp, fileErrors);
        return new AuditReport(findings, risk, summary, metadata);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "pqc-audit-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
