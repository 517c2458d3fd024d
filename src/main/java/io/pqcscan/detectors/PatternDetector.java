package io.pqcscan.detectors;

import io.pqcscan.ConfidenceWeights;
import io.pqcscan.model.PrimitiveFamily;
import io.pqcscan.model.SourceLocation;
import io.pqcscan.parser.ParsedFile;
import io.pqcscan.parser.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a fixed pattern catalog against parsed files.
 * <p>
 * All matchers are compiled once in {@link #create}; afterwards the detector
 * is immutable and may be shared between threads. {@link #detect} never throws:
 * a matcher failing on a line is logged and that line/pattern pair is skipped.
 */
public final class PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 4096;

    private static final Pattern KEY_SIZE = Pattern.compile("\\b(512|768|1024|1536|2048|3072|4096|8192)\\b");

    private static final Set<PrimitiveFamily> KEY_SIZE_FAMILIES = EnumSet.of(
            PrimitiveFamily.INTEGER_FACTORIZATION,
            PrimitiveFamily.DISCRETE_LOG,
            PrimitiveFamily.KEY_EXCHANGE);

    private static final Comparator<Detection> FILE_ORDER = Comparator
            .comparingInt((Detection d) -> d.location().line())
            .thenComparingInt(d -> d.location().column())
            .thenComparing(Detection::patternId);

    private record CompiledPattern(CryptoPattern pattern, LineMatcher matcher) {
    }

    private final List<CompiledPattern> compiled;
    private final Map<String, CryptoPattern> byId;
    private final ConfidenceScorer scorer;
    private final boolean stripComments;
    private final int maxLineLength;

    private PatternDetector(List<CompiledPattern> compiled, ConfidenceScorer scorer,
                            boolean stripComments, int maxLineLength) {
        this.compiled = List.copyOf(compiled);
        Map<String, CryptoPattern> index = new LinkedHashMap<>();
        for (CompiledPattern cp : compiled) {
            index.put(cp.pattern().id(), cp.pattern());
        }
        this.byId = Map.copyOf(index);
        this.scorer = scorer;
        this.stripComments = stripComments;
        this.maxLineLength = maxLineLength;
    }

    /**
     * Creates a detector over the default catalog with default weights.
     */
    public static PatternDetector createDefault() throws DetectionException {
        return create(PatternCatalog.loadDefault().patterns(), ConfidenceWeights.defaults(),
                true, DEFAULT_MAX_LINE_LENGTH);
    }

    /**
     * Compiles the given patterns into a detector.
     *
     * @param patterns      Patterns to evaluate, ids must be unique
     * @param weights       Confidence multiplier table
     * @param stripComments Skip comment-only lines and comment text within lines
     * @param maxLineLength Number of characters per line the matchers examine
     * @throws DetectionException if any matcher is malformed or unsafe
     */
    public static PatternDetector create(List<CryptoPattern> patterns, ConfidenceWeights weights,
                                         boolean stripComments, int maxLineLength) throws DetectionException {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive, got " + maxLineLength);
        }
        List<CompiledPattern> compiled = new ArrayList<>(patterns.size());
        Set<String> seen = new HashSet<>();
        for (CryptoPattern pattern : patterns) {
            if (!seen.add(pattern.id())) {
                throw new DetectionException(pattern.id(), "duplicate pattern id");
            }
            compiled.add(new CompiledPattern(pattern, LineMatcher.compile(pattern.id(), pattern.matcher())));
        }
        log.debug("Compiled {} crypto patterns", compiled.size());
        return new PatternDetector(compiled, new ConfidenceScorer(weights), stripComments, maxLineLength);
    }

    public List<CryptoPattern> patterns() {
        return compiled.stream().map(CompiledPattern::pattern).toList();
    }

    public Optional<CryptoPattern> pattern(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Runs every applicable pattern over every eligible line.
     *
     * @param file Parsed file
     * @param path Path recorded in detection locations
     * @return Detections ordered by line, column and pattern id; empty if nothing matched
     */
    public List<Detection> detect(ParsedFile file, String path) {
        String locationPath = path != null ? path : "";
        List<CompiledPattern> applicable = new ArrayList<>();
        List<Boolean> corroborated = new ArrayList<>();
        for (CompiledPattern cp : compiled) {
            if (!cp.pattern().appliesTo(file.language())) {
                continue;
            }
            boolean imported = cp.pattern().corroboratedBy(file);
            if (cp.matcher().kind() == MatcherKind.IMPORT_CORROBORATED && !imported) {
                continue;
            }
            applicable.add(cp);
            corroborated.add(imported);
        }
        if (applicable.isEmpty()) {
            return List.of();
        }

        List<Detection> detections = new ArrayList<>();
        for (SourceLine line : file.lines()) {
            if (line.blank() || (stripComments && line.comment())) {
                continue;
            }
            String text = stripComments ? line.code() : line.text();
            if (text.length() > maxLineLength) {
                text = text.substring(0, maxLineLength);
            }
            for (int i = 0; i < applicable.size(); i++) {
                CompiledPattern cp = applicable.get(i);
                try {
                    Optional<LineMatcher.Match> match = cp.matcher().firstMatch(text);
                    if (match.isPresent()) {
                        detections.add(toDetection(cp, file, line, text, match.get(), corroborated.get(i), locationPath));
                    }
                } catch (RuntimeException | StackOverflowError e) {
                    log.warn("Skipping pattern {} on {}:{}: {}", cp.pattern().id(), locationPath, line.number(),
                            e.toString());
                }
            }
        }
        detections.sort(FILE_ORDER);
        return detections;
    }

    private Detection toDetection(CompiledPattern cp, ParsedFile file, SourceLine line, String text,
                                  LineMatcher.Match match, boolean corroborated, String path) {
        double confidence = scorer.score(cp.matcher().kind(), file, line, match.start(), corroborated);
        SourceLocation location = new SourceLocation(path, line.number(), match.start() + 1,
                SourceLocation.snippetOf(line.text()));
        Integer keySize = KEY_SIZE_FAMILIES.contains(cp.pattern().family()) ? keySizeIn(text) : null;
        return new Detection(cp.pattern().id(), location, confidence, keySize);
    }

    private static Integer keySizeIn(String text) {
        Matcher m = KEY_SIZE.matcher(text);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }
}
