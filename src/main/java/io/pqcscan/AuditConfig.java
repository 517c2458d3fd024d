package io.pqcscan;

import io.pqcscan.model.Severity;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Caller-supplied audit settings.
 * <p>
 * Instances are immutable. Values are only checked for type here; semantic
 * validation (overlapping lists, unknown pattern ids, ranges) happens when an
 * {@link io.pqcscan.audit.AuditEngine} is constructed.
 */
public class AuditConfig {

    public static final long DEFAULT_MAX_INPUT_SIZE = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_LINE_LENGTH = 4096;

    private final Severity severityThreshold;
    private final Set<String> includePatterns;
    private final Set<String> excludePatterns;
    private final long maxInputSize;
    private final int maxLineLength;
    private final boolean stripComments;
    private final int parallelism;
    private final ConfidenceWeights confidence;

    private AuditConfig(Builder builder) {
        this.severityThreshold = builder.severityThreshold;
        this.includePatterns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.includePatterns));
        this.excludePatterns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludePatterns));
        this.maxInputSize = builder.maxInputSize;
        this.maxLineLength = builder.maxLineLength;
        this.stripComments = builder.stripComments;
        this.parallelism = builder.parallelism;
        this.confidence = builder.confidence;
    }

    public static AuditConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .severityThreshold(severityThreshold)
                .includePatterns(includePatterns)
                .excludePatterns(excludePatterns)
                .maxInputSize(maxInputSize)
                .maxLineLength(maxLineLength)
                .stripComments(stripComments)
                .parallelism(parallelism)
                .confidence(confidence);
    }

    /**
     * Load configuration from a YAML file.
     */
    public static AuditConfig load(Path configPath) throws IOException {
        try (InputStream in = Files.newInputStream(configPath)) {
            return load(in);
        }
    }

    /**
     * Load configuration from a YAML stream. Missing keys keep their defaults;
     * unknown keys are ignored.
     *
     * @throws IOException if the document is not a mapping or a value has the wrong type
     */
    public static AuditConfig load(InputStream in) throws IOException {
        Yaml yaml = new Yaml();
        Object root = yaml.load(in);
        if (root == null) {
            return defaults();
        }
        if (!(root instanceof Map<?, ?> data)) {
            throw new IOException("Config must be a YAML mapping");
        }

        Builder builder = builder();
        try {
            Object threshold = data.get("severityThreshold");
            if (threshold != null) {
                builder.severityThreshold(Severity.parse(threshold.toString()));
            }
            builder.includePatterns(toSet(data.get("includePatterns"), "includePatterns"));
            builder.excludePatterns(toSet(data.get("excludePatterns"), "excludePatterns"));

            Number maxInputSize = number(data, "maxInputSize");
            if (maxInputSize != null) {
                builder.maxInputSize(maxInputSize.longValue());
            }
            Number maxLineLength = number(data, "maxLineLength");
            if (maxLineLength != null) {
                builder.maxLineLength(maxLineLength.intValue());
            }
            Number parallelism = number(data, "parallelism");
            if (parallelism != null) {
                builder.parallelism(parallelism.intValue());
            }
            Object strip = data.get("stripComments");
            if (strip != null) {
                if (!(strip instanceof Boolean b)) {
                    throw new IOException("'stripComments' must be true or false");
                }
                builder.stripComments(b);
            }
            Object confidence = data.get("confidence");
            if (confidence != null) {
                if (!(confidence instanceof Map<?, ?> weights)) {
                    throw new IOException("'confidence' must be a mapping");
                }
                builder.confidence(toWeights(weights));
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid config: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static ConfidenceWeights toWeights(Map<?, ?> map) throws IOException {
        ConfidenceWeights d = ConfidenceWeights.defaults();
        List<String> keywords = d.cryptoFunctionKeywords();
        Object kw = map.get("cryptoFunctionKeywords");
        if (kw != null) {
            keywords = List.copyOf(toSet(kw, "cryptoFunctionKeywords"));
        }
        return new ConfidenceWeights(
                doubleOr(map, "textBase", d.textBase()),
                doubleOr(map, "callShapeBase", d.callShapeBase()),
                doubleOr(map, "importCorroboratedBase", d.importCorroboratedBase()),
                doubleOr(map, "cryptoFunctionBoost", d.cryptoFunctionBoost()),
                doubleOr(map, "corroboratingImportBoost", d.corroboratingImportBoost()),
                doubleOr(map, "labelLiteralPenalty", d.labelLiteralPenalty()),
                keywords);
    }

    private static double doubleOr(Map<?, ?> map, String key, double fallback) throws IOException {
        Number value = number(map, key);
        return value != null ? value.doubleValue() : fallback;
    }

    private static Number number(Map<?, ?> map, String key) throws IOException {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number n)) {
            throw new IOException("'" + key + "' must be a number, got: " + value);
        }
        return n;
    }

    private static Set<String> toSet(Object value, String key) throws IOException {
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IOException("'" + key + "' must be a list");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }

    public Severity getSeverityThreshold() {
        return severityThreshold;
    }

    public Set<String> getIncludePatterns() {
        return includePatterns;
    }

    public Set<String> getExcludePatterns() {
        return excludePatterns;
    }

    public long getMaxInputSize() {
        return maxInputSize;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public boolean isStripComments() {
        return stripComments;
    }

    public int getParallelism() {
        return parallelism;
    }

    public ConfidenceWeights getConfidence() {
        return confidence;
    }

    /**
     * Returns true if findings of the given pattern may appear in a report.
     * An empty include list admits every pattern not explicitly excluded.
     */
    public boolean admitsPattern(String patternId) {
        if (excludePatterns.contains(patternId)) {
            return false;
        }
        return includePatterns.isEmpty() || includePatterns.contains(patternId);
    }

    @Override
    public String toString() {
        return "AuditConfig{" +
                "severityThreshold=" + severityThreshold +
                ", includePatterns=" + includePatterns +
                ", excludePatterns=" + excludePatterns +
                ", maxInputSize=" + maxInputSize +
                ", maxLineLength=" + maxLineLength +
                ", stripComments=" + stripComments +
                ", parallelism=" + parallelism +
                '}';
    }

    public static class Builder {
        private Severity severityThreshold = Severity.INFO;
        private Set<String> includePatterns = Set.of();
        private Set<String> excludePatterns = Set.of();
        private long maxInputSize = DEFAULT_MAX_INPUT_SIZE;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private boolean stripComments = true;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private ConfidenceWeights confidence = ConfidenceWeights.defaults();

        public Builder severityThreshold(Severity severityThreshold) {
            this.severityThreshold = severityThreshold != null ? severityThreshold : Severity.INFO;
            return this;
        }

        public Builder includePatterns(Collection<String> includePatterns) {
            this.includePatterns = includePatterns != null ? new LinkedHashSet<>(includePatterns) : Set.of();
            return this;
        }

        public Builder excludePatterns(Collection<String> excludePatterns) {
            this.excludePatterns = excludePatterns != null ? new LinkedHashSet<>(excludePatterns) : Set.of();
            return this;
        }

        public Builder maxInputSize(long maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder stripComments(boolean stripComments) {
            this.stripComments = stripComments;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder confidence(ConfidenceWeights confidence) {
            this.confidence = confidence != null ? confidence : ConfidenceWeights.defaults();
            return this;
        }

        public AuditConfig build() {
            return new AuditConfig(this);
        }
    }
}
