package io.pqcscan.model;

/**
 * A single confidence-scored report of one pattern match at one location.
 *
 * @param id                Stable id derived from pattern and location
 * @param patternId         Id of the catalog pattern that matched
 * @param patternName       Human-readable pattern name
 * @param severity          Severity of the pattern
 * @param primitiveFamily   Family of the matched primitive
 * @param location          Where the match occurred
 * @param description       What was found
 * @param recommendation    Suggested replacement or action
 * @param confidence        Confidence in [0.0, 1.0]
 * @param quantumVulnerable True if the primitive is breakable by a quantum computer
 * @param keySize           Modulus/key size seen on the same line, or null
 */
public record Finding(
        String id,
        String patternId,
        String patternName,
        Severity severity,
        PrimitiveFamily primitiveFamily,
        SourceLocation location,
        String description,
        String recommendation,
        double confidence,
        boolean quantumVulnerable,
        Integer keySize
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (patternId == null || patternId.isBlank()) {
            throw new IllegalArgumentException("patternId cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (primitiveFamily == null) {
            throw new IllegalArgumentException("primitiveFamily cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        if (patternName == null) {
            patternName = patternId;
        }
    }

    /**
     * Builder for creating Finding instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String patternId;
        private String patternName;
        private Severity severity;
        private PrimitiveFamily primitiveFamily;
        private SourceLocation location;
        private String description;
        private String recommendation;
        private double confidence;
        private boolean quantumVulnerable;
        private Integer keySize;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder patternId(String patternId) {
            this.patternId = patternId;
            return this;
        }

        public Builder patternName(String patternName) {
            this.patternName = patternName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder primitiveFamily(PrimitiveFamily primitiveFamily) {
            this.primitiveFamily = primitiveFamily;
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder quantumVulnerable(boolean quantumVulnerable) {
            this.quantumVulnerable = quantumVulnerable;
            return this;
        }

        public Builder keySize(Integer keySize) {
            this.keySize = keySize;
            return this;
        }

        public Finding build() {
            return new Finding(
                    id,
                    patternId,
                    patternName,
                    severity,
                    primitiveFamily,
                    location,
                    description,
                    recommendation,
                    confidence,
                    quantumVulnerable,
                    keySize
            );
        }
    }

    /**
     * Returns the file path of the finding.
     */
    public String path() {
        return location.path();
    }

    /**
     * Returns the line number of the finding.
     */
    public int line() {
        return location.line();
    }
}
