package io.pqcscan.detectors;

import io.pqcscan.model.SourceLocation;

/**
 * A raw pattern match, before the audit turns it into a finding.
 *
 * @param patternId  Id of the matching pattern
 * @param location   Where the match starts
 * @param confidence Confidence in [0.0, 1.0]
 * @param keySize    Standard key size on the same line, or null
 */
public record Detection(
        String patternId,
        SourceLocation location,
        double confidence,
        Integer keySize
) {
    public Detection {
        if (patternId == null || patternId.isBlank()) {
            throw new IllegalArgumentException("patternId cannot be null or blank");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
    }
}
