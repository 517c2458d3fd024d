package io.pqcscan.detectors;

/**
 * Thrown when a detector cannot be built because a pattern's matcher is malformed
 * or could backtrack without bound.
 */
public class DetectionException extends Exception {

    private final String patternId;

    public DetectionException(String patternId, String message) {
        super("Pattern '" + patternId + "': " + message);
        this.patternId = patternId;
    }

    public DetectionException(String patternId, String message, Throwable cause) {
        super("Pattern '" + patternId + "': " + message, cause);
        this.patternId = patternId;
    }

    public String patternId() {
        return patternId;
    }
}
