package io.pqcscan.model;

/**
 * Discrete bucket of a normalized risk score.
 */
public enum RiskLevel {
    /**
     * Normalized score above 8.0.
     */
    CATASTROPHIC("CATASTROPHIC"),

    /**
     * Normalized score in [5.0, 8.0].
     */
    HIGH("HIGH"),

    /**
     * Normalized score in [2.0, 5.0).
     */
    MEDIUM("MEDIUM"),

    /**
     * Normalized score below 2.0.
     */
    LOW("LOW");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Maps a normalized score onto its bucket.
     */
    public static RiskLevel fromScore(double score) {
        if (score > 8.0) {
            return CATASTROPHIC;
        }
        if (score >= 5.0) {
            return HIGH;
        }
        if (score >= 2.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
