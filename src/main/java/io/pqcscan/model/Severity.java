package io.pqcscan.model;

import java.util.Locale;

/**
 * Severity of a cryptographic finding.
 * Lower rank = more severe.
 */
public enum Severity {
    /**
     * Critical - key material for a quantum-vulnerable scheme is created or a
     * key size is already classically breakable.
     */
    CRITICAL(1, "CRITICAL", 10.0),

    /**
     * High - quantum-vulnerable or broken primitive in active use.
     * Examples: RSA encryption, ECDSA signing, MD5 digests.
     */
    HIGH(2, "HIGH", 7.0),

    /**
     * Medium - deprecated but not yet broken in practice.
     * Examples: 3DES, ECB mode, TLS 1.0.
     */
    MEDIUM(3, "MEDIUM", 4.0),

    /**
     * Low - weak hygiene worth reviewing.
     */
    LOW(4, "LOW", 1.0),

    /**
     * Informational - inventory only, does not contribute to risk.
     */
    INFO(5, "INFO", 0.0);

    private final int rank;
    private final String label;
    private final double riskWeight;

    Severity(int rank, String label, double riskWeight) {
        this.rank = rank;
        this.label = label;
        this.riskWeight = riskWeight;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Weight of a finding of this severity in the aggregate risk score.
     */
    public double riskWeight() {
        return riskWeight;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a severity name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not a known severity
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity cannot be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> CRITICAL;
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            case "low" -> LOW;
            case "info" -> INFO;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}
