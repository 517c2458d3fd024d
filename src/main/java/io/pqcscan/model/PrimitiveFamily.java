package io.pqcscan.model;

import java.util.Locale;

/**
 * Class of cryptographic algorithm a pattern targets.
 */
public enum PrimitiveFamily {
    INTEGER_FACTORIZATION("Integer-factorization public key", true, false),
    ELLIPTIC_CURVE("Elliptic-curve public key", true, false),
    DISCRETE_LOG("Finite-field discrete-log signature", true, false),
    KEY_EXCHANGE("Classical key exchange", true, false),
    BROKEN_HASH("Broken hash function", false, true),
    DEPRECATED_CIPHER("Deprecated symmetric cipher", false, true),
    DEPRECATED_PROTOCOL("Deprecated secure-channel protocol", false, true),
    WEAK_RANDOM("Non-cryptographic randomness", false, true);

    private final String displayName;
    private final boolean quantumVulnerable;
    private final boolean deprecated;

    PrimitiveFamily(String displayName, boolean quantumVulnerable, boolean deprecated) {
        this.displayName = displayName;
        this.quantumVulnerable = quantumVulnerable;
        this.deprecated = deprecated;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * True if a large quantum computer breaks this family (Shor's algorithm).
     */
    public boolean quantumVulnerable() {
        return quantumVulnerable;
    }

    /**
     * True if the family is classically weak and already deprecated.
     */
    public boolean deprecated() {
        return deprecated;
    }

    public static PrimitiveFamily parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Primitive family cannot be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
