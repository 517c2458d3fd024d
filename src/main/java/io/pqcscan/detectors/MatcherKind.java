package io.pqcscan.detectors;

import java.util.Locale;

/**
 * The closed set of matcher variants a catalog pattern can use.
 */
public enum MatcherKind {
    /**
     * Bare textual match anywhere in the code part of a line.
     */
    TEXT("text"),

    /**
     * Match on the shape of a call or constructor, e.g. {@code rsa.generate_private_key(}.
     */
    CALL_SHAPE("call-shape"),

    /**
     * Textual match that only counts when the file imports a corroborating module.
     * Used for tokens too ambiguous to report on their own, such as {@code EC}.
     */
    IMPORT_CORROBORATED("import-corroborated");

    private final String id;

    MatcherKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static MatcherKind parse(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        String key = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (MatcherKind kind : values()) {
            if (kind.id.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown matcher kind: " + value);
    }
}
