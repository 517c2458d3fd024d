package io.pqcscan.parser;

/**
 * Thrown when content cannot be parsed at all. Everything short of this is
 * absorbed into a degraded {@link ParsedFile}.
 */
public class SourceParseException extends Exception {

    /**
     * Why parsing was refused.
     */
    public enum Reason {
        INPUT_TOO_LARGE
    }

    private final Reason reason;

    public SourceParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static SourceParseException inputTooLarge(long size, long max) {
        return new SourceParseException(Reason.INPUT_TOO_LARGE,
                "Source too large: " + size + " bytes (max: " + max + ")");
    }
}
