package io.pqcscan.audit;

/**
 * Thrown when a single audit call cannot be completed.
 */
public class AuditException extends Exception {

    public enum Kind {
        /**
         * The caller's input was rejected before parsing (bad path, oversized payload).
         */
        INVALID_INPUT,

        /**
         * An unexpected failure inside the engine. Only the current call is affected.
         */
        INTERNAL
    }

    private final Kind kind;

    public AuditException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuditException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static AuditException invalidInput(String message) {
        return new AuditException(Kind.INVALID_INPUT, message);
    }

    public static AuditException internal(String message, Throwable cause) {
        return new AuditException(Kind.INTERNAL, message, cause);
    }
}
