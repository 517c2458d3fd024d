package io.pqcscan.audit;

import io.pqcscan.parser.SourceDecoder;

/**
 * Rejects inputs that must not reach the parser.
 */
class InputValidator {

    private final long maxInputSize;

    InputValidator(long maxInputSize) {
        this.maxInputSize = maxInputSize;
    }

    /**
     * Checks a submitted path. Blank paths, NUL characters and any ".."
     * segment are refused.
     */
    void validatePath(String path) throws AuditException {
        if (path == null || path.isBlank()) {
            throw AuditException.invalidInput("Path cannot be blank");
        }
        if (path.indexOf('\0') >= 0) {
            throw AuditException.invalidInput("Path contains a NUL character");
        }
        for (String segment : path.split("[/\\\\]")) {
            if (segment.equals("..")) {
                throw AuditException.invalidInput("Path traversal rejected: " + path);
            }
        }
    }

    void validateSize(long bytes, String path) throws AuditException {
        if (bytes > maxInputSize) {
            throw AuditException.invalidInput(
                    "Input too large: " + path + " is " + bytes + " bytes (max: " + maxInputSize + ")");
        }
    }

    void validate(String content, String path) throws AuditException {
        validatePath(path);
        validateSize(SourceDecoder.utf8Length(content), path);
    }
}
