package io.pqcscan.model;

/**
 * A file that could not be analyzed in a batch audit.
 *
 * @param path    Path the content was submitted under
 * @param kind    Failure category, e.g. INVALID_INPUT or INTERNAL
 * @param message Human-readable reason
 */
public record FileError(
        String path,
        String kind,
        String message
) {
}
