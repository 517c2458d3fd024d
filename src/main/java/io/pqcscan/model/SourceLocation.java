package io.pqcscan.model;

/**
 * Position of a match in a scanned file.
 *
 * @param path    Path (or language hint) the content was submitted under
 * @param line    1-based line number
 * @param column  1-based column of the first matched character
 * @param snippet Trimmed source line, truncated for display
 */
public record SourceLocation(
        String path,
        int line,
        int column,
        String snippet
) {
    public static final int MAX_SNIPPET_LENGTH = 200;

    public SourceLocation {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1, got " + column);
        }
        if (snippet == null) {
            snippet = "";
        }
    }

    /**
     * Builds a display snippet from a raw source line.
     */
    public static String snippetOf(String rawLine) {
        if (rawLine == null) {
            return "";
        }
        String trimmed = rawLine.strip();
        if (trimmed.length() > MAX_SNIPPET_LENGTH) {
            return trimmed.substring(0, MAX_SNIPPET_LENGTH) + "...";
        }
        return trimmed;
    }

    /**
     * Returns "path:line:column".
     */
    public String display() {
        return path + ":" + line + ":" + column;
    }
}
