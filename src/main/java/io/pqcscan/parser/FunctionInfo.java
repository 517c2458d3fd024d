package io.pqcscan.parser;

/**
 * Best-effort function or method boundary.
 *
 * @param name      Function name as written
 * @param startLine 1-based line of the header
 * @param endLine   1-based last line of the body (inclusive)
 */
public record FunctionInfo(String name, int startLine, int endLine) {

    public FunctionInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid function range " + startLine + ".." + endLine);
        }
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
