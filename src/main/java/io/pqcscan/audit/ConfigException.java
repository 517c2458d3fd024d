package io.pqcscan.audit;

import java.util.List;

/**
 * Thrown when an {@link AuditEngine} is constructed from an invalid or
 * contradictory configuration. No scanning happens in that case.
 */
public class ConfigException extends Exception {

    private final List<String> problems;

    public ConfigException(List<String> problems) {
        super("Invalid audit configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String problem, Throwable cause) {
        super("Invalid audit configuration: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> problems() {
        return problems;
    }
}
