package io.pqcscan.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Complete audit result: ordered findings, risk score, summary and metadata.
 *
 * @param findings  Findings sorted by path, line, pattern id and column
 * @param riskScore Aggregate risk over {@code findings}
 * @param summary   Counters for the audit
 * @param metadata  Tool version, caller timestamp and per-file errors
 */
public record AuditReport(
        List<Finding> findings,
        RiskScore riskScore,
        AuditSummary summary,
        ReportMetadata metadata
) {
    /**
     * Compact constructor with validation.
     */
    public AuditReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (riskScore == null) {
            throw new IllegalArgumentException("riskScore cannot be null");
        }
        if (summary == null) {
            throw new IllegalArgumentException("summary cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
    }

    /**
     * Returns findings filtered by minimum severity.
     */
    public List<Finding> findingsAtLeast(Severity minimum) {
        return findings.stream()
                .filter(f -> f.severity().isAtLeast(minimum))
                .toList();
    }

    /**
     * Returns findings grouped by severity.
     */
    public Map<Severity, List<Finding>> findingsBySeverity() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::severity));
    }

    /**
     * Returns findings grouped by primitive family.
     */
    public Map<PrimitiveFamily, List<Finding>> findingsByFamily() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::primitiveFamily));
    }

    /**
     * Returns true if any finding is at or above the given severity.
     */
    public boolean hasFindingsAtLeast(Severity minimum) {
        return findings.stream().anyMatch(f -> f.severity().isAtLeast(minimum));
    }

    public int totalFindings() {
        return findings.size();
    }
}
