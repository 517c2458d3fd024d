package io.pqcscan.model;

import java.util.List;

/**
 * Counters summarizing an audit.
 *
 * @param filesScanned               Files that were parsed and analyzed
 * @param filesFailed                Files rejected or failed in a batch run
 * @param linesScanned               Total line count across analyzed files
 * @param quantumVulnerableFamilies  Distinct quantum-vulnerable families present, in declaration order
 * @param deprecatedFamilies         Distinct deprecated families present, in declaration order
 * @param recommendations            Migration advice for the families present
 */
public record AuditSummary(
        int filesScanned,
        int filesFailed,
        long linesScanned,
        List<PrimitiveFamily> quantumVulnerableFamilies,
        List<PrimitiveFamily> deprecatedFamilies,
        List<String> recommendations
) {
    public AuditSummary {
        quantumVulnerableFamilies = quantumVulnerableFamilies == null ? List.of() : List.copyOf(quantumVulnerableFamilies);
        deprecatedFamilies = deprecatedFamilies == null ? List.of() : List.copyOf(deprecatedFamilies);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
