package io.pqcscan.model;

/**
 * Aggregate risk derived from a set of findings.
 *
 * @param total         Normalized score (weighted findings per 1000 lines, never below 0)
 * @param weightedSum   Sum of severity weight times confidence before normalization
 * @param critical      Number of critical findings
 * @param high          Number of high findings
 * @param medium        Number of medium findings
 * @param low           Number of low findings
 * @param info          Number of informational findings
 * @param riskLevel     Bucket of {@code total}
 */
public record RiskScore(
        double total,
        double weightedSum,
        int critical,
        int high,
        int medium,
        int low,
        int info,
        RiskLevel riskLevel
) {
    public RiskScore {
        if (Double.isNaN(total) || total < 0.0) {
            throw new IllegalArgumentException("total must be >= 0, got " + total);
        }
        if (riskLevel == null) {
            riskLevel = RiskLevel.fromScore(total);
        }
    }

    /**
     * Score of an audit with no findings.
     */
    public static RiskScore zero() {
        return new RiskScore(0.0, 0.0, 0, 0, 0, 0, 0, RiskLevel.LOW);
    }

    public int count(Severity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
            case INFO -> info;
        };
    }

    public int totalFindings() {
        return critical + high + medium + low + info;
    }
}
