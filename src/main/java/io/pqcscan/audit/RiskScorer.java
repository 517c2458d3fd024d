package io.pqcscan.audit;

import io.pqcscan.model.Finding;
import io.pqcscan.model.RiskLevel;
import io.pqcscan.model.RiskScore;

import java.util.List;

/**
 * Computes the aggregate risk of a finding set.
 * <p>
 * {@code weightedSum = sum(severityWeight x confidence)} and
 * {@code total = weightedSum / max(1, linesScanned / 1000)}, so the score is a
 * density per thousand lines that never rewards files for being short.
 */
class RiskScorer {

    RiskScore score(List<Finding> findings, long linesScanned) {
        if (findings.isEmpty()) {
            return RiskScore.zero();
        }
        double weightedSum = 0.0;
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        int info = 0;
        for (Finding finding : findings) {
            weightedSum += finding.severity().riskWeight() * finding.confidence();
            switch (finding.severity()) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
                case INFO -> info++;
            }
        }
        double total = normalize(weightedSum, linesScanned);
        return new RiskScore(total, weightedSum, critical, high, medium, low, info, RiskLevel.fromScore(total));
    }

    static double normalize(double weightedSum, long linesScanned) {
        double denominator = Math.max(1.0, linesScanned / 1000.0);
        return Math.max(0.0, weightedSum / denominator);
    }
}
