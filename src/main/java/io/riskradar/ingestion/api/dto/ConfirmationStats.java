package io.riskradar.ingestion.api.dto;

import java.util.Map;

/**
 * Aggregate view over a set of evaluations. Severity distribution and average score cover
 * confirmed threats only.
 */
public record ConfirmationStats(
        int totalEvaluated,
        int totalConfirmations,
        double averageScore,
        Map<String, Integer> severityDistribution,
        double confirmationRate
) {
    public ConfirmationStats {
        severityDistribution = severityDistribution != null ? Map.copyOf(severityDistribution) : Map.of();
    }

    public static ConfirmationStats empty() {
        return new ConfirmationStats(0, 0, 0.0, Map.of(), 0.0);
    }
}
