package io.riskradar.ingestion.api.dto;

/**
 * Optional qualitative assessment supplied by an analyst.
 *
 * @param businessImpact 0..10
 * @param urgency        0..10
 * @param likelihood     0..1
 */
public record RiskAssessment(
        String incidentId,
        double businessImpact,
        double urgency,
        double likelihood,
        String trendDirection
) {
    public RiskAssessment {
        businessImpact = Math.max(0.0, Math.min(10.0, businessImpact));
        urgency = Math.max(0.0, Math.min(10.0, urgency));
        likelihood = Math.max(0.0, Math.min(1.0, likelihood));
    }
}
