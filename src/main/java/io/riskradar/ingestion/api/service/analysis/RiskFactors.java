package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.Severity;

/**
 * Inputs to {@link RiskScorer}. {@code sourceType} is a source-type key such as "government".
 */
public record RiskFactors(
        String id,
        Severity severity,
        double confidence,
        double sentiment,
        String sourceType
) {
    public RiskFactors {
        severity = severity != null ? severity : Severity.MEDIUM;
        sourceType = sourceType != null ? sourceType : "unknown";
    }
}
