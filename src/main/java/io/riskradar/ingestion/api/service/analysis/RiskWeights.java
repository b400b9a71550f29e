package io.riskradar.ingestion.api.service.analysis;

public record RiskWeights(
        double severity,
        double confidence,
        double sentiment,
        double sourceReliability
) {
    public static final double TOLERANCE = 0.01;

    public static RiskWeights defaults() {
        return new RiskWeights(0.35, 0.25, 0.20, 0.20);
    }

    public double total() {
        return severity + confidence + sentiment + sourceReliability;
    }

    public boolean isNormalized() {
        return Math.abs(total() - 1.0) <= TOLERANCE;
    }
}
