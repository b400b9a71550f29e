package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.Severity;
import io.riskradar.ingestion.api.exception.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted combination of severity, confidence, sentiment and source reliability into a risk
 * score on [0,1].
 */
@Component
public class RiskScorer {

    private static final Logger logger = LoggerFactory.getLogger(RiskScorer.class);

    private static final Map<Severity, Double> SEVERITY_SCORES = new EnumMap<>(Map.of(
            Severity.CRITICAL, 1.0,
            Severity.HIGH, 0.8,
            Severity.MEDIUM, 0.5,
            Severity.LOW, 0.2,
            Severity.INFO, 0.1));

    private static final Map<String, Double> SOURCE_SCORES = Map.of(
            "government", 0.9,
            "news", 0.7,
            "social", 0.4,
            "social_media", 0.4,
            "blog", 0.5,
            "forum", 0.3,
            "other", 0.3);

    static final double UNKNOWN_SEVERITY_SCORE = 0.5;
    static final double UNKNOWN_SOURCE_SCORE = 0.3;

    private volatile RiskWeights weights = RiskWeights.defaults();

    public double score(Severity severity, double confidence, double sentiment, String sourceType) {
        if (Double.isNaN(confidence) || Double.isNaN(sentiment)) {
            throw new ScoringException("Confidence and sentiment must be numbers");
        }

        RiskWeights current = weights;

        double severityComponent = severity != null
                ? SEVERITY_SCORES.get(severity)
                : UNKNOWN_SEVERITY_SCORE;
        double confidenceComponent = clamp(confidence, 0.0, 1.0);
        double sentimentComponent = Math.max(0.0, (1.0 - clamp(sentiment, -1.0, 1.0)) / 2.0);
        double sourceComponent = sourceScore(sourceType);

        double risk = severityComponent * current.severity()
                + confidenceComponent * current.confidence()
                + sentimentComponent * current.sentiment()
                + sourceComponent * current.sourceReliability();

        return clamp(risk, 0.0, 1.0);
    }

    public double score(RiskFactors factors) {
        return score(factors.severity(), factors.confidence(), factors.sentiment(), factors.sourceType());
    }

    public String level(double score) {
        if (score >= 0.8) return "critical";
        if (score >= 0.6) return "high";
        if (score >= 0.4) return "medium";
        if (score >= 0.2) return "low";
        return "minimal";
    }

    /**
     * Scores each entry and reports its level and the components that went in.
     */
    public List<Map<String, Object>> scoreBatch(List<RiskFactors> batch) {
        return batch.stream()
                .map(factors -> {
                    double risk = score(factors);

                    Map<String, Object> components = new LinkedHashMap<>();
                    components.put("severity", factors.severity().key());
                    components.put("confidence", factors.confidence());
                    components.put("sentiment", factors.sentiment());
                    components.put("source_type", factors.sourceType());

                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("incident_id", factors.id());
                    result.put("risk_score", risk);
                    result.put("risk_level", level(risk));
                    result.put("components", components);
                    return result;
                })
                .toList();
    }

    /**
     * Replaces the weights if they sum to 1.0 within {@link RiskWeights#TOLERANCE}.
     *
     * @return {@code false} with the current weights unchanged when rejected
     */
    public boolean updateWeights(RiskWeights newWeights) {
        if (newWeights == null || !newWeights.isNormalized()) {
            logger.warn("Rejected risk weights {}: total {} is not 1.0",
                    newWeights, newWeights != null ? newWeights.total() : null);
            return false;
        }

        weights = newWeights;
        logger.info("Updated risk weights: {}", newWeights);
        return true;
    }

    public RiskWeights weights() {
        return weights;
    }

    /**
     * Converts a [0,1] risk score onto the 0..10 incident scale.
     */
    public static double toIncidentScale(double risk) {
        return clamp(risk * 10.0, 0.0, 10.0);
    }

    static double sourceScore(String sourceType) {
        if (sourceType == null) return UNKNOWN_SOURCE_SCORE;
        return SOURCE_SCORES.getOrDefault(sourceType.toLowerCase(Locale.ROOT), UNKNOWN_SOURCE_SCORE);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
