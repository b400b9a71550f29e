package io.riskradar.ingestion.api.service.analysis;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Thresholds for confirming a candidate as a threat. Immutable; unset values take the defaults
 * below. Replace the whole instance to change criteria.
 *
 * @param minRiskScore          inclusive confirmation threshold on the 0..10 scale
 * @param maxNegativeSentiment  sentiment at or below this counts as very negative
 * @param minSourceReliability  reliability considered trustworthy; informational
 * @param recentIncidentWindow  how far back historical incidents count as recent
 * @param escalationFactor      multiplier on the mean risk of similar recent incidents
 */
public record ConfirmationCriteria(
        Double minRiskScore,
        Double minConfidence,
        Double maxNegativeSentiment,
        Double minSourceReliability,
        Integer minKeywordMatches,
        Duration recentIncidentWindow,
        Double escalationFactor,
        Map<String, Double> sourceTypeWeights
) {
    public static final double DEFAULT_MIN_RISK_SCORE = 6.0;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.7;
    public static final double DEFAULT_MAX_NEGATIVE_SENTIMENT = -0.3;
    public static final double DEFAULT_MIN_SOURCE_RELIABILITY = 0.8;
    public static final int DEFAULT_MIN_KEYWORD_MATCHES = 2;
    public static final Duration DEFAULT_RECENT_WINDOW = Duration.ofHours(24);
    public static final double DEFAULT_ESCALATION_FACTOR = 1.2;
    public static final double UNKNOWN_SOURCE_WEIGHT = 0.5;

    public static final Map<String, Double> DEFAULT_SOURCE_TYPE_WEIGHTS = Map.of(
            "government", 1.0,
            "news", 0.9,
            "blog", 0.8,
            "social", 0.6,
            "social_media", 0.6,
            "forum", 0.5,
            "other", 0.4);

    public ConfirmationCriteria {
        minRiskScore = minRiskScore != null ? minRiskScore : DEFAULT_MIN_RISK_SCORE;
        minConfidence = minConfidence != null ? minConfidence : DEFAULT_MIN_CONFIDENCE;
        maxNegativeSentiment = maxNegativeSentiment != null ? maxNegativeSentiment : DEFAULT_MAX_NEGATIVE_SENTIMENT;
        minSourceReliability = minSourceReliability != null ? minSourceReliability : DEFAULT_MIN_SOURCE_RELIABILITY;
        minKeywordMatches = minKeywordMatches != null ? minKeywordMatches : DEFAULT_MIN_KEYWORD_MATCHES;
        recentIncidentWindow = recentIncidentWindow != null ? recentIncidentWindow : DEFAULT_RECENT_WINDOW;
        escalationFactor = escalationFactor != null ? escalationFactor : DEFAULT_ESCALATION_FACTOR;
        sourceTypeWeights = sourceTypeWeights != null && !sourceTypeWeights.isEmpty()
                ? Map.copyOf(sourceTypeWeights)
                : DEFAULT_SOURCE_TYPE_WEIGHTS;
    }

    public static ConfirmationCriteria defaults() {
        return new ConfirmationCriteria(null, null, null, null, null, null, null, null);
    }

    public double sourceWeight(String sourceType) {
        if (sourceType == null) return UNKNOWN_SOURCE_WEIGHT;
        return sourceTypeWeights.getOrDefault(sourceType.toLowerCase(Locale.ROOT), UNKNOWN_SOURCE_WEIGHT);
    }

    public ConfirmationCriteria withMinRiskScore(double value) {
        return new ConfirmationCriteria(value, minConfidence, maxNegativeSentiment, minSourceReliability,
                minKeywordMatches, recentIncidentWindow, escalationFactor, sourceTypeWeights);
    }
}
