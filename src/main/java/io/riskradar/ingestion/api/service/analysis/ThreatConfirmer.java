package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.ConfirmationStats;
import io.riskradar.ingestion.api.dto.Decision;
import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.RiskAssessment;
import io.riskradar.ingestion.api.dto.ThreatEvaluation;
import io.riskradar.ingestion.api.exception.ScoringException;
import io.riskradar.ingestion.config.RiskRadarConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides whether a scored candidate is a confirmed threat.
 * <p>
 * Seven factors, each normalized to 0..10, are combined with fixed weights; the candidate is
 * confirmed when the result reaches {@link ConfirmationCriteria#minRiskScore()} (inclusive).
 * Evaluation never throws: a malformed candidate yields an unconfirmed zero-score decision.
 * <p>
 * Criteria are swapped atomically. An evaluation reads the criteria once and uses that
 * snapshot throughout.
 */
@Component
public class ThreatConfirmer {

    private static final Logger logger = LoggerFactory.getLogger(ThreatConfirmer.class);

    static final String BASE_RISK = "base_risk_score";
    static final String CONFIDENCE = "confidence_factor";
    static final String SENTIMENT = "sentiment_factor";
    static final String SOURCE = "source_factor";
    static final String KEYWORD = "keyword_factor";
    static final String PATTERN = "pattern_factor";
    static final String ASSESSMENT = "assessment_factor";

    static final double BASE_RISK_WEIGHT = 0.30;
    static final double CONFIDENCE_WEIGHT = 0.15;
    static final double SENTIMENT_WEIGHT = 0.15;
    static final double SOURCE_WEIGHT = 0.15;
    static final double KEYWORD_WEIGHT = 0.10;
    static final double PATTERN_WEIGHT = 0.10;
    static final double ASSESSMENT_WEIGHT = 0.05;

    static final double NEUTRAL = 5.0;
    static final double STRONG = 7.0;
    static final double MAX_FACTOR = 10.0;

    private final AtomicReference<ConfirmationCriteria> criteria;
    private final Clock clock;

    @Autowired
    public ThreatConfirmer(RiskRadarConfig config) {
        this(config.confirmation(), Clock.systemDefaultZone());
    }

    public ThreatConfirmer(ConfirmationCriteria criteria, Clock clock) {
        this.criteria = new AtomicReference<>(criteria != null ? criteria : ConfirmationCriteria.defaults());
        this.clock = clock;
    }

    public Decision evaluate(IncidentCandidate candidate) {
        return evaluate(candidate, null, List.of());
    }

    public Decision evaluate(IncidentCandidate candidate, RiskAssessment assessment, List<IncidentCandidate> history) {
        ConfirmationCriteria snapshot = criteria.get();

        try {
            validate(candidate);

            Map<String, Double> factors = new LinkedHashMap<>();
            factors.put(BASE_RISK, candidate.riskScore());
            factors.put(CONFIDENCE, confidenceFactor(candidate, snapshot));
            factors.put(SENTIMENT, sentimentFactor(candidate, snapshot));
            factors.put(SOURCE, sourceFactor(candidate, snapshot));
            factors.put(KEYWORD, keywordFactor(candidate, snapshot));
            factors.put(PATTERN, historicalFactor(candidate, history, snapshot));
            factors.put(ASSESSMENT, assessmentFactor(assessment));

            double score = factors.get(BASE_RISK) * BASE_RISK_WEIGHT
                    + factors.get(CONFIDENCE) * CONFIDENCE_WEIGHT
                    + factors.get(SENTIMENT) * SENTIMENT_WEIGHT
                    + factors.get(SOURCE) * SOURCE_WEIGHT
                    + factors.get(KEYWORD) * KEYWORD_WEIGHT
                    + factors.get(PATTERN) * PATTERN_WEIGHT
                    + factors.get(ASSESSMENT) * ASSESSMENT_WEIGHT;

            boolean confirmed = score >= snapshot.minRiskScore();

            logger.info("Threat evaluation for '{}': score={}, confirmed={}",
                    abbreviate(candidate.title()), String.format(Locale.ROOT, "%.2f", score), confirmed);

            return new Decision(confirmed, score, explain(candidate, score, factors, confirmed), factors);

        } catch (RuntimeException e) {
            logger.error("Error evaluating incident {}: {}",
                    candidate != null ? candidate.id() : null, e.getMessage());
            return Decision.error(e.getMessage());
        }
    }

    /**
     * Evaluates each candidate against the same history, in order.
     */
    public List<ThreatEvaluation> bulkEvaluate(List<IncidentCandidate> candidates, List<IncidentCandidate> history) {
        return candidates.stream()
                .map(candidate -> new ThreatEvaluation(candidate, evaluate(candidate, null, history)))
                .toList();
    }

    public void updateCriteria(ConfirmationCriteria newCriteria) {
        if (newCriteria == null) {
            throw new IllegalArgumentException("Confirmation criteria must not be null");
        }
        criteria.set(newCriteria);
        logger.info("Threat confirmation criteria updated: {}", newCriteria);
    }

    public ConfirmationCriteria criteria() {
        return criteria.get();
    }

    public ConfirmationStats stats(List<ThreatEvaluation> evaluations) {
        if (evaluations.isEmpty()) return ConfirmationStats.empty();

        List<ThreatEvaluation> confirmed = evaluations.stream()
                .filter(evaluation -> evaluation.decision().confirmed())
                .toList();

        Map<String, Integer> severityDistribution = new TreeMap<>();
        double scoreTotal = 0.0;
        for (ThreatEvaluation evaluation : confirmed) {
            scoreTotal += evaluation.decision().score();
            if (evaluation.candidate().severity() != null) {
                severityDistribution.merge(evaluation.candidate().severity().key(), 1, Integer::sum);
            }
        }

        return new ConfirmationStats(
                evaluations.size(),
                confirmed.size(),
                confirmed.isEmpty() ? 0.0 : scoreTotal / confirmed.size(),
                severityDistribution,
                (double) confirmed.size() / evaluations.size());
    }

    private void validate(IncidentCandidate candidate) {
        if (candidate == null) {
            throw new ScoringException("Candidate is null");
        }
        if (candidate.severity() == null) {
            throw new ScoringException("Candidate " + candidate.id() + " has no severity");
        }
        if (candidate.title() == null) {
            throw new ScoringException("Candidate " + candidate.id() + " has no title");
        }
    }

    double confidenceFactor(IncidentCandidate candidate, ConfirmationCriteria criteria) {
        double confidence = candidate.confidenceScore();
        return confidence >= criteria.minConfidence() ? confidence * 10 : confidence * 5;
    }

    double sentimentFactor(IncidentCandidate candidate, ConfirmationCriteria criteria) {
        double sentiment = candidate.sentimentScore();

        if (sentiment <= criteria.maxNegativeSentiment()) return Math.abs(sentiment) * 8;
        if (sentiment < 0) return Math.abs(sentiment) * 5;
        if (sentiment < 0.3) return 3.0;
        return Math.max(1.0, 3.0 - sentiment * 2);
    }

    double sourceFactor(IncidentCandidate candidate, ConfirmationCriteria criteria) {
        double reliability = criteria.sourceWeight(candidate.sourceType()) * 10;

        // corroborated by more than one source
        if (candidate.sourceUrls().size() > 1) {
            reliability *= 1.2;
        }
        return Math.min(MAX_FACTOR, reliability);
    }

    double keywordFactor(IncidentCandidate candidate, ConfirmationCriteria criteria) {
        int count = candidate.keywords().size();
        return count >= criteria.minKeywordMatches()
                ? Math.min(MAX_FACTOR, count * 2.0)
                : count * 1.5;
    }

    double historicalFactor(IncidentCandidate candidate, List<IncidentCandidate> history,
                            ConfirmationCriteria criteria) {
        if (history == null || history.isEmpty()) return NEUTRAL;

        LocalDateTime cutoff = LocalDateTime.now(clock).minus(criteria.recentIncidentWindow());
        Set<String> keywords = new HashSet<>(candidate.keywords());

        List<IncidentCandidate> similar = history.stream()
                .filter(previous -> previous.createdAt() != null && !previous.createdAt().isBefore(cutoff))
                .filter(previous -> previous.keywords().stream().anyMatch(keywords::contains))
                .toList();

        if (similar.isEmpty()) return NEUTRAL;

        double averageRisk = similar.stream()
                .mapToDouble(IncidentCandidate::riskScore)
                .average()
                .orElse(0.0);
        return Math.min(MAX_FACTOR, averageRisk * criteria.escalationFactor());
    }

    double assessmentFactor(RiskAssessment assessment) {
        if (assessment == null) return NEUTRAL;
        return (assessment.businessImpact() * 0.6 + assessment.urgency() * 0.4) * assessment.likelihood();
    }

    private String explain(IncidentCandidate candidate, double score, Map<String, Double> factors, boolean confirmed) {
        StringBuilder reason = new StringBuilder();
        if (confirmed) {
            reason.append(String.format(Locale.ROOT, "THREAT CONFIRMED (Score: %.1f/10)\n", score));
            reason.append("Contributing factors:\n");
        } else {
            reason.append(String.format(Locale.ROOT, "Threat not confirmed (Score: %.1f/10)\n", score));
            reason.append("Limiting factors:\n");
        }

        describe(reason, factors.get(CONFIDENCE),
                String.format(Locale.ROOT, "High confidence (%.2f)", candidate.confidenceScore()),
                String.format(Locale.ROOT, "Low confidence (%.2f)", candidate.confidenceScore()));
        describe(reason, factors.get(SENTIMENT),
                String.format(Locale.ROOT, "Negative sentiment indicates threat (%.2f)", candidate.sentimentScore()),
                String.format(Locale.ROOT, "Positive/neutral sentiment (%.2f)", candidate.sentimentScore()));
        describe(reason, factors.get(SOURCE),
                "Reliable source type (" + candidate.sourceType() + ")",
                "Lower reliability source (" + candidate.sourceType() + ")");
        describe(reason, factors.get(KEYWORD),
                "Strong keyword matches (" + candidate.keywords().size() + " keywords)",
                "Limited keyword matches (" + candidate.keywords().size() + " keywords)");
        describe(reason, factors.get(PATTERN),
                "Similar recent incidents detected (escalating pattern)",
                "No escalating pattern in recent incidents");
        describe(reason, factors.get(ASSESSMENT),
                "Analyst assessment indicates high impact",
                "Analyst assessment indicates limited impact");

        reason.append("\nSeverity: ").append(candidate.severity().name());
        reason.append("\nKeywords: ").append(String.join(", ", candidate.keywords()));
        return reason.toString();
    }

    private static void describe(StringBuilder reason, double factor, String strong, String weak) {
        if (factor >= STRONG) {
            reason.append("+ ").append(strong).append('\n');
        } else if (factor < NEUTRAL) {
            reason.append("- ").append(weak).append('\n');
        }
    }

    private static String abbreviate(String title) {
        return title.length() <= 50 ? title : title.substring(0, 50) + "...";
    }
}
