package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.Severity;
import io.riskradar.ingestion.api.exception.ScoringException;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RiskScorerTest {

    private RiskScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RiskScorer();
    }

    @Test
    @DisplayName("Should keep every score within [0,1]")
    void shouldKeepScoresWithinUnitRange() {
        double[] confidences = {-1.0, 0.0, 0.5, 1.0, 2.0};
        double[] sentiments = {-5.0, -1.0, 0.0, 1.0, 5.0};
        String[] sourceTypes = {"government", "news", "social", "blog", "forum", "mystery", null};

        for (Severity severity : Severity.values()) {
            for (double confidence : confidences) {
                for (double sentiment : sentiments) {
                    for (String sourceType : sourceTypes) {
                        assertThat(scorer.score(severity, confidence, sentiment, sourceType))
                                .isBetween(0.0, 1.0);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Should combine components with default weights")
    void shouldCombineComponentsWithDefaultWeights() {
        // 1.0*.35 + 1.0*.25 + 1.0*.20 + 0.9*.20
        double risk = scorer.score(Severity.CRITICAL, 1.0, -1.0, "government");

        assertThat(risk).isCloseTo(0.98, within(1e-9));
        assertThat(scorer.level(risk)).isEqualTo("critical");
    }

    @Test
    @DisplayName("Should treat positive sentiment as no added risk")
    void shouldIgnorePositiveSentiment() {
        double neutral = scorer.score(Severity.LOW, 0.5, 1.0, "news");
        double negative = scorer.score(Severity.LOW, 0.5, -0.9, "news");

        assertThat(negative).isGreaterThan(neutral);
    }

    @Test
    @DisplayName("Should use the fallback score for unknown source types")
    void shouldFallBackForUnknownSourceType() {
        double unknown = scorer.score(Severity.MEDIUM, 0.5, 0.0, "pigeon");
        double other = scorer.score(Severity.MEDIUM, 0.5, 0.0, "other");

        assertThat(unknown).isEqualTo(other);
        assertThat(RiskScorer.sourceScore("GOVERNMENT")).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should reject NaN inputs")
    void shouldRejectNaN() {
        assertThatThrownBy(() -> scorer.score(Severity.HIGH, Double.NaN, 0.0, "news"))
                .isInstanceOf(ScoringException.class);
    }

    @Test
    @DisplayName("Should map scores to levels at the band edges")
    void shouldMapLevels() {
        assertThat(scorer.level(0.8)).isEqualTo("critical");
        assertThat(scorer.level(0.79)).isEqualTo("high");
        assertThat(scorer.level(0.6)).isEqualTo("high");
        assertThat(scorer.level(0.4)).isEqualTo("medium");
        assertThat(scorer.level(0.2)).isEqualTo("low");
        assertThat(scorer.level(0.19)).isEqualTo("minimal");
    }

    @Test
    @DisplayName("Should reject weights that do not sum to one and keep the current ones")
    void shouldRejectUnnormalizedWeights() {
        RiskWeights before = scorer.weights();

        boolean updated = scorer.updateWeights(new RiskWeights(0.35, 0.25, 0.20, 0.17));

        assertThat(updated).isFalse();
        assertThat(scorer.weights()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should accept weights within tolerance and use them")
    void shouldAcceptNormalizedWeights() {
        RiskWeights severityOnly = new RiskWeights(1.0, 0.0, 0.0, 0.005);

        assertThat(scorer.updateWeights(severityOnly)).isTrue();
        assertThat(scorer.weights()).isEqualTo(severityOnly);
        assertThat(scorer.score(Severity.HIGH, 0.0, 1.0, "other")).isCloseTo(0.8015, within(1e-9));
    }

    @Test
    @DisplayName("Should score a batch with level and components")
    void shouldScoreBatch() {
        List<Map<String, Object>> results = scorer.scoreBatch(List.of(
                new RiskFactors("inc-1", Severity.CRITICAL, 0.9, -0.9, "government"),
                new RiskFactors("inc-2", null, 0.1, 0.1, null)));

        assertThat(results).hasSize(2);
        assertThat(results.get(0)).containsEntry("incident_id", "inc-1");
        assertThat(results.get(0).get("risk_level")).isEqualTo("critical");
        assertThat(results.get(1).get("components"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("severity", "medium")
                .containsEntry("source_type", "unknown");
    }

    @Test
    @DisplayName("Should convert to the incident scale")
    void shouldConvertToIncidentScale() {
        assertThat(RiskScorer.toIncidentScale(0.73)).isCloseTo(7.3, within(1e-9));
        assertThat(RiskScorer.toIncidentScale(1.5)).isEqualTo(10.0);
    }
}
