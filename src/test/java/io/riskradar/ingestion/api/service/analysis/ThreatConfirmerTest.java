package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.ConfirmationStats;
import io.riskradar.ingestion.api.dto.Decision;
import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.RiskAssessment;
import io.riskradar.ingestion.api.dto.Severity;
import io.riskradar.ingestion.api.dto.ThreatEvaluation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ThreatConfirmerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private ThreatConfirmer confirmer;

    @BeforeEach
    void setUp() {
        confirmer = new ThreatConfirmer(ConfirmationCriteria.defaults(), CLOCK);
    }

    @Test
    @DisplayName("Should never lower the score when confidence increases")
    void shouldBeMonotonicInConfidence() {
        double previous = -1.0;
        for (int step = 0; step <= 20; step++) {
            double confidence = step / 20.0;
            Decision decision = confirmer.evaluate(
                    candidate("Ransomware outbreak", Severity.HIGH, confidence, 6.0, -0.3, "news",
                            List.of("ransomware")));

            assertThat(decision.score()).isGreaterThanOrEqualTo(previous);
            previous = decision.score();
        }
    }

    @Test
    @DisplayName("Should confirm when the score equals the threshold")
    void shouldConfirmAtInclusiveBoundary() {
        IncidentCandidate candidate = candidate("Phishing wave", Severity.MEDIUM, 0.6, 5.0, -0.3, "blog",
                List.of("phishing"));
        double score = confirmer.evaluate(candidate).score();

        confirmer.updateCriteria(ConfirmationCriteria.defaults().withMinRiskScore(score));
        Decision atThreshold = confirmer.evaluate(candidate);

        assertThat(atThreshold.score()).isEqualTo(score);
        assertThat(atThreshold.confirmed()).isTrue();

        confirmer.updateCriteria(ConfirmationCriteria.defaults().withMinRiskScore(Math.nextUp(score)));
        assertThat(confirmer.evaluate(candidate).confirmed()).isFalse();
    }

    @Test
    @DisplayName("Should confirm a strong candidate and explain contributing factors")
    void shouldConfirmStrongCandidate() {
        IncidentCandidate candidate = candidate("Ransomware hits Acme Corp", Severity.CRITICAL, 0.9, 9.0, -0.9,
                "government", List.of("ransomware", "acme", "breach", "encryption"));

        Decision decision = confirmer.evaluate(candidate);

        // 9*.30 + 9*.15 + 7.2*.15 + 10*.15 + 8*.10 + 5*.10 + 5*.05
        assertThat(decision.score()).isCloseTo(8.18, within(1e-9));
        assertThat(decision.confirmed()).isTrue();
        assertThat(decision.factors()).hasSize(7)
                .containsEntry(ThreatConfirmer.SOURCE, 10.0)
                .containsEntry(ThreatConfirmer.KEYWORD, 8.0);
        assertThat(decision.explanation())
                .startsWith("THREAT CONFIRMED (Score: 8.2/10)")
                .contains("Contributing factors:")
                .contains("+ High confidence (0.90)")
                .contains("+ Reliable source type (government)")
                .contains("Severity: CRITICAL")
                .contains("Keywords: ransomware, acme, breach, encryption");
    }

    @Test
    @DisplayName("Should reject a weak candidate and explain limiting factors")
    void shouldRejectWeakCandidate() {
        IncidentCandidate candidate = candidate("Forum chatter about phishing", Severity.LOW, 0.3, 2.0, 0.1,
                "social", List.of("phishing"));

        Decision decision = confirmer.evaluate(candidate);

        assertThat(decision.confirmed()).isFalse();
        assertThat(decision.explanation())
                .startsWith("Threat not confirmed")
                .contains("Limiting factors:")
                .contains("- Low confidence (0.30)")
                .contains("- Limited keyword matches (1 keywords)")
                .contains("Severity: LOW");
    }

    @Test
    @DisplayName("Should escalate when similar incidents happened recently")
    void shouldEscalateOnRecentSimilarIncidents() {
        IncidentCandidate candidate = candidate("Ransomware strikes hospital", Severity.HIGH, 0.7, 6.0, -0.6,
                "news", List.of("ransomware", "hospital"));
        IncidentCandidate recent = candidate("Ransomware strikes clinic", Severity.HIGH, 0.7, 8.0, -0.6,
                "news", List.of("ransomware")).withCreatedAt(NOW.minusHours(2));
        IncidentCandidate stale = candidate("Ransomware last week", Severity.HIGH, 0.7, 8.0, -0.6,
                "news", List.of("ransomware")).withCreatedAt(NOW.minusHours(48));

        Decision withoutHistory = confirmer.evaluate(candidate);
        Decision withRecent = confirmer.evaluate(candidate, null, List.of(recent));
        Decision withStale = confirmer.evaluate(candidate, null, List.of(stale));

        assertThat(withRecent.factors().get(ThreatConfirmer.PATTERN)).isCloseTo(9.6, within(1e-9));
        assertThat(withRecent.score()).isGreaterThan(withoutHistory.score());
        assertThat(withStale.factors().get(ThreatConfirmer.PATTERN)).isEqualTo(ThreatConfirmer.NEUTRAL);
    }

    @Test
    @DisplayName("Should fold in an analyst assessment")
    void shouldUseAssessment() {
        IncidentCandidate candidate = candidate("Botnet activity", Severity.MEDIUM, 0.5, 5.0, -0.3, "news",
                List.of("botnet"));

        Decision decision = confirmer.evaluate(candidate,
                new RiskAssessment(candidate.id(), 10.0, 5.0, 0.5, "rising"), List.of());

        assertThat(decision.factors().get(ThreatConfirmer.ASSESSMENT)).isCloseTo(4.0, within(1e-9));
    }

    @Test
    @DisplayName("Should return an error decision for a malformed candidate")
    void shouldReturnErrorDecisionForMalformedCandidate() {
        IncidentCandidate malformed = candidate("No severity", null, 0.9, 9.0, -0.9, "news", List.of());

        Decision decision = confirmer.evaluate(malformed);

        assertThat(decision.confirmed()).isFalse();
        assertThat(decision.score()).isZero();
        assertThat(decision.explanation()).startsWith("Evaluation error:");
        assertThat(confirmer.evaluate(null).explanation()).contains("Candidate is null");
    }

    @Test
    @DisplayName("Should compute factors from criteria thresholds")
    void shouldComputeFactors() {
        ConfirmationCriteria criteria = ConfirmationCriteria.defaults();

        assertThat(confirmer.confidenceFactor(candidateWithConfidence(0.7), criteria)).isCloseTo(7.0, within(1e-9));
        assertThat(confirmer.confidenceFactor(candidateWithConfidence(0.6), criteria)).isCloseTo(3.0, within(1e-9));

        assertThat(confirmer.sentimentFactor(candidateWithSentiment(-0.9), criteria)).isCloseTo(7.2, within(1e-9));
        assertThat(confirmer.sentimentFactor(candidateWithSentiment(-0.2), criteria)).isCloseTo(1.0, within(1e-9));
        assertThat(confirmer.sentimentFactor(candidateWithSentiment(0.1), criteria)).isEqualTo(3.0);
        assertThat(confirmer.sentimentFactor(candidateWithSentiment(0.9), criteria)).isCloseTo(1.2, within(1e-9));
    }

    @Test
    @DisplayName("Should boost corroborated sources up to the cap")
    void shouldBoostCorroboratedSources() {
        IncidentCandidate corroborated = new IncidentCandidate(null, "Breach", "", List.of(), Severity.HIGH,
                0.5, 5.0, 0.0, List.of("https://a.example/1", "https://b.example/2"), Map.of(), NOW,
                Map.of("source_type", "news"));

        double factor = confirmer.sourceFactor(corroborated, ConfirmationCriteria.defaults());

        assertThat(factor).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should evaluate in bulk and report stats over confirmed threats")
    void shouldEvaluateInBulkAndReportStats() {
        List<ThreatEvaluation> evaluations = confirmer.bulkEvaluate(List.of(
                candidate("Ransomware hits Acme Corp", Severity.CRITICAL, 0.9, 9.0, -0.9, "government",
                        List.of("ransomware", "acme", "breach", "encryption")),
                candidate("Minor phishing attempt", Severity.LOW, 0.3, 2.0, 0.1, "social", List.of("phishing"))),
                List.of());

        ConfirmationStats stats = confirmer.stats(evaluations);

        assertThat(stats.totalEvaluated()).isEqualTo(2);
        assertThat(stats.totalConfirmations()).isEqualTo(1);
        assertThat(stats.confirmationRate()).isEqualTo(0.5);
        assertThat(stats.severityDistribution()).containsExactly(Map.entry("critical", 1));
        assertThat(confirmer.stats(List.of())).isEqualTo(ConfirmationStats.empty());
    }

    @Test
    @DisplayName("Should reject null criteria")
    void shouldRejectNullCriteria() {
        assertThatThrownBy(() -> confirmer.updateCriteria(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(confirmer.criteria()).isEqualTo(ConfirmationCriteria.defaults());
    }

    private static IncidentCandidate candidate(String title, Severity severity, double confidence, double risk,
                                               double sentiment, String sourceType, List<String> keywords) {
        return new IncidentCandidate(null, title, title, keywords, severity, confidence, risk, sentiment,
                List.of("https://example.com/" + title.hashCode()), Map.of(), NOW,
                Map.of("source_type", sourceType));
    }

    private static IncidentCandidate candidateWithConfidence(double confidence) {
        return candidate("Confidence probe", Severity.MEDIUM, confidence, 5.0, 0.0, "news", List.of());
    }

    private static IncidentCandidate candidateWithSentiment(double sentiment) {
        return candidate("Sentiment probe", Severity.MEDIUM, 0.5, 5.0, sentiment, "news", List.of());
    }
}
