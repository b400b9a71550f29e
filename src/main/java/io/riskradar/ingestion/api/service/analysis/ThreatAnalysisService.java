package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.Severity;
import io.riskradar.ingestion.api.dto.TextAnalysis;
import io.riskradar.ingestion.config.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns scraped content into scored incident candidates.
 * <p>
 * The risk score is computed on [0,1] and moved onto the 0..10 incident scale here, once.
 */
@Service
public class ThreatAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ThreatAnalysisService.class);

    static final double BASE_CONFIDENCE = 0.5;

    private final EntityExtractor entityExtractor;
    private final SentimentScorer sentimentScorer;
    private final RiskScorer riskScorer;

    public ThreatAnalysisService(EntityExtractor entityExtractor, SentimentScorer sentimentScorer,
                                 RiskScorer riskScorer) {
        this.entityExtractor = entityExtractor;
        this.sentimentScorer = sentimentScorer;
        this.riskScorer = riskScorer;
    }

    /**
     * @param reliability reliability weight of the source the item came from
     */
    public IncidentCandidate analyze(ContentItem item, double reliability) {
        String text = item.text();

        Map<String, List<String>> entities = entityExtractor.validate(entityExtractor.extract(text));
        Severity severity = severityOf(item);
        double confidence = confidence(item, reliability);
        double sentiment = sentimentScorer.score(text);

        double risk = riskScorer.score(severity, confidence, sentiment, item.sourceType().key());

        Map<String, Object> metadata = new LinkedHashMap<>(item.metadata());
        metadata.put("source_type", item.sourceType().key());
        metadata.put("source_name", item.sourceName());
        metadata.put("risk_level", riskScorer.level(risk));

        IncidentCandidate candidate = new IncidentCandidate(
                null,
                item.title(),
                item.body(),
                keywords(item, entities),
                severity,
                confidence,
                RiskScorer.toIncidentScale(risk),
                sentiment,
                List.of(item.url()),
                entities,
                item.extractedAt(),
                metadata
        );

        logger.debug("Analyzed '{}' from {}: severity={}, risk={}", item.title(), item.sourceName(),
                severity, candidate.riskScore());
        return candidate;
    }

    public TextAnalysis analyzeText(String text) {
        Map<String, List<String>> entities = entityExtractor.validate(entityExtractor.extract(text));
        double sentiment = sentimentScorer.score(text);

        return new TextAnalysis(
                entities,
                entityExtractor.summarize(entities),
                sentiment,
                sentimentScorer.summarize(sentiment),
                SeverityClassifier.classify(text).key()
        );
    }

    /**
     * Base 0.5, +0.3 for highly reliable sources, +0.1 each for bodies over 500 and 1000
     * characters, -0.2 for social sources; clamped to [0,1].
     */
    double confidence(ContentItem item, double reliability) {
        double confidence = BASE_CONFIDENCE;

        if (reliability >= 0.9) confidence += 0.3;

        int length = item.body().length();
        if (length > 500) confidence += 0.1;
        if (length > 1000) confidence += 0.1;

        if (item.sourceType() == SourceType.SOCIAL) confidence -= 0.2;

        return Math.max(0.0, Math.min(1.0, confidence));
    }

    Severity severityOf(ContentItem item) {
        Object advisorySeverity = item.metadata("severity");
        if (advisorySeverity != null) {
            Severity severity = Severity.fromValue(advisorySeverity.toString());
            if (severity != null) return severity;
        }
        return SeverityClassifier.classify(item.text());
    }

    private List<String> keywords(ContentItem item, Map<String, List<String>> entities) {
        Set<String> keywords = new LinkedHashSet<>();
        item.matchedKeywords().forEach(keyword -> keywords.add(keyword.toLowerCase(Locale.ROOT)));
        keywords.addAll(entities.getOrDefault(EntityKind.THREAT_KEYWORDS.key(), List.of()));
        return List.copyOf(keywords);
    }
}
