package io.riskradar.ingestion.api.dto;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scored incident candidate. Scores are clamped here, at production time: confidence to [0,1],
 * risk to [0,10], sentiment to [-1,1]. A re-scored candidate is a new instance.
 */
public record IncidentCandidate(
        String id,
        String title,
        String description,
        List<String> keywords,
        Severity severity,
        double confidenceScore,
        double riskScore,
        double sentimentScore,
        List<String> sourceUrls,
        Map<String, List<String>> entities,
        LocalDateTime createdAt,
        Map<String, Object> metadata
) {
    public static final double MAX_RISK = 10.0;

    public IncidentCandidate {
        id = id != null ? id : UUID.randomUUID().toString();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        sourceUrls = sourceUrls != null ? List.copyOf(sourceUrls) : List.of();
        entities = entities != null ? Collections.unmodifiableMap(new LinkedHashMap<>(entities)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        confidenceScore = clamp(confidenceScore, 0.0, 1.0);
        riskScore = clamp(riskScore, 0.0, MAX_RISK);
        sentimentScore = clamp(sentimentScore, -1.0, 1.0);
    }

    public String sourceType() {
        Object type = metadata.get("source_type");
        return type != null ? type.toString() : "other";
    }

    public IncidentCandidate withCreatedAt(LocalDateTime timestamp) {
        return new IncidentCandidate(id, title, description, keywords, severity, confidenceScore, riskScore,
                sentimentScore, sourceUrls, entities, timestamp, metadata);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }
}
