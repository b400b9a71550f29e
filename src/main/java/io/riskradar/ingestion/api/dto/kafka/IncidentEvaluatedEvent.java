package io.riskradar.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskradar.ingestion.api.dto.Decision;
import io.riskradar.ingestion.api.dto.IncidentCandidate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record IncidentEvaluatedEvent(
        @JsonProperty("incidentId") String incidentId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("severity") String severity,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("sourceUrls") List<String> sourceUrls,
        @JsonProperty("entities") Map<String, List<String>> entities,
        @JsonProperty("riskScore") double riskScore,
        @JsonProperty("confidenceScore") double confidenceScore,
        @JsonProperty("sentimentScore") double sentimentScore,
        @JsonProperty("confirmed") boolean confirmed,
        @JsonProperty("decisionScore") double decisionScore,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("evaluatedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime evaluatedAt
) {
    public static IncidentEvaluatedEvent create(IncidentCandidate candidate, Decision decision) {
        return new IncidentEvaluatedEvent(
                candidate.id(),
                candidate.title(),
                candidate.description(),
                candidate.severity() != null ? candidate.severity().key() : null,
                candidate.keywords(),
                candidate.sourceUrls(),
                candidate.entities(),
                candidate.riskScore(),
                candidate.confidenceScore(),
                candidate.sentimentScore(),
                decision.confirmed(),
                decision.score(),
                decision.explanation(),
                LocalDateTime.now()
        );
    }
}
