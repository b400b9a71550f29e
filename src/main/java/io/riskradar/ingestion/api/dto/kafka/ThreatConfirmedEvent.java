package io.riskradar.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskradar.ingestion.api.dto.Decision;
import io.riskradar.ingestion.api.dto.IncidentCandidate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record ThreatConfirmedEvent(
        @JsonProperty("alertId") String alertId,
        @JsonProperty("incidentId") String incidentId,
        @JsonProperty("title") String title,
        @JsonProperty("severity") String severity,
        @JsonProperty("score") double score,
        @JsonProperty("triggerKeywords") List<String> triggerKeywords,
        @JsonProperty("source") String source,
        @JsonProperty("confirmedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime confirmedAt
) {
    public static ThreatConfirmedEvent create(IncidentCandidate candidate, Decision decision) {
        Object source = candidate.metadata().get("source_name");
        return new ThreatConfirmedEvent(
                "ALERT-" + UUID.randomUUID().toString().substring(0, 8),
                candidate.id(),
                candidate.title(),
                candidate.severity() != null ? candidate.severity().key() : null,
                decision.score(),
                candidate.keywords(),
                source != null ? source.toString() : "unknown",
                LocalDateTime.now()
        );
    }
}
