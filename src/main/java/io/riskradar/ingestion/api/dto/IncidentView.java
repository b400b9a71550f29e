package io.riskradar.ingestion.api.dto;

import java.time.LocalDateTime;

public record IncidentView(
        String id,
        IncidentStatus status,
        LocalDateTime detectedAt,
        IncidentCandidate candidate
) {}
