package io.riskradar.ingestion.api.dto;

public record ThreatEvaluation(
        IncidentCandidate candidate,
        Decision decision
) {}
