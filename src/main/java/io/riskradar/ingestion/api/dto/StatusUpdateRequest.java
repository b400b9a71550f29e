package io.riskradar.ingestion.api.dto;

public record StatusUpdateRequest(IncidentStatus status) {}
