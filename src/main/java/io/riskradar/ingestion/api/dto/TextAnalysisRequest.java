package io.riskradar.ingestion.api.dto;

public record TextAnalysisRequest(String text) {}
