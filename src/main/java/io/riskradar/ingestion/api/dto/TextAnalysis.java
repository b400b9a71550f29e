package io.riskradar.ingestion.api.dto;

import java.util.List;
import java.util.Map;

public record TextAnalysis(
        Map<String, List<String>> entities,
        Map<String, Object> entitySummary,
        double sentiment,
        Map<String, Object> sentimentSummary,
        String severity
) {}
