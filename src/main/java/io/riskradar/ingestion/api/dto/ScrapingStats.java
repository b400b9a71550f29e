package io.riskradar.ingestion.api.dto;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Counters accumulated over every run of one coordinator.
 */
public record ScrapingStats(
        int totalAttempted,
        int successful,
        int failed,
        int totalItems,
        Map<String, Integer> sourcesByType,
        LocalDateTime lastRunAt
) {
    public ScrapingStats {
        sourcesByType = sourcesByType != null ? Map.copyOf(sourcesByType) : Map.of();
    }
}
