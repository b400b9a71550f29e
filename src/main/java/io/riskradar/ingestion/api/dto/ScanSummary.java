package io.riskradar.ingestion.api.dto;

import java.util.List;

/**
 * Outcome of one full scan: scraping plus analysis and confirmation.
 */
public record ScanSummary(
        String batchId,
        int sourcesCount,
        int successfulSources,
        int failedSources,
        int itemsScraped,
        int newItems,
        int incidentsDetected,
        int duplicatesDropped,
        int confirmedThreats,
        long durationMs,
        List<String> errors
) {
    public ScanSummary {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
