package io.riskradar.ingestion.api.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record RunResult(
        String status,
        int sourcesCount,
        int itemsScraped,
        int successful,
        int failed,
        Map<String, Integer> itemsByType,
        List<ContentItem> results,
        List<String> errors,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {
    public static final String COMPLETED = "completed";

    public RunResult {
        itemsByType = itemsByType != null ? Map.copyOf(itemsByType) : Map.of();
        results = results != null ? List.copyOf(results) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static RunResult empty(LocalDateTime now) {
        return new RunResult(COMPLETED, 0, 0, 0, 0, Map.of(), List.of(), List.of(), now, now);
    }
}
