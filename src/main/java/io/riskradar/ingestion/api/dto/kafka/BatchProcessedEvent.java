package io.riskradar.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskradar.ingestion.api.dto.ScanSummary;

import java.time.LocalDateTime;

public record BatchProcessedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("sourcesCount") int sourcesCount,
        @JsonProperty("failedSources") int failedSources,
        @JsonProperty("itemsScraped") int itemsScraped,
        @JsonProperty("newItems") int newItems,
        @JsonProperty("incidentsDetected") int incidentsDetected,
        @JsonProperty("confirmedThreats") int confirmedThreats,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime processedAt
) {
    public static BatchProcessedEvent create(ScanSummary summary) {
        return new BatchProcessedEvent(
                summary.batchId(),
                summary.sourcesCount(),
                summary.failedSources(),
                summary.itemsScraped(),
                summary.newItems(),
                summary.incidentsDetected(),
                summary.confirmedThreats(),
                summary.durationMs(),
                LocalDateTime.now()
        );
    }
}
