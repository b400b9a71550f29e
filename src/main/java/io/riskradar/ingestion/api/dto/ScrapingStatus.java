package io.riskradar.ingestion.api.dto;

public record ScrapingStatus(
        State state,
        int activeTasks,
        ScrapingStats stats
) {
    public enum State {
        IDLE,
        RUNNING,
        STOPPED
    }
}
