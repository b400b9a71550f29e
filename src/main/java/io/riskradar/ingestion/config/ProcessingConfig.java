package io.riskradar.ingestion.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling
) {
    public ProcessingConfig {
        scheduleInterval = scheduleInterval != null ? scheduleInterval : Duration.ofMinutes(5);
        initialDelay = initialDelay != null ? initialDelay : Duration.ofSeconds(30);
    }

    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
