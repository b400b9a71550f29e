package io.riskradar.ingestion.api.util;

import io.riskradar.ingestion.config.RiskRadarConfig;
import org.springframework.stereotype.Component;

/**
 * Exposes schedule settings to {@code @Scheduled} SpEL expressions.
 */
@Component
public class ScanProps {
    private final long scheduleIntervalMs;
    private final long initialDelayMs;

    public ScanProps(RiskRadarConfig config) {
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
    }

    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
}
