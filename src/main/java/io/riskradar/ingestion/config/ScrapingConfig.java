package io.riskradar.ingestion.config;

import java.time.Duration;

public record ScrapingConfig(
        int workerPoolSize,
        Duration taskTimeout,
        Duration requestTimeout
) {
    public static final int DEFAULT_WORKERS = 5;
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public ScrapingConfig {
        workerPoolSize = workerPoolSize > 0 ? workerPoolSize : DEFAULT_WORKERS;
        taskTimeout = taskTimeout != null ? taskTimeout : DEFAULT_TASK_TIMEOUT;
        requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    public static ScrapingConfig defaults() {
        return new ScrapingConfig(DEFAULT_WORKERS, DEFAULT_TASK_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }
}
