package io.riskradar.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String incidentEvaluated,
        String threatConfirmed,
        String batchProcessed
) {}
