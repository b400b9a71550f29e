package io.riskradar.ingestion.api.service;

import io.riskradar.ingestion.api.dto.Decision;
import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.ScanSummary;
import io.riskradar.ingestion.api.dto.kafka.BatchProcessedEvent;
import io.riskradar.ingestion.api.dto.kafka.IncidentEvaluatedEvent;
import io.riskradar.ingestion.api.dto.kafka.ThreatConfirmedEvent;
import io.riskradar.ingestion.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Hands evaluated incidents, confirmed threats and scan summaries to downstream persistence
 * over Kafka. Publishing failures are logged and never reach the scan.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    public void publishIncidentEvaluated(IncidentCandidate candidate, Decision decision) {
        try {
            IncidentEvaluatedEvent event = IncidentEvaluatedEvent.create(candidate, decision);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.incidentEvaluated(), candidate.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent incident evaluated event: {} to partition: {}",
                            candidate.id(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send incident evaluated event: {}", candidate.id(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing incident evaluated event for: {}", candidate.id(), e);
        }
    }

    public void publishThreatConfirmed(IncidentCandidate candidate, Decision decision) {
        try {
            ThreatConfirmedEvent event = ThreatConfirmedEvent.create(candidate, decision);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.threatConfirmed(), event.alertId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.warn("THREAT CONFIRMED: alert {} for incident {} (score: {})",
                            event.alertId(), candidate.id(), decision.score());
                } else {
                    logger.error("CRITICAL: Failed to send threat confirmed alert: {}", event.alertId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing threat confirmed event for: {}", candidate.id(), e);
        }
    }

    public void publishBatchProcessed(ScanSummary summary) {
        try {
            BatchProcessedEvent event = BatchProcessedEvent.create(summary);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.batchProcessed(), event.batchId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent batch processed event: {} ({} items from {} sources)",
                            event.batchId(), summary.itemsScraped(), summary.sourcesCount());
                } else {
                    logger.error("Failed to send batch processed event: {}", event.batchId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing batch processed event: {}", summary.batchId(), e);
        }
    }
}
