package io.riskradar.ingestion.api.service;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.dto.Decision;
import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.IncidentStatus;
import io.riskradar.ingestion.api.dto.RunResult;
import io.riskradar.ingestion.api.dto.ScanSummary;
import io.riskradar.ingestion.api.dto.ScrapingStats;
import io.riskradar.ingestion.api.dto.ScrapingStatus;
import io.riskradar.ingestion.api.service.analysis.Incident;
import io.riskradar.ingestion.api.service.analysis.IncidentAggregator;
import io.riskradar.ingestion.api.service.analysis.ThreatAnalysisService;
import io.riskradar.ingestion.api.service.analysis.ThreatConfirmer;
import io.riskradar.ingestion.api.service.scraping.ScrapingCoordinator;
import io.riskradar.ingestion.api.service.scraping.ScrapingCoordinatorFactory;
import io.riskradar.ingestion.config.RiskRadarConfig;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a full scan: scrape every enabled source, drop content seen in earlier scans, analyze,
 * de-duplicate against active incidents, confirm, and publish the results.
 */
@Service
public class ScheduledThreatScanService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledThreatScanService.class);

    private final ScrapingCoordinatorFactory coordinatorFactory;
    private final ContentDeduplicationService deduplicationService;
    private final ThreatAnalysisService analysisService;
    private final IncidentAggregator aggregator;
    private final ThreatConfirmer confirmer;
    private final EventPublisherService eventPublisher;
    private final RiskRadarConfig config;

    private final AtomicBoolean scanning = new AtomicBoolean();
    private final AtomicReference<ScrapingCoordinator> currentCoordinator = new AtomicReference<>();

    public ScheduledThreatScanService(ScrapingCoordinatorFactory coordinatorFactory,
                                      ContentDeduplicationService deduplicationService,
                                      ThreatAnalysisService analysisService,
                                      IncidentAggregator aggregator,
                                      ThreatConfirmer confirmer,
                                      EventPublisherService eventPublisher,
                                      RiskRadarConfig config) {
        this.coordinatorFactory = coordinatorFactory;
        this.deduplicationService = deduplicationService;
        this.analysisService = analysisService;
        this.aggregator = aggregator;
        this.confirmer = confirmer;
        this.eventPublisher = eventPublisher;
        this.config = config;
    }

    @Scheduled(
            fixedRateString = "#{@scanProps.scheduleIntervalMs}",
            initialDelayString = "#{@scanProps.initialDelayMs}"
    )
    public void scheduledScan() {
        if (!config.processing().enableScheduling()) {
            logger.debug("Scheduled scanning disabled");
            return;
        }

        try {
            runScan();
        } catch (IllegalStateException e) {
            logger.info("Skipping scheduled scan: {}", e.getMessage());
        }
    }

    /**
     * @throws IllegalStateException if a scan is already running
     */
    public ScanSummary runScan() {
        if (!scanning.compareAndSet(false, true)) {
            throw new IllegalStateException("A scan is already in progress");
        }

        try {
            return scan();
        } finally {
            scanning.set(false);
        }
    }

    public ScrapingStatus status() {
        ScrapingCoordinator coordinator = currentCoordinator.get();
        if (coordinator == null) {
            return new ScrapingStatus(ScrapingStatus.State.IDLE, 0,
                    new ScrapingStats(0, 0, 0, 0, Map.of(), null));
        }
        return coordinator.status();
    }

    /**
     * Advisory stop of the current scrape; see {@link ScrapingCoordinator#stop()}.
     *
     * @return {@code false} if nothing has run yet
     */
    public boolean stop() {
        ScrapingCoordinator coordinator = currentCoordinator.get();
        if (coordinator == null) return false;

        coordinator.stop();
        return true;
    }

    private ScanSummary scan() {
        String batchId = "BATCH-" + System.currentTimeMillis();
        long startTime = System.currentTimeMillis();

        List<SourceDescriptor> sources = config.getEnabledSources();
        logger.info("Starting threat scan {} for {} enabled sources", batchId, sources.size());

        int expired = aggregator.expire();
        if (expired > 0) {
            logger.debug("Evicted {} stale incidents before scan {}", expired, batchId);
        }

        ScrapingCoordinator coordinator = coordinatorFactory.create();
        currentCoordinator.set(coordinator);
        RunResult run = coordinator.run(sources);

        Map<String, Double> reliability = new HashMap<>();
        sources.forEach(source -> reliability.put(source.name(), source.reliabilityWeight()));

        List<String> errors = new ArrayList<>(run.errors());
        int newItems = 0;
        int incidents = 0;
        int duplicates = 0;
        int confirmed = 0;

        for (ContentItem item : run.results()) {
            String contentKey = contentKey(item);
            if (deduplicationService.isAlreadyProcessed(contentKey)) {
                continue;
            }
            newItems++;

            try {
                IncidentCandidate candidate = analysisService.analyze(item,
                        reliability.getOrDefault(item.sourceName(), SourceDescriptor.DEFAULT_RELIABILITY));
                // only analyzed content is remembered, failures are retried next scan
                deduplicationService.markAsProcessed(contentKey);

                List<IncidentCandidate> history = aggregator.history();
                Optional<Incident> incident = aggregator.offer(candidate);
                if (incident.isEmpty()) {
                    duplicates++;
                    continue;
                }
                incidents++;

                Decision decision = confirmer.evaluate(candidate, null, history);
                eventPublisher.publishIncidentEvaluated(candidate, decision);

                if (decision.confirmed()) {
                    incident.get().transitionTo(IncidentStatus.CONFIRMED);
                    eventPublisher.publishThreatConfirmed(candidate, decision);
                    confirmed++;
                } else {
                    incident.get().transitionTo(IncidentStatus.PENDING);
                }

            } catch (RuntimeException e) {
                logger.error("Failed to analyze '{}' from {}: {}", item.title(), item.sourceName(), e.getMessage());
                errors.add(item.sourceName() + ": analysis failed for " + item.url() + ": " + e.getMessage());
            }
        }

        ScanSummary summary = new ScanSummary(
                batchId,
                run.sourcesCount(),
                run.successful(),
                run.failed(),
                run.itemsScraped(),
                newItems,
                incidents,
                duplicates,
                confirmed,
                System.currentTimeMillis() - startTime,
                errors
        );

        eventPublisher.publishBatchProcessed(summary);

        logger.info("Threat scan {} completed: {} items, {} new, {} incidents, {} confirmed in {}ms",
                batchId, run.itemsScraped(), newItems, incidents, confirmed, summary.durationMs());
        return summary;
    }

    /**
     * Items without their own link share the source URL, so the title is part of the key.
     */
    private static String contentKey(ContentItem item) {
        return item.url() + "|" + item.title();
    }
}
