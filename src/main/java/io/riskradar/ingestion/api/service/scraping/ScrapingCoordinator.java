package io.riskradar.ingestion.api.service.scraping;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.dto.RunResult;
import io.riskradar.ingestion.api.dto.ScrapingStats;
import io.riskradar.ingestion.api.dto.ScrapingStatus;
import io.riskradar.ingestion.api.dto.SourceValidation;
import io.riskradar.ingestion.api.exception.SourceTaskException;
import io.riskradar.ingestion.api.service.extraction.ExtractionStrategyRegistry;
import io.riskradar.ingestion.api.service.extraction.FeedReader;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.api.service.fetch.FetchClientFactory;
import io.riskradar.ingestion.api.service.fetch.FetchResult;
import io.riskradar.ingestion.config.ScrapingConfig;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceFormat;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans one scraping task per enabled source out over a fixed-size worker pool and aggregates
 * what comes back.
 * <p>
 * Each task gets its own {@link FetchClient}. A task that throws or exceeds the task timeout is
 * counted as failed; it never aborts the run or delays other sources. The timeout clock starts
 * when a worker picks the task up, not when it is queued.
 * <p>
 * {@link #stop()} is advisory: it clears the active-task registry used for status reporting but
 * does not cancel tasks already handed to the pool.
 */
public class ScrapingCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ScrapingCoordinator.class);

    private final FetchClientFactory clientFactory;
    private final ExtractionStrategyRegistry strategies;
    private final FeedReader feedReader;
    private final ScrapingConfig config;
    private final Clock clock;

    private final Map<String, CompletableFuture<List<ContentItem>>> activeTasks = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile ScrapingStatus.State state = ScrapingStatus.State.IDLE;

    // cumulative counters, guarded by lock
    private final Object lock = new Object();
    private int totalAttempted;
    private int successful;
    private int failed;
    private int totalItems;
    private final Map<String, Integer> sourcesByType = new LinkedHashMap<>();
    private LocalDateTime lastRunAt;

    public ScrapingCoordinator(FetchClientFactory clientFactory, ExtractionStrategyRegistry strategies,
                               FeedReader feedReader, ScrapingConfig config, Clock clock) {
        this.clientFactory = clientFactory;
        this.strategies = strategies;
        this.feedReader = feedReader;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Scrapes every enabled source once.
     *
     * @throws IllegalStateException if a run is already in progress on this coordinator
     */
    public RunResult run(List<SourceDescriptor> sources) {
        List<SourceDescriptor> enabled = sources.stream()
                .filter(SourceDescriptor::isEnabled)
                .toList();

        LocalDateTime startedAt = LocalDateTime.now(clock);
        if (enabled.isEmpty()) {
            logger.info("No enabled sources to scrape");
            return RunResult.empty(startedAt);
        }

        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A scraping run is already in progress");
        }
        state = ScrapingStatus.State.RUNNING;

        int workers = Math.min(config.workerPoolSize(), enabled.size());
        logger.info("Starting scraping run: {} sources, {} workers", enabled.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor();
        RunAccumulator run = new RunAccumulator();

        try {
            List<CompletableFuture<Void>> recorded = new ArrayList<>();
            for (SourceDescriptor source : enabled) {
                String taskKey = String.valueOf(source.name());
                CompletableFuture<List<ContentItem>> task = submit(source, pool, watchdog);
                activeTasks.put(taskKey, task);

                recorded.add(task.handle((items, error) -> {
                    activeTasks.remove(taskKey, task);
                    if (error == null) {
                        run.success(source, items);
                    } else {
                        run.failure(source, unwrap(error));
                    }
                    return null;
                }));
            }

            CompletableFuture.allOf(recorded.toArray(new CompletableFuture[0])).join();

        } finally {
            // in-flight work is left to finish on its own
            pool.shutdown();
            watchdog.shutdownNow();
            activeTasks.clear();
            running.set(false);
            if (state == ScrapingStatus.State.RUNNING) {
                state = ScrapingStatus.State.IDLE;
            }
        }

        RunResult result = run.toResult(enabled.size(), startedAt, LocalDateTime.now(clock));
        logger.info("Scraping run completed: {} successful, {} failed, {} items",
                result.successful(), result.failed(), result.itemsScraped());
        return result;
    }

    public ScrapingStatus status() {
        return new ScrapingStatus(state, activeTasks.size(), stats());
    }

    public ScrapingStats stats() {
        synchronized (lock) {
            return new ScrapingStats(totalAttempted, successful, failed, totalItems, sourcesByType, lastRunAt);
        }
    }

    /**
     * Clears the active-task registry. Tasks already running keep running and their results
     * are still collected by the run that dispatched them.
     */
    public void stop() {
        int cleared = activeTasks.size();
        activeTasks.clear();
        state = ScrapingStatus.State.STOPPED;
        logger.info("Scraping stopped; cleared {} active task handles", cleared);
    }

    public SourceValidation validate(SourceDescriptor source) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (source.name() == null || source.name().isBlank()) {
            errors.add("Missing required field: name");
        }
        if (source.url() == null || source.url().isBlank()) {
            errors.add("Missing required field: url");
        } else if (!source.url().startsWith("http://") && !source.url().startsWith("https://")) {
            errors.add("URL must start with http:// or https://");
        }

        if (source.type() == SourceType.OTHER) {
            warnings.add("No dedicated extraction for type '" + source.type().key() + "'; generic extraction will be used");
        }
        if (source.keywords().isEmpty()) {
            warnings.add("No keywords specified; every item will be accepted");
        }

        return new SourceValidation(errors.isEmpty(), errors, warnings);
    }

    public List<String> supportedSourceTypes() {
        return strategies.supportedTypes().stream()
                .map(SourceType::key)
                .toList();
    }

    private CompletableFuture<List<ContentItem>> submit(SourceDescriptor source, ExecutorService pool,
                                                        ScheduledExecutorService watchdog) {
        CompletableFuture<List<ContentItem>> task = new CompletableFuture<>();

        pool.execute(() -> {
            Thread worker = Thread.currentThread();
            long timeoutMs = config.taskTimeout().toMillis();
            // guards the worker: interrupts are only delivered while it still runs this task
            AtomicBoolean taskActive = new AtomicBoolean(true);

            ScheduledFuture<?> timeout = watchdog.schedule(() -> {
                synchronized (taskActive) {
                    if (task.completeExceptionally(new TimeoutException("Timed out after " + timeoutMs + " ms"))
                            && taskActive.get()) {
                        worker.interrupt();
                    }
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);

            try {
                task.complete(scrapeSource(source));
            } catch (Throwable e) {
                task.completeExceptionally(e);
            } finally {
                timeout.cancel(false);
                synchronized (taskActive) {
                    taskActive.set(false);
                    Thread.interrupted();
                }
            }
        });

        return task;
    }

    List<ContentItem> scrapeSource(SourceDescriptor source) {
        logger.info("Scraping source {} ({})", source.name(), source.type().key());
        FetchClient client = clientFactory.create(source);

        List<ContentItem> items;
        if (source.format() == SourceFormat.FEED) {
            FetchResult<List<ContentItem>> feed = feedReader.read(source, client, config.requestTimeout());
            if (!feed.isSuccess()) {
                throw new SourceTaskException(source.name(), "Fetch failed: " + feed.error());
            }
            items = feed.value();
        } else {
            FetchResult<Document> page = client.fetch(source.url(), config.requestTimeout());
            if (!page.isSuccess()) {
                throw new SourceTaskException(source.name(), "Fetch failed: " + page.error());
            }
            items = strategies.forType(source.type()).extract(page.value(), source, client);
        }

        logger.info("Finished source {}: {} items, {} requests", source.name(), items.size(), client.requestCount());
        return items;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Per-run results. Also folds each outcome into the cumulative counters under the same lock.
     */
    private class RunAccumulator {
        private final List<ContentItem> results = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private final Map<String, Integer> itemsByType = new LinkedHashMap<>();
        private int runSuccessful;
        private int runFailed;

        void success(SourceDescriptor source, List<ContentItem> items) {
            synchronized (lock) {
                results.addAll(items);
                itemsByType.merge(source.type().key(), items.size(), Integer::sum);
                runSuccessful++;

                totalAttempted++;
                successful++;
                totalItems += items.size();
                sourcesByType.merge(source.type().key(), 1, Integer::sum);
            }
        }

        void failure(SourceDescriptor source, Throwable error) {
            String message = String.format(Locale.ROOT, "%s: %s", source.name(),
                    error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());

            if (error instanceof TimeoutException) {
                logger.warn("Source task timed out: {}", message);
            } else {
                logger.error("Source task failed: {}", message, error);
            }

            synchronized (lock) {
                errors.add(message);
                runFailed++;

                totalAttempted++;
                failed++;
                sourcesByType.merge(source.type().key(), 1, Integer::sum);
            }
        }

        RunResult toResult(int sourcesCount, LocalDateTime startedAt, LocalDateTime completedAt) {
            synchronized (lock) {
                lastRunAt = completedAt;
                return new RunResult(RunResult.COMPLETED, sourcesCount, results.size(), runSuccessful, runFailed,
                        itemsByType, results, errors, startedAt, completedAt);
            }
        }
    }
}
