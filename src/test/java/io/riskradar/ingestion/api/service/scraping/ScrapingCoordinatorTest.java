package io.riskradar.ingestion.api.service.scraping;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.dto.RunResult;
import io.riskradar.ingestion.api.dto.ScrapingStatus;
import io.riskradar.ingestion.api.dto.SourceValidation;
import io.riskradar.ingestion.api.exception.ErrorCategory;
import io.riskradar.ingestion.api.service.extraction.ExtractionStrategy;
import io.riskradar.ingestion.api.service.extraction.ExtractionStrategyRegistry;
import io.riskradar.ingestion.api.service.extraction.FeedReader;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.api.service.fetch.FetchClientFactory;
import io.riskradar.ingestion.api.service.fetch.FetchError;
import io.riskradar.ingestion.api.service.fetch.FetchResult;
import io.riskradar.ingestion.config.ScrapingConfig;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceFormat;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapingCoordinatorTest {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private FetchClientFactory clientFactory;

    @Mock
    private ExtractionStrategyRegistry strategies;

    @Mock
    private ExtractionStrategy newsStrategy;

    @Mock
    private FeedReader feedReader;

    @Mock
    private FetchClient client;

    @Mock
    private FetchClient slowClient;

    private ScrapingCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = coordinator(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should isolate a failing source and keep the successful one's items")
    void shouldIsolateFailingSource() {
        SourceDescriptor broken = news("Broken News", "https://broken.example.com/");
        SourceDescriptor healthy = news("Healthy News", "https://healthy.example.com/");
        Document page = Jsoup.parse("<article></article>", healthy.url());
        ContentItem item = item(healthy, "Ransomware hits Acme Corp");

        when(clientFactory.create(any())).thenReturn(client);
        when(client.fetch(broken.url(), REQUEST_TIMEOUT)).thenReturn(FetchResult.failure(
                new FetchError(broken.url(), ErrorCategory.SERVER_UNAVAILABLE, "Server temporarily unavailable (503)")));
        when(client.fetch(healthy.url(), REQUEST_TIMEOUT)).thenReturn(FetchResult.success(page));
        when(strategies.forType(SourceType.NEWS)).thenReturn(newsStrategy);
        when(newsStrategy.extract(page, healthy, client)).thenReturn(List.of(item));

        RunResult result = coordinator.run(List.of(broken, healthy));

        assertThat(result.status()).isEqualTo(RunResult.COMPLETED);
        assertThat(result.sourcesCount()).isEqualTo(2);
        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.results()).containsExactly(item);
        assertThat(result.itemsByType()).containsEntry("news", 1);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).startsWith("Broken News: Fetch failed");

        assertThat(coordinator.stats().totalAttempted()).isEqualTo(2);
        assertThat(coordinator.stats().sourcesByType()).containsEntry("news", 2);
        assertThat(coordinator.status().state()).isEqualTo(ScrapingStatus.State.IDLE);
        assertThat(coordinator.status().activeTasks()).isZero();
    }

    @Test
    @DisplayName("Should return an empty completed result when no source is enabled")
    void shouldReturnEmptyResultWithoutEnabledSources() {
        RunResult none = coordinator.run(List.of());
        RunResult disabled = coordinator.run(List.of(news("Off", "https://off.example.com/").withEnabled(false)));

        assertThat(none.status()).isEqualTo(RunResult.COMPLETED);
        assertThat(none.sourcesCount()).isZero();
        assertThat(disabled.results()).isEmpty();
        assertThat(disabled.errors()).isEmpty();
        verifyNoInteractions(clientFactory);
    }

    @Test
    @DisplayName("Should report an error thrown by a strategy with its own cause instead of a timeout")
    void shouldReportErrorsThrownByStrategy() {
        SourceDescriptor source = news("Recursive News", "https://recursive.example.com/");
        Document page = Jsoup.parse("<article></article>", source.url());

        when(clientFactory.create(source)).thenReturn(client);
        when(client.fetch(source.url(), REQUEST_TIMEOUT)).thenReturn(FetchResult.success(page));
        when(strategies.forType(SourceType.NEWS)).thenReturn(newsStrategy);
        when(newsStrategy.extract(page, source, client)).thenThrow(new StackOverflowError("selector recursion"));

        long start = System.nanoTime();
        RunResult result = coordinator.run(List.of(source));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).containsExactly("Recursive News: selector recursion");
        assertThat(elapsedMs).isLessThan(5000);
    }

    @Test
    @DisplayName("Should record a timed-out source as failed without waiting for it")
    void shouldTimeOutSlowSource() {
        coordinator = coordinator(Duration.ofMillis(200));
        SourceDescriptor slow = news("Slow News", "https://slow.example.com/");
        SourceDescriptor fast = news("Fast News", "https://fast.example.com/");
        Document page = Jsoup.parse("<article></article>", fast.url());
        CountDownLatch never = new CountDownLatch(1);

        when(clientFactory.create(slow)).thenReturn(slowClient);
        when(clientFactory.create(fast)).thenReturn(client);
        when(slowClient.fetch(slow.url(), REQUEST_TIMEOUT)).thenAnswer(invocation -> {
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return FetchResult.failure(new FetchError(slow.url(), ErrorCategory.TIMEOUT, "interrupted"));
        });
        when(client.fetch(fast.url(), REQUEST_TIMEOUT)).thenReturn(FetchResult.success(page));
        when(strategies.forType(SourceType.NEWS)).thenReturn(newsStrategy);
        when(newsStrategy.extract(page, fast, client)).thenReturn(List.of(item(fast, "Botnet takedown")));

        long started = System.nanoTime();
        RunResult result = coordinator.run(List.of(slow, fast));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).containsExactly("Slow News: Timed out after 200 ms");
        assertThat(elapsedMs).isLessThan(5_000);
    }

    @Test
    @DisplayName("Should report running tasks and let stop clear them without cancelling")
    void shouldStopAdvisorily() throws Exception {
        SourceDescriptor source = news("Blocking News", "https://blocking.example.com/");
        Document page = Jsoup.parse("<article></article>", source.url());
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        when(clientFactory.create(source)).thenReturn(client);
        when(client.fetch(source.url(), REQUEST_TIMEOUT)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return FetchResult.success(page);
        });
        when(strategies.forType(SourceType.NEWS)).thenReturn(newsStrategy);
        when(newsStrategy.extract(eq(page), eq(source), any())).thenReturn(List.of(item(source, "Spyware found")));

        CompletableFuture<RunResult> run = CompletableFuture.supplyAsync(() -> coordinator.run(List.of(source)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(coordinator.status().state()).isEqualTo(ScrapingStatus.State.RUNNING);
        assertThat(coordinator.status().activeTasks()).isEqualTo(1);
        assertThatThrownBy(() -> coordinator.run(List.of(source)))
                .isInstanceOf(IllegalStateException.class);

        coordinator.stop();
        assertThat(coordinator.status().state()).isEqualTo(ScrapingStatus.State.STOPPED);
        assertThat(coordinator.status().activeTasks()).isZero();

        release.countDown();
        RunResult result = run.get(5, TimeUnit.SECONDS);

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.results()).hasSize(1);
        assertThat(coordinator.status().state()).isEqualTo(ScrapingStatus.State.STOPPED);
    }

    @Test
    @DisplayName("Should read feed sources through the feed reader")
    void shouldReadFeedSources() {
        SourceDescriptor feed = new SourceDescriptor("Reddit r/netsec", SourceType.SOCIAL,
                "https://www.reddit.com/r/netsec/.rss", Set.of(), Map.of(), 60, 0.75, true, SourceFormat.FEED, null);
        ContentItem entry = item(feed, "Exploit released for SSL VPN");

        when(clientFactory.create(feed)).thenReturn(client);
        when(feedReader.read(feed, client, REQUEST_TIMEOUT)).thenReturn(FetchResult.success(List.of(entry)));

        RunResult result = coordinator.run(List.of(feed));

        assertThat(result.results()).containsExactly(entry);
        assertThat(result.itemsByType()).containsEntry("social", 1);
        verifyNoInteractions(strategies);
    }

    @Test
    @DisplayName("Should validate source descriptors")
    void shouldValidateSources() {
        SourceValidation valid = coordinator.validate(
                SourceDescriptor.of("CISA", SourceType.GOVERNMENT, "https://www.cisa.gov/", Set.of("advisory")));
        SourceValidation invalid = coordinator.validate(
                SourceDescriptor.of(" ", SourceType.OTHER, "ftp://files.example.com/", Set.of()));

        assertThat(valid.valid()).isTrue();
        assertThat(valid.warnings()).isEmpty();
        assertThat(invalid.valid()).isFalse();
        assertThat(invalid.errors()).containsExactly(
                "Missing required field: name", "URL must start with http:// or https://");
        assertThat(invalid.warnings()).hasSize(2);
    }

    @Test
    @DisplayName("Should list source types with dedicated extraction")
    void shouldListSupportedTypes() {
        when(strategies.supportedTypes()).thenReturn(Set.of(SourceType.NEWS));

        assertThat(coordinator.supportedSourceTypes()).containsExactly("news");
    }

    private ScrapingCoordinator coordinator(Duration taskTimeout) {
        return new ScrapingCoordinator(clientFactory, strategies, feedReader,
                new ScrapingConfig(2, taskTimeout, REQUEST_TIMEOUT), Clock.systemUTC());
    }

    private static SourceDescriptor news(String name, String url) {
        return SourceDescriptor.of(name, SourceType.NEWS, url, Set.of());
    }

    private static ContentItem item(SourceDescriptor source, String title) {
        return new ContentItem(title, "", source.url() + "item", source.name(), source.type(), List.of(),
                LocalDateTime.now(), Map.of());
    }
}
