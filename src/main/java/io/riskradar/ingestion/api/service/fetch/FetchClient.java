package io.riskradar.ingestion.api.service.fetch;

import com.google.common.util.concurrent.RateLimiter;
import io.riskradar.ingestion.api.exception.ErrorCategory;
import io.riskradar.ingestion.api.exception.FetchException;
import io.riskradar.ingestion.api.exception.TransientFetchException;
import io.riskradar.ingestion.config.HttpConfig;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rate-limited HTTP fetch and HTML parse for a single source.
 * <p>
 * One instance per source per run: the token bucket, the user-agent rotation and the
 * seen-URL set are never shared between sources. Failures never escape as exceptions;
 * they come back as a classified {@link FetchError}.
 */
public class FetchClient {

    private static final Logger logger = LoggerFactory.getLogger(FetchClient.class);

    private static final int MAX_BODY_BYTES = 5 * 1024 * 1024;
    private static final long MAX_BACKOFF_MS = 10_000;

    private final SourceDescriptor source;
    private final List<String> userAgents;
    private final RateLimiter rateLimiter;
    private final RetryTemplate retryTemplate;
    private final Set<String> seenUrls = ConcurrentHashMap.newKeySet();
    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final AtomicInteger requestCount = new AtomicInteger();
    private final Duration defaultTimeout;

    public FetchClient(SourceDescriptor source, HttpConfig httpConfig) {
        this.source = source;
        this.userAgents = httpConfig.userAgents();
        this.defaultTimeout = Duration.ofMillis(Math.max(1, httpConfig.readTimeout()));
        this.rateLimiter = RateLimiter.create(source.rateLimitPerMinute() / 60.0);
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(httpConfig.maxRetries() + 1)
                .exponentialBackoff(httpConfig.retryDelay(), 2.0,
                        Math.max(MAX_BACKOFF_MS, httpConfig.retryDelay() + 1L))
                .retryOn(TransientFetchException.class)
                .build();
    }

    public SourceDescriptor source() {
        return source;
    }

    public FetchResult<Document> fetch(String url) {
        return fetch(url, defaultTimeout);
    }

    /**
     * Fetches and parses an HTML page.
     */
    public FetchResult<Document> fetch(String url, Duration timeout) {
        FetchResult<String> body = fetchBody(url, timeout);
        if (!body.isSuccess()) {
            return FetchResult.failure(body.error());
        }

        try {
            return FetchResult.success(Jsoup.parse(body.value(), url));
        } catch (RuntimeException e) {
            logger.warn("Failed to parse {} for {}: {}", url, source.name(), e.getMessage());
            return FetchResult.failure(new FetchError(url, ErrorCategory.PARSE_ERROR,
                    "Unparseable document: " + e.getMessage()));
        }
    }

    /**
     * Fetches the raw response body, retrying transient failures.
     */
    public FetchResult<String> fetchBody(String url, Duration timeout) {
        try {
            String body = retryTemplate.execute(context -> fetchOnce(url, timeout));
            return FetchResult.success(body);

        } catch (FetchException e) {
            logFailure(url, e);
            return FetchResult.failure(FetchError.from(url, e));
        }
    }

    public boolean isSeen(String url) {
        return seenUrls.contains(url);
    }

    /**
     * @return {@code true} if the URL had not been seen before
     */
    public boolean markSeen(String url) {
        return seenUrls.add(url);
    }

    public int seenCount() {
        return seenUrls.size();
    }

    public int requestCount() {
        return requestCount.get();
    }

    private String fetchOnce(String url, Duration timeout) throws FetchException {
        if (url == null || url.isBlank()) {
            throw FetchException.of("URL is null or empty", ErrorCategory.INVALID_URL);
        }

        rateLimiter.acquire();
        requestCount.incrementAndGet();
        logger.debug("Fetching {} for {}", url, source.name());

        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(nextUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.5")
                    .header("Cache-Control", "no-cache")
                    .timeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                    .maxBodySize(MAX_BODY_BYTES)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();

            validateResponse(response, url);

            return response.body();

        } catch (FetchException e) {
            throw e;

        } catch (MalformedURLException | IllegalArgumentException e) {
            throw FetchException.of("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw FetchException.of("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw FetchException.of("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw FetchException.of("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw FetchException.of("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException | UncheckedIOException e) {
            throw FetchException.of("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);
        }
    }

    private void validateResponse(Connection.Response response, String url) throws FetchException {
        int responseCode = response.statusCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_NOT_FOUND ->
                    throw FetchException.of("Page not found (404): " + url, ErrorCategory.NOT_FOUND);
            case HttpURLConnection.HTTP_FORBIDDEN ->
                    throw FetchException.of("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);
            case HttpURLConnection.HTTP_UNAUTHORIZED ->
                    throw FetchException.of("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);
            case 429 ->
                    throw FetchException.of("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);
            case HttpURLConnection.HTTP_INTERNAL_ERROR ->
                    throw FetchException.of("Server error (500): " + url, ErrorCategory.SERVER_ERROR);
            case HttpURLConnection.HTTP_BAD_GATEWAY,
                 HttpURLConnection.HTTP_UNAVAILABLE,
                 HttpURLConnection.HTTP_GATEWAY_TIMEOUT ->
                    throw FetchException.of("Server temporarily unavailable (" + responseCode + "): " + url,
                            ErrorCategory.SERVER_UNAVAILABLE);
            default -> {
                if (responseCode < 200 || responseCode >= 300) {
                    throw FetchException.of(
                            String.format("HTTP error %d (%s): %s", responseCode, response.statusMessage(), url),
                            ErrorCategory.HTTP_ERROR);
                }
            }
        }
    }

    private void logFailure(String url, FetchException e) {
        switch (e.getCategory()) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, IO_ERROR ->
                    logger.warn("Temporary error for {} ({}): {}", url, source.name(), e.getMessage());
            case RATE_LIMITED ->
                    logger.warn("Rate limited for {} ({}): {}", url, source.name(), e.getMessage());
            default ->
                    logger.error("Fetch failed for {} ({}): {} (category: {})",
                            url, source.name(), e.getMessage(), e.getCategory());
        }
    }

    private String nextUserAgent() {
        int index = Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size());
        return userAgents.get(index);
    }
}
