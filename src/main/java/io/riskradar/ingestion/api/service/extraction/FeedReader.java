package io.riskradar.ingestion.api.service.extraction;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.exception.ErrorCategory;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.api.service.fetch.FetchError;
import io.riskradar.ingestion.api.service.fetch.FetchResult;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.contentItem;
import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.matchesKeywords;
import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.truncate;

/**
 * Reads RSS/Atom sources into content items with the same keyword filter and seen-URL
 * bookkeeping as the HTML strategies.
 */
@Component
public class FeedReader {

    private static final Logger logger = LoggerFactory.getLogger(FeedReader.class);

    static final int MAX_ENTRIES = 20;
    static final int MAX_DESCRIPTION_LENGTH = 800;

    public FetchResult<List<ContentItem>> read(SourceDescriptor source, FetchClient client, Duration timeout) {
        FetchResult<String> body = client.fetchBody(source.url(), timeout);
        if (!body.isSuccess()) {
            return FetchResult.failure(body.error());
        }

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(body.value()));
        } catch (FeedException | IllegalArgumentException e) {
            logger.warn("Feed parsing error for {}: {}", source.name(), e.getMessage());
            return FetchResult.failure(new FetchError(source.url(), ErrorCategory.PARSE_ERROR,
                    "Feed parsing error: " + e.getMessage()));
        }

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed has no entries: {}", source.name());
            return FetchResult.success(List.of());
        }

        List<ContentItem> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            if (items.size() >= MAX_ENTRIES) break;

            try {
                ContentItem item = convertEntry(entry, source, client);
                if (item != null) {
                    items.add(item);
                }
            } catch (RuntimeException e) {
                logger.warn("Failed to convert feed entry from {}: {}", source.name(), e.getMessage());
            }
        }

        logger.info("Read {} items from feed {}", items.size(), source.name());
        return FetchResult.success(items);
    }

    private ContentItem convertEntry(SyndEntry entry, SourceDescriptor source, FetchClient client) {
        String title = entry.getTitle() != null ? cleanText(entry.getTitle()) : "";
        String link = entry.getLink() != null ? entry.getLink().trim() : "";

        if (title.isBlank() || link.isBlank()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }
        if (client.isSeen(link)) {
            return null;
        }

        String description = entry.getDescription() != null
                ? truncate(cleanText(entry.getDescription().getValue()), MAX_DESCRIPTION_LENGTH)
                : "";

        if (!matchesKeywords(source.keywords(), title + " " + description)) {
            return null;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("author", entry.getAuthor() != null ? cleanText(entry.getAuthor()) : "");
        metadata.put("published_date", entry.getPublishedDate() != null
                ? LocalDateTime.ofInstant(entry.getPublishedDate().toInstant(), ZoneId.systemDefault()).toString()
                : "");
        metadata.put("content_type", "feed_entry");

        ContentItem item = contentItem(source, title, description, link, metadata);
        client.markSeen(link);
        return item;
    }

    private String cleanText(String text) {
        if (text == null) return "";
        return Jsoup.parse(text).text().trim();
    }
}
