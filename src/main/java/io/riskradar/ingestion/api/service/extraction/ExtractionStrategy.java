package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.config.SourceType;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Turns a fetched listing page into canonical content items for one kind of source.
 * <p>
 * Implementations use the client only to follow item links and to consult or update its
 * seen-URL set; they never share state with each other.
 */
public interface ExtractionStrategy {

    /**
     * The source type this strategy handles, or {@code null} for the generic fallback.
     */
    SourceType type();

    /**
     * Extracts items in document order. Items that fail extraction are skipped; this method
     * does not throw for malformed markup.
     */
    List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client);
}
