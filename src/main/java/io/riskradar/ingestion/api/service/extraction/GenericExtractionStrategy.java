package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Map;

/**
 * Fallback for sources whose type has no dedicated strategy. Uses news-style defaults, never
 * follows links and attaches only the source type.
 */
public class GenericExtractionStrategy implements ExtractionStrategy {

    static final ListingProfile PROFILE = new ListingProfile(
            "article, .post, .item", "h1, h2, h3, .title", "p", "a",
            10, 15,
            3, 20, 500,
            List.of(), 0, 0, 0);

    private final ListingExtractor extractor = new ListingExtractor(PROFILE,
            (container, title, description, url) -> Map.of("content_type", "generic"));

    @Override
    public SourceType type() {
        return null;
    }

    @Override
    public List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client) {
        return extractor.extract(document, source, client);
    }
}
