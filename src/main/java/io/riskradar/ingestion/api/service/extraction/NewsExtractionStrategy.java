package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.firstDate;
import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.firstText;

public class NewsExtractionStrategy implements ExtractionStrategy {

    static final ListingProfile PROFILE = new ListingProfile(
            "article", "h1, h2, h3", "p", "a",
            10, 20,
            3, 20, 500,
            List.of("div.article-content", "div.story-body", "div.entry-content",
                    "div.post-content", "main p", "article p"),
            5, 20, 800);

    private static final List<String> DATE_SELECTORS =
            List.of("time", ".date", ".published", ".timestamp", "[datetime]");
    private static final List<String> AUTHOR_SELECTORS =
            List.of(".author", ".byline", ".writer", "[rel=\"author\"]");

    private final ListingExtractor extractor = new ListingExtractor(PROFILE, this::describe);

    @Override
    public SourceType type() {
        return SourceType.NEWS;
    }

    @Override
    public List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client) {
        return extractor.extract(document, source, client);
    }

    private Map<String, Object> describe(Element container, String title, String description, String url) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("published_date", firstDate(container, DATE_SELECTORS));
        metadata.put("author", firstText(container, AUTHOR_SELECTORS));
        metadata.put("content_type", "news_article");
        return metadata;
    }
}
