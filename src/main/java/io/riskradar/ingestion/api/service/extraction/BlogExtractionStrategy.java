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

import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.*;

/**
 * Blog and research posts. Besides date and author, records tags, category and a word count.
 */
public class BlogExtractionStrategy implements ExtractionStrategy {

    static final ListingProfile PROFILE = new ListingProfile(
            "article, .post, .entry", "h1, h2, h3, .title", ".content, .excerpt, p", "a",
            10, 15,
            3, 20, 600,
            List.of(".entry-content", ".post-content", ".article-content", ".content", "main p", "article p"),
            5, 20, 800);

    private static final List<String> DATE_SELECTORS = List.of(
            "time", ".date", ".published", ".post-date", ".entry-date", ".meta-date", "[datetime]");
    private static final List<String> AUTHOR_SELECTORS = List.of(
            ".author", ".byline", ".post-author", ".entry-author", "[rel=\"author\"]");
    private static final List<String> TAG_SELECTORS = List.of(
            ".tags a", ".post-tags a", ".entry-tags a", ".tag-links a");
    private static final List<String> CATEGORY_SELECTORS = List.of(
            ".category", ".post-category", ".entry-category", ".cat-links a");

    private final ListingExtractor extractor = new ListingExtractor(PROFILE, this::describe);

    @Override
    public SourceType type() {
        return SourceType.BLOG;
    }

    @Override
    public List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client) {
        return extractor.extract(document, source, client);
    }

    private Map<String, Object> describe(Element container, String title, String description, String url) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("published_date", firstDate(container, DATE_SELECTORS));
        metadata.put("author", firstText(container, AUTHOR_SELECTORS));
        metadata.put("tags", distinctTexts(container, TAG_SELECTORS, 0));
        metadata.put("category", firstText(container, CATEGORY_SELECTORS));
        metadata.put("content_type", "blog_post");
        metadata.put("word_count", description.isBlank() ? 0 : description.trim().split("\\s+").length);
        return metadata;
    }
}
