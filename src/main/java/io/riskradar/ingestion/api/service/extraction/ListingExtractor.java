package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.exception.ExtractionException;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.api.service.fetch.FetchResult;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.*;

/**
 * Container-based listing extraction: select item containers, read title, link and excerpt,
 * optionally follow the link for a body, filter by keywords. Strategies compose it with their
 * own {@link ListingProfile} and {@link ItemMetadata}.
 */
public final class ListingExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ListingExtractor.class);

    private final ListingProfile profile;
    private final ItemMetadata metadata;

    public ListingExtractor(ListingProfile profile, ItemMetadata metadata) {
        this.profile = profile;
        this.metadata = metadata;
    }

    public List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client) {
        Elements containers;
        try {
            containers = document.select(source.selector("article_selector", profile.containerSelector()));
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            logger.warn("Invalid item selector for {}: {}", source.name(), e.getMessage());
            return List.of();
        }
        logger.info("Found {} item elements for {}", containers.size(), source.name());

        List<ContentItem> items = new ArrayList<>();
        int limit = Math.min(containers.size(), profile.maxItems());

        for (Element container : containers.subList(0, limit)) {
            try {
                extractItem(container, source, client).ifPresent(items::add);

            } catch (ExtractionException e) {
                logger.debug("Skipping item from {}: missing {} ({})", source.name(), e.getField(), e.getMessage());

            } catch (RuntimeException e) {
                logger.warn("Error processing item element from {}: {}", source.name(), e.getMessage());
            }
        }

        logger.info("Extracted {} items from {}", items.size(), source.name());
        return items;
    }

    private Optional<ContentItem> extractItem(Element container, SourceDescriptor source, FetchClient client) {
        String title = requireTitle(container, source.selector("title_selector", profile.titleSelector()));
        if (title.length() < profile.minTitleLength()) {
            return Optional.empty();
        }

        Element link = container.selectFirst(source.selector("link_selector", profile.linkSelector()));
        String url = resolveUrl(link != null ? link.attr("href") : null, source.url());
        if (client.isSeen(url)) {
            return Optional.empty();
        }

        String description = joinParagraphs(
                container.select(source.selector("content_selector", profile.contentSelector())),
                profile.maxParagraphs(),
                profile.minParagraphLength(),
                profile.maxDescriptionLength());

        if (description.isEmpty() && profile.followsLinks() && !url.equals(source.url())) {
            description = fetchItemBody(url, source, client);
        }

        if (!matchesKeywords(source.keywords(), title + " " + description)) {
            return Optional.empty();
        }

        ContentItem item = contentItem(source, title, description, url,
                metadata.describe(container, title, description, url));
        client.markSeen(url);
        return Optional.of(item);
    }

    /**
     * Fetches the item page and reads a bounded body from the first selector that yields text.
     */
    private String fetchItemBody(String url, SourceDescriptor source, FetchClient client) {
        FetchResult<Document> page = client.fetch(url);
        if (!page.isSuccess()) {
            logger.debug("Could not follow {} for {}: {}", url, source.name(), page.error());
            return "";
        }

        List<String> selectors = new ArrayList<>();
        String configured = source.fieldSelectors().get("content_selector");
        if (configured != null && !configured.isBlank()) {
            selectors.add(configured);
        }
        selectors.addAll(profile.articleSelectors());

        for (String selector : selectors) {
            String body = joinParagraphs(page.value().select(selector),
                    profile.articleParagraphs(),
                    profile.articleMinParagraphLength(),
                    profile.articleMaxLength());
            if (!body.isEmpty()) {
                return body;
            }
        }
        return "";
    }
}
