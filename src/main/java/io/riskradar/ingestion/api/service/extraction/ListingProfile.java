package io.riskradar.ingestion.api.service.extraction;

import java.util.List;

/**
 * Type-specific defaults for extracting items from a listing page. Descriptor field selectors
 * ({@code article_selector}, {@code title_selector}, {@code content_selector}, {@code link_selector})
 * override the selector defaults.
 *
 * @param articleSelectors selectors tried in order on a followed item page; empty disables following
 */
public record ListingProfile(
        String containerSelector,
        String titleSelector,
        String contentSelector,
        String linkSelector,
        int minTitleLength,
        int maxItems,
        int maxParagraphs,
        int minParagraphLength,
        int maxDescriptionLength,
        List<String> articleSelectors,
        int articleParagraphs,
        int articleMinParagraphLength,
        int articleMaxLength
) {
    public ListingProfile {
        articleSelectors = articleSelectors != null ? List.copyOf(articleSelectors) : List.of();
    }

    public boolean followsLinks() {
        return !articleSelectors.isEmpty();
    }
}
