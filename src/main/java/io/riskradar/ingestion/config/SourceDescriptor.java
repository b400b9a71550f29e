package io.riskradar.ingestion.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Static configuration for one content origin. Immutable: a descriptor handed to a
 * scraping task is a snapshot and is never changed while the task runs.
 */
public record SourceDescriptor(
        String name,
        SourceType type,
        String url,
        Set<String> keywords,
        Map<String, String> fieldSelectors,
        int rateLimitPerMinute,
        Double reliabilityWeight,
        Boolean enabled,
        SourceFormat format,
        String category
) {
    public static final int DEFAULT_RATE_LIMIT = 60;
    public static final double DEFAULT_RELIABILITY = 0.5;

    public SourceDescriptor {
        type = type != null ? type : SourceType.OTHER;
        keywords = keywords != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(keywords))
                : Set.of();
        fieldSelectors = fieldSelectors != null ? Map.copyOf(fieldSelectors) : Map.of();
        rateLimitPerMinute = rateLimitPerMinute > 0 ? rateLimitPerMinute : DEFAULT_RATE_LIMIT;
        reliabilityWeight = reliabilityWeight != null
                ? Math.max(0.0, Math.min(1.0, reliabilityWeight))
                : DEFAULT_RELIABILITY;
        enabled = enabled == null || enabled;
        format = format != null ? format : SourceFormat.HTML;
        category = category != null && !category.isBlank() ? category : type.key();
    }

    public static SourceDescriptor of(String name, SourceType type, String url, Set<String> keywords) {
        return new SourceDescriptor(name, type, url, keywords, Map.of(), DEFAULT_RATE_LIMIT,
                DEFAULT_RELIABILITY, true, SourceFormat.HTML, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String selector(String field, String fallback) {
        String configured = fieldSelectors.get(field);
        return configured != null && !configured.isBlank() ? configured : fallback;
    }

    public SourceDescriptor withEnabled(boolean value) {
        return new SourceDescriptor(name, type, url, keywords, fieldSelectors, rateLimitPerMinute,
                reliabilityWeight, value, format, category);
    }

    public SourceDescriptor withSelectors(Map<String, String> selectors) {
        return new SourceDescriptor(name, type, url, keywords, selectors, rateLimitPerMinute,
                reliabilityWeight, enabled, format, category);
    }
}
