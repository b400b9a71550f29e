package io.riskradar.ingestion.api.dto;

import io.riskradar.ingestion.config.SourceType;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One scraped item in canonical form. Created once per item, never mutated afterwards.
 */
public record ContentItem(
        String title,
        String body,
        String url,
        String sourceName,
        SourceType sourceType,
        List<String> matchedKeywords,
        LocalDateTime extractedAt,
        Map<String, Object> metadata
) {
    public ContentItem {
        body = body != null ? body : "";
        matchedKeywords = matchedKeywords != null ? List.copyOf(matchedKeywords) : List.of();
        // insertion order is kept so metadata reads the way the strategy wrote it
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public String text() {
        return body.isEmpty() ? title : title + " " + body;
    }

    public Object metadata(String key) {
        return metadata.get(key);
    }
}
