package io.riskradar.ingestion.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SourceType {
    NEWS("news"),
    GOVERNMENT("government"),
    SOCIAL("social"),
    BLOG("blog"),
    OTHER("other");

    private final String key;

    SourceType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolves a configured type name, falling back to {@link #OTHER} for anything unknown.
     * "social_media" is accepted as an alias of {@link #SOCIAL}.
     */
    @JsonCreator
    public static SourceType fromKey(String value) {
        if (value == null) return OTHER;

        String normalized = value.trim().toLowerCase();
        if (normalized.equals("social_media")) return SOCIAL;

        return Arrays.stream(values())
                .filter(type -> type.key.equals(normalized))
                .findFirst()
                .orElse(OTHER);
    }
}
