package io.riskradar.ingestion.config;

import java.util.List;

public record HttpConfig(
        int readTimeout,
        int maxRetries,
        int retryDelay,
        List<String> userAgents
) {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    public HttpConfig {
        userAgents = userAgents == null || userAgents.isEmpty()
                ? List.of(DEFAULT_USER_AGENT)
                : List.copyOf(userAgents);
        maxRetries = Math.max(0, maxRetries);
        retryDelay = Math.max(1, retryDelay);
    }
}
