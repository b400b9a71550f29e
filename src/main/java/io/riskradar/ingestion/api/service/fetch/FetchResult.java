package io.riskradar.ingestion.api.service.fetch;

import java.util.Optional;

/**
 * Either a fetched value or a classified {@link FetchError}; exactly one is present.
 */
public record FetchResult<T>(T value, FetchError error) {

    public FetchResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(value, null);
    }

    public static <T> FetchResult<T> failure(FetchError error) {
        return new FetchResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
