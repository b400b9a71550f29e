package io.riskradar.ingestion.api.service.fetch;

import io.riskradar.ingestion.api.exception.ErrorCategory;
import io.riskradar.ingestion.api.exception.FetchErrorKind;
import io.riskradar.ingestion.api.exception.FetchException;

public record FetchError(
        String url,
        ErrorCategory category,
        String message
) {
    public FetchErrorKind kind() {
        return category.kind();
    }

    public static FetchError from(String url, FetchException e) {
        return new FetchError(url, e.getCategory(), e.getMessage());
    }

    @Override
    public String toString() {
        return kind() + "/" + category + ": " + message;
    }
}
