package io.riskradar.ingestion.api.exception;

public class FetchException extends Exception {
    private final ErrorCategory category;

    public FetchException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public static FetchException of(String message, Throwable cause, ErrorCategory category) {
        return category.isTransient()
                ? new TransientFetchException(message, cause, category)
                : new FetchException(message, cause, category);
    }

    public static FetchException of(String message, ErrorCategory category) {
        return of(message, null, category);
    }
}
