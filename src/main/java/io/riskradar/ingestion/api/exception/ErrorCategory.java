package io.riskradar.ingestion.api.exception;

public enum ErrorCategory {
    TIMEOUT(FetchErrorKind.TIMEOUT, true),                // Connection/read timeout
    CONNECTION_REFUSED(FetchErrorKind.NETWORK, true),     // Connection refused
    DNS_ERROR(FetchErrorKind.NETWORK, false),             // Unknown host
    NETWORK_ERROR(FetchErrorKind.NETWORK, true),          // Other network issues
    IO_ERROR(FetchErrorKind.NETWORK, true),               // I/O problems
    INVALID_URL(FetchErrorKind.NETWORK, false),           // Malformed URL
    NOT_FOUND(FetchErrorKind.NETWORK, false),             // 404 error
    ACCESS_FORBIDDEN(FetchErrorKind.NETWORK, false),      // 403 error
    AUTH_REQUIRED(FetchErrorKind.NETWORK, false),         // 401 error
    SERVER_ERROR(FetchErrorKind.NETWORK, false),          // 500 error
    SERVER_UNAVAILABLE(FetchErrorKind.NETWORK, true),     // 502/503/504
    HTTP_ERROR(FetchErrorKind.NETWORK, false),            // Other non-2xx
    PARSE_ERROR(FetchErrorKind.PARSE, false),             // HTML/feed parsing issues
    RATE_LIMITED(FetchErrorKind.NETWORK, false);          // 429 Too Many Requests

    private final FetchErrorKind kind;
    private final boolean transientFailure;

    ErrorCategory(FetchErrorKind kind, boolean transientFailure) {
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    public FetchErrorKind kind() {
        return kind;
    }

    /**
     * Whether a request failing with this category is worth retrying.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
