package io.riskradar.ingestion.api.exception;

/**
 * A fetch failure that may succeed when retried (timeouts, refused connections, 5xx unavailability).
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
