package io.riskradar.ingestion.api.exception;

/**
 * Raised when an item container lacks a required field; the item is skipped, the source continues.
 */
public class ExtractionException extends RuntimeException {
    private final String field;

    public ExtractionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
