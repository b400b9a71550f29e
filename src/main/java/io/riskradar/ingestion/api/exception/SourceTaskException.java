package io.riskradar.ingestion.api.exception;

/**
 * Failure of one source's scraping task. Counted and reported by the coordinator, never fatal to a run.
 */
public class SourceTaskException extends RuntimeException {
    private final String sourceName;

    public SourceTaskException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceTaskException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
