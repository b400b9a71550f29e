package io.riskradar.ingestion.api.exception;

public class ScoringException extends IllegalArgumentException {

    public ScoringException(String message) {
        super(message);
    }
}
