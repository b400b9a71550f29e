package io.riskradar.ingestion.api.exception;

public enum FetchErrorKind {
    NETWORK,
    TIMEOUT,
    PARSE
}
