package io.riskradar.ingestion.config;

public enum SourceFormat {
    HTML,   // listing page parsed with CSS selectors
    FEED    // RSS/Atom document
}
