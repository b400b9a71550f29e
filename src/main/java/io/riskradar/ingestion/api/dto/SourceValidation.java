package io.riskradar.ingestion.api.dto;

import java.util.List;

public record SourceValidation(
        boolean valid,
        List<String> errors,
        List<String> warnings
) {
    public SourceValidation {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
