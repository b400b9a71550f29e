package io.riskradar.ingestion.api.dto;

import io.riskradar.ingestion.config.SourceDescriptor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record SourcesInfo(
        Map<String, List<SourceDescriptor>> sourcesByCategory,
        int totalSources,
        int enabledSources,
        LocalDateTime lastUpdated
) {}
