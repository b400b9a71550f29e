package io.riskradar.ingestion.config;

import io.riskradar.ingestion.api.service.analysis.ConfirmationCriteria;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "riskradar")
public record RiskRadarConfig(
        List<SourceDescriptor> sources,
        ScrapingConfig scraping,
        ProcessingConfig processing,
        HttpConfig http,
        ConfirmationCriteria confirmation
) {
    public RiskRadarConfig {
        sources = sources != null ? List.copyOf(sources) : List.of();
        scraping = scraping != null ? scraping : ScrapingConfig.defaults();
        processing = processing != null ? processing : new ProcessingConfig(null, null, true);
        http = http != null ? http : new HttpConfig(30000, 3, 1000, List.of());
        confirmation = confirmation != null ? confirmation : ConfirmationCriteria.defaults();
    }

    public List<SourceDescriptor> getEnabledSources() {
        return sources.stream()
                .filter(SourceDescriptor::isEnabled)
                .toList();
    }
}
