package io.riskradar.ingestion.api.service.scraping;

import io.riskradar.ingestion.api.service.extraction.ExtractionStrategyRegistry;
import io.riskradar.ingestion.api.service.extraction.FeedReader;
import io.riskradar.ingestion.api.service.fetch.FetchClientFactory;
import io.riskradar.ingestion.config.RiskRadarConfig;
import io.riskradar.ingestion.config.ScrapingConfig;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds a coordinator per run; no coordinator is shared process-wide.
 */
@Component
public class ScrapingCoordinatorFactory {

    private final FetchClientFactory clientFactory;
    private final ExtractionStrategyRegistry strategies;
    private final FeedReader feedReader;
    private final ScrapingConfig scrapingConfig;

    public ScrapingCoordinatorFactory(FetchClientFactory clientFactory, ExtractionStrategyRegistry strategies,
                                      FeedReader feedReader, RiskRadarConfig config) {
        this.clientFactory = clientFactory;
        this.strategies = strategies;
        this.feedReader = feedReader;
        this.scrapingConfig = config.scraping();
    }

    public ScrapingCoordinator create() {
        return create(scrapingConfig);
    }

    public ScrapingCoordinator create(ScrapingConfig config) {
        return new ScrapingCoordinator(clientFactory, strategies, feedReader, config, Clock.systemDefaultZone());
    }
}
