package io.riskradar.ingestion.api.service.fetch;

import io.riskradar.ingestion.config.HttpConfig;
import io.riskradar.ingestion.config.RiskRadarConfig;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh {@link FetchClient} per source so no fetch state leaks between sources or runs.
 */
@Component
public class FetchClientFactory {

    private final HttpConfig httpConfig;

    @Autowired
    public FetchClientFactory(RiskRadarConfig config) {
        this(config.http());
    }

    public FetchClientFactory(HttpConfig httpConfig) {
        this.httpConfig = httpConfig;
    }

    public FetchClient create(SourceDescriptor source) {
        return new FetchClient(source, httpConfig);
    }
}
