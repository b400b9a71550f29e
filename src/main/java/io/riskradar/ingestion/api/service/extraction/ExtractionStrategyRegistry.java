package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.config.SourceType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each source type to its extraction strategy. Types without a dedicated strategy get the
 * generic fallback. Strategies are stateless and shared across tasks.
 */
@Component
public class ExtractionStrategyRegistry {

    private final Map<SourceType, ExtractionStrategy> strategies = new EnumMap<>(SourceType.class);
    private final ExtractionStrategy fallback;

    public ExtractionStrategyRegistry() {
        this(List.of(
                new NewsExtractionStrategy(),
                new GovernmentExtractionStrategy(),
                new SocialExtractionStrategy(),
                new BlogExtractionStrategy()
        ), new GenericExtractionStrategy());
    }

    public ExtractionStrategyRegistry(List<ExtractionStrategy> typed, ExtractionStrategy fallback) {
        for (ExtractionStrategy strategy : typed) {
            if (strategy.type() == null) {
                throw new IllegalArgumentException("Typed strategy expected, got " + strategy.getClass().getSimpleName());
            }
            strategies.put(strategy.type(), strategy);
        }
        this.fallback = fallback;
    }

    public ExtractionStrategy forType(SourceType type) {
        if (type == null) return fallback;
        return strategies.getOrDefault(type, fallback);
    }

    public Set<SourceType> supportedTypes() {
        return Collections.unmodifiableSet(strategies.keySet());
    }
}
