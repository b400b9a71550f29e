package io.riskradar.ingestion.api.service.extraction;

import org.jsoup.nodes.Element;

import java.util.Map;

/**
 * Supplies the type-specific metadata attached to an accepted item.
 */
@FunctionalInterface
public interface ItemMetadata {

    Map<String, Object> describe(Element container, String title, String description, String url);
}
