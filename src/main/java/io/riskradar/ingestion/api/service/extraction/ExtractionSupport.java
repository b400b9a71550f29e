package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.exception.ExtractionException;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing primitives shared by every extraction strategy.
 */
public final class ExtractionSupport {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");

    private ExtractionSupport() {
    }

    public static String text(Element element) {
        if (element == null) return "";
        return WHITESPACE.matcher(element.text()).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    public static String requireTitle(Element container, String selector) {
        Element titleElement = container.selectFirst(selector);
        if (titleElement == null) {
            throw new ExtractionException("title", "No element matches title selector '" + selector + "'");
        }
        return text(titleElement);
    }

    /**
     * Joins up to {@code maxParts} texts of the matched elements that are longer than
     * {@code minLength}, cut to {@code maxLength}.
     */
    public static String joinParagraphs(Elements elements, int maxParts, int minLength, int maxLength) {
        List<String> parts = new ArrayList<>();
        for (Element element : elements) {
            if (parts.size() >= maxParts) break;
            String text = text(element);
            if (!text.isEmpty() && text.length() > minLength) {
                parts.add(text);
            }
        }
        return truncate(String.join(" ", parts), maxLength);
    }

    /**
     * Resolves an item link: absolute links pass through, root-relative links are joined with the
     * source's origin, anything else falls back to the source URL.
     */
    public static String resolveUrl(String href, String sourceUrl) {
        if (href == null || href.isBlank()) return sourceUrl;

        String trimmed = href.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        if (trimmed.startsWith("/") && !trimmed.startsWith("//")) {
            String origin = origin(sourceUrl);
            return origin != null ? origin + trimmed : sourceUrl;
        }
        return sourceUrl;
    }

    public static String origin(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) return null;
            return uri.getScheme() + "://" + uri.getRawAuthority();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean matchesKeywords(Set<String> keywords, String text) {
        if (keywords.isEmpty()) return true;

        String lowerText = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .anyMatch(keyword -> lowerText.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    public static List<String> matchedKeywords(Set<String> keywords, String text) {
        String lowerText = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .filter(keyword -> lowerText.contains(keyword.toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * Reads the first matching element's {@code datetime} attribute, else its text.
     */
    public static String firstDate(Element container, List<String> selectors) {
        for (String selector : selectors) {
            Element element = container.selectFirst(selector);
            if (element == null) continue;

            if (element.hasAttr("datetime") && !element.attr("datetime").isBlank()) {
                return element.attr("datetime");
            }
            String text = text(element);
            if (!text.isEmpty()) return text;
        }
        return "";
    }

    public static String firstText(Element container, List<String> selectors) {
        for (String selector : selectors) {
            String text = text(container.selectFirst(selector));
            if (!text.isEmpty()) return text;
        }
        return "";
    }

    public static int firstNumber(Element container, List<String> selectors) {
        for (String selector : selectors) {
            Element element = container.selectFirst(selector);
            if (element == null) continue;

            Matcher matcher = FIRST_NUMBER.matcher(text(element));
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group());
                } catch (NumberFormatException e) {
                    // out of int range; the count is unknown, the item is still kept
                    return 0;
                }
            }
        }
        return 0;
    }

    public static List<String> distinctTexts(Element container, List<String> selectors, int minLength) {
        Set<String> values = new LinkedHashSet<>();
        for (String selector : selectors) {
            for (Element element : container.select(selector)) {
                String text = text(element);
                if (text.length() > minLength) {
                    values.add(text);
                }
            }
        }
        return List.copyOf(values);
    }

    public static ContentItem contentItem(SourceDescriptor source, String title, String description, String url,
                                          Map<String, Object> metadata) {
        String cleanTitle = title.trim();
        String cleanDescription = description != null ? description.trim() : "";
        return new ContentItem(
                cleanTitle,
                cleanDescription,
                url,
                source.name(),
                source.type(),
                matchedKeywords(source.keywords(), cleanTitle + " " + cleanDescription),
                LocalDateTime.now(),
                metadata
        );
    }
}
