package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.service.analysis.SeverityClassifier;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.firstDate;

/**
 * Security advisories and alerts from government agencies (CISA, CERTs). Each item carries a
 * severity, the first advisory identifier, every CVE mentioned and the affected vendors/products.
 */
public class GovernmentExtractionStrategy implements ExtractionStrategy {

    static final ListingProfile PROFILE = new ListingProfile(
            ".c-teaser, .views-row", "h3 a, h2 a", ".c-teaser__summary, .field-content", "h3 a, h2 a",
            5, 15,
            2, 10, 600,
            List.of(".field-content", ".advisory-content", ".alert-content", "main .content",
                    ".page-content p", "article p"),
            4, 15, 1000);

    private static final List<Pattern> ADVISORY_ID_PATTERNS = List.of(
            Pattern.compile("CVE-\\d{4}-\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("CISA-\\d{4}-\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("AA\\d{2}-\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("ICS-CERT-\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("VU#\\d+", Pattern.CASE_INSENSITIVE));

    private static final Pattern CVE_ID = Pattern.compile("CVE-\\d{4}-\\d+", Pattern.CASE_INSENSITIVE);

    private static final List<String> KNOWN_PRODUCTS = List.of(
            "microsoft", "windows", "office", "exchange", "cisco", "juniper", "vmware", "apache",
            "oracle", "adobe", "google", "chrome", "firefox", "safari", "linux", "ubuntu");

    private static final List<String> DATE_SELECTORS =
            List.of("time", ".date", ".published", ".release-date", ".field-date");

    private final ListingExtractor extractor = new ListingExtractor(PROFILE, this::describe);

    @Override
    public SourceType type() {
        return SourceType.GOVERNMENT;
    }

    @Override
    public List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client) {
        return extractor.extract(document, source, client);
    }

    private Map<String, Object> describe(Element container, String title, String description, String url) {
        String text = title + " " + description;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("severity", SeverityClassifier.classify(text).key());
        metadata.put("advisory_id", advisoryId(text));
        metadata.put("cve_ids", cveIds(text));
        metadata.put("affected_products", affectedProducts(text));
        metadata.put("published_date", firstDate(container, DATE_SELECTORS));
        metadata.put("content_type", "security_advisory");
        return metadata;
    }

    static String advisoryId(String text) {
        for (Pattern pattern : ADVISORY_ID_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group().toUpperCase(Locale.ROOT);
            }
        }
        return "";
    }

    static List<String> cveIds(String text) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = CVE_ID.matcher(text);
        while (matcher.find()) {
            ids.add(matcher.group().toUpperCase(Locale.ROOT));
        }
        return List.copyOf(ids);
    }

    static List<String> affectedProducts(String text) {
        String lowerText = text.toLowerCase(Locale.ROOT);
        List<String> products = new ArrayList<>();
        for (String product : KNOWN_PRODUCTS) {
            if (lowerText.contains(product)) {
                products.add(Character.toUpperCase(product.charAt(0)) + product.substring(1));
            }
        }
        return products;
    }
}
