package io.riskradar.ingestion.api.service.analysis;

import com.google.common.net.InternetDomainName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction of indicators, threat keywords and organization names.
 * <p>
 * Results are keyed by {@link EntityKind#key()}; each list holds unique values in first-seen
 * order. Kinds with no match are absent from the map.
 */
@Component
public class EntityExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    static final List<String> THREAT_KEYWORDS = List.of(
            "malware", "ransomware", "phishing", "exploit", "vulnerability",
            "breach", "attack", "trojan", "virus", "botnet", "ddos",
            "injection", "backdoor", "rootkit", "spyware", "adware");

    // case-sensitive on purpose: capitalization is the signal
    private static final List<Pattern> ORGANIZATION_PATTERNS = List.of(
            Pattern.compile("\\b[A-Z][a-z]+ (?:Inc|Corp|LLC|Ltd|Company|Corporation|Technologies|Systems|Security)\\b"),
            Pattern.compile("\\b(?:Microsoft|Google|Apple|Amazon|Facebook|Twitter|LinkedIn|GitHub|Cisco|IBM|Oracle)\\b"));

    public Map<String, List<String>> extract(String text) {
        if (text == null || text.isBlank()) return Map.of();

        Map<String, List<String>> entities = new LinkedHashMap<>();

        for (EntityKind kind : EntityKind.values()) {
            if (kind.pattern() != null) {
                putIfPresent(entities, kind, findAll(kind.pattern(), text));
            }
        }

        String lowerText = text.toLowerCase(Locale.ROOT);
        putIfPresent(entities, EntityKind.THREAT_KEYWORDS, THREAT_KEYWORDS.stream()
                .filter(lowerText::contains)
                .toList());

        Set<String> organizations = new LinkedHashSet<>();
        for (Pattern pattern : ORGANIZATION_PATTERNS) {
            organizations.addAll(findAll(pattern, text));
        }
        putIfPresent(entities, EntityKind.ORGANIZATIONS, List.copyOf(organizations));

        return Collections.unmodifiableMap(entities);
    }

    /**
     * Only the indicator-of-compromise kinds: IPs, domains, URLs, file hashes and CVE ids.
     */
    public Map<String, List<String>> extractIocs(String text) {
        if (text == null || text.isBlank()) return Map.of();

        Map<String, List<String>> iocs = new LinkedHashMap<>();
        for (EntityKind kind : EntityKind.values()) {
            if (kind.isIoc()) {
                putIfPresent(iocs, kind, findAll(kind.pattern(), text));
            }
        }
        return Collections.unmodifiableMap(iocs);
    }

    public List<Map<String, List<String>>> extractBatch(List<String> texts) {
        return texts.stream()
                .map(this::extract)
                .toList();
    }

    /**
     * Per-kind cleanup: IPv4 octets must be 0-255, domains are lower-cased and must look like a
     * registrable name, URLs must be http(s); other kinds keep their non-empty values.
     */
    public Map<String, List<String>> validate(Map<String, List<String>> entities) {
        Map<String, List<String>> validated = new LinkedHashMap<>();

        entities.forEach((kindKey, values) -> {
            EntityKind kind = EntityKind.fromKey(kindKey);
            Set<String> cleaned = new LinkedHashSet<>();

            for (String raw : values) {
                if (raw == null) continue;
                String value = raw.trim();

                if (kind == EntityKind.IP_ADDRESSES) {
                    if (isValidIpv4(value)) cleaned.add(value);

                } else if (kind == EntityKind.DOMAINS) {
                    String domain = value.toLowerCase(Locale.ROOT);
                    if (isValidDomain(domain)) cleaned.add(domain);

                } else if (kind == EntityKind.URLS) {
                    if (value.startsWith("http://") || value.startsWith("https://")) cleaned.add(value);

                } else if (!value.isEmpty()) {
                    cleaned.add(value);
                }
            }

            if (!cleaned.isEmpty()) {
                validated.put(kindKey, List.copyOf(cleaned));
            }
        });

        logger.debug("Validated entities: {} kinds in, {} kinds out", entities.size(), validated.size());
        return Collections.unmodifiableMap(validated);
    }

    public Map<String, Object> summarize(Map<String, List<String>> entities) {
        Map<String, Integer> countsByType = new LinkedHashMap<>();
        entities.forEach((kind, values) -> countsByType.put(kind, values.size()));

        boolean hasIocs = entities.keySet().stream()
                .map(EntityKind::fromKey)
                .anyMatch(kind -> kind != null && kind.isIoc());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", countsByType.values().stream().mapToInt(Integer::intValue).sum());
        summary.put("type_count", entities.size());
        summary.put("counts_by_type", countsByType);
        summary.put("has_iocs", hasIocs);
        summary.put("has_threat_keywords", entities.containsKey(EntityKind.THREAT_KEYWORDS.key()));
        return summary;
    }

    private static List<String> findAll(Pattern pattern, String text) {
        Set<String> matches = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return new ArrayList<>(matches);
    }

    private static void putIfPresent(Map<String, List<String>> entities, EntityKind kind, List<String> values) {
        if (!values.isEmpty()) {
            entities.put(kind.key(), List.copyOf(values));
        }
    }

    static boolean isValidIpv4(String value) {
        String[] octets = value.split("\\.");
        if (octets.length != 4) return false;

        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                return false;
            }
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }

    static boolean isValidDomain(String domain) {
        return domain.contains(".") && domain.length() > 3 && InternetDomainName.isValid(domain);
    }
}
