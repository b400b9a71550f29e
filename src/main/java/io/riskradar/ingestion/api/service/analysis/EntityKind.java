package io.riskradar.ingestion.api.service.analysis;

import java.util.regex.Pattern;

/**
 * Entity kinds recognized in free text, in extraction order. Pattern-based kinds carry their
 * regex; threat keywords and organizations are matched separately.
 */
public enum EntityKind {
    IP_ADDRESSES("ip_addresses", true,
            "\\b(?:[0-9]{1,3}\\.){3}[0-9]{1,3}\\b"),
    DOMAINS("domains", true,
            "\\b[a-zA-Z0-9](?:[a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?)*\\.[a-zA-Z]{2,}\\b"),
    URLS("urls", true,
            "https?://[^\\s<>\"{}|\\\\^`\\[\\]]+"),
    EMAIL_ADDRESSES("email_addresses", false,
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b"),
    FILE_HASHES("file_hashes", true,
            "\\b[a-fA-F0-9]{32,64}\\b"),
    CVE_IDS("cve_ids", true,
            "CVE-\\d{4}-\\d{4,7}"),
    BITCOIN_ADDRESSES("bitcoin_addresses", false,
            "\\b[13][a-km-zA-HJ-NP-Z1-9]{25,34}\\b"),
    THREAT_KEYWORDS("threat_keywords", false, null),
    ORGANIZATIONS("organizations", false, null);

    private final String key;
    private final boolean ioc;
    private final Pattern pattern;

    EntityKind(String key, boolean ioc, String regex) {
        this.key = key;
        this.ioc = ioc;
        this.pattern = regex != null ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : null;
    }

    public String key() {
        return key;
    }

    /**
     * Whether values of this kind are indicators of compromise.
     */
    public boolean isIoc() {
        return ioc;
    }

    Pattern pattern() {
        return pattern;
    }

    public static EntityKind fromKey(String key) {
        for (EntityKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        return null;
    }
}
