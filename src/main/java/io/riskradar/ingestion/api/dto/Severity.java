package io.riskradar.ingestion.api.dto;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    public String key() {
        return name().toLowerCase();
    }

    /**
     * @return the matching severity, or {@code null} when the value names none
     */
    public static Severity fromValue(String value) {
        if (value == null) return null;

        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return null;
    }
}
