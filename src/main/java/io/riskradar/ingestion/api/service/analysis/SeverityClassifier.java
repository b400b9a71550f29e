package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.Severity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Advisory severity heuristic: severity words first, then a CVSS score, else {@link Severity#MEDIUM}.
 * Severity words match at the start of a word, so inflections ("critically", "urgently") count.
 */
public final class SeverityClassifier {

    private static final Map<Severity, Pattern> SEVERITY_WORDS = new LinkedHashMap<>();

    static {
        SEVERITY_WORDS.put(Severity.CRITICAL, Pattern.compile("\\b(?:critical|emergency|urgent)"));
        SEVERITY_WORDS.put(Severity.HIGH, Pattern.compile("\\b(?:high|important|severe)"));
        SEVERITY_WORDS.put(Severity.MEDIUM, Pattern.compile("\\b(?:medium|moderate)"));
        SEVERITY_WORDS.put(Severity.LOW, Pattern.compile("\\b(?:low|minor)"));
    }

    private static final Pattern CVSS_SCORE = Pattern.compile("cvss[:\\s]*(\\d+\\.?\\d*)");

    private SeverityClassifier() {
    }

    public static Severity classify(String text) {
        if (text == null || text.isBlank()) return Severity.MEDIUM;

        String lowerText = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Severity, Pattern> entry : SEVERITY_WORDS.entrySet()) {
            if (entry.getValue().matcher(lowerText).find()) {
                return entry.getKey();
            }
        }

        Matcher cvss = CVSS_SCORE.matcher(lowerText);
        if (cvss.find()) {
            return fromCvss(Double.parseDouble(cvss.group(1)));
        }
        return Severity.MEDIUM;
    }

    static Severity fromCvss(double score) {
        if (score >= 9.0) return Severity.CRITICAL;
        if (score >= 7.0) return Severity.HIGH;
        if (score >= 4.0) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
