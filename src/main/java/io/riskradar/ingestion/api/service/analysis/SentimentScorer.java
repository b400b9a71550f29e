package io.riskradar.ingestion.api.service.analysis;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-count sentiment heuristic. A placeholder for a learned model: the score only reflects
 * how many distinct negative terms appear, with no linguistic nuance.
 * <p>
 * Output is always one of {@code 0.1, -0.3, -0.6, -0.9}.
 */
@Component
public class SentimentScorer {

    static final List<String> NEGATIVE_KEYWORDS = List.of(
            "threat", "attack", "breach", "hack", "malware", "virus",
            "exploit", "vulnerability", "compromise", "incident",
            "dangerous", "critical", "severe", "emergency");

    public static final double NO_NEGATIVE_TERMS = 0.1;
    public static final double MILDLY_NEGATIVE = -0.3;
    public static final double MODERATELY_NEGATIVE = -0.6;
    public static final double VERY_NEGATIVE = -0.9;

    public double score(String text) {
        int count = negativeTermCount(text);

        if (count == 0) return NO_NEGATIVE_TERMS;
        if (count <= 2) return MILDLY_NEGATIVE;
        if (count <= 4) return MODERATELY_NEGATIVE;
        return VERY_NEGATIVE;
    }

    public List<Double> scoreBatch(List<String> texts) {
        return texts.stream()
                .map(this::score)
                .toList();
    }

    public Map<String, Object> summarize(double score) {
        String label;
        String confidence;

        if (score >= 0.5) {
            label = "positive";
            confidence = "high";
        } else if (score >= 0.1) {
            label = "positive";
            confidence = "low";
        } else if (score >= -0.1) {
            label = "neutral";
            confidence = "medium";
        } else if (score >= -0.5) {
            label = "negative";
            confidence = "low";
        } else {
            label = "negative";
            confidence = "high";
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("label", label);
        summary.put("confidence", confidence);
        summary.put("score", score);
        return summary;
    }

    int negativeTermCount(String text) {
        if (text == null || text.isBlank()) return 0;

        String lowerText = text.toLowerCase(Locale.ROOT);
        return (int) NEGATIVE_KEYWORDS.stream()
                .filter(lowerText::contains)
                .count();
    }
}
