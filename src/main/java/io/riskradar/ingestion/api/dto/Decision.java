package io.riskradar.ingestion.api.dto;

import java.util.Map;

/**
 * Outcome of a threat confirmation. {@code score} is on the 0..10 incident scale;
 * {@code factors} holds every normalized factor that went into it.
 */
public record Decision(
        boolean confirmed,
        double score,
        String explanation,
        Map<String, Double> factors
) {
    public Decision {
        factors = factors != null ? Map.copyOf(factors) : Map.of();
    }

    public static Decision error(String message) {
        return new Decision(false, 0.0, "Evaluation error: " + message, Map.of());
    }
}
