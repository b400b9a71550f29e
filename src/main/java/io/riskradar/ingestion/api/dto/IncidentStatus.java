package io.riskradar.ingestion.api.dto;

import java.util.EnumSet;
import java.util.Set;

/**
 * Incident lifecycle. Transitions only move forward, except the pending/investigating pair.
 * <pre>
 * detected -> (analyzing) -> pending | confirmed | dismissed
 * pending <-> investigating
 * </pre>
 */
public enum IncidentStatus {
    DETECTED,
    ANALYZING,
    PENDING,
    INVESTIGATING,
    CONFIRMED,
    DISMISSED;

    public Set<IncidentStatus> successors() {
        return switch (this) {
            case DETECTED -> EnumSet.of(ANALYZING, PENDING, CONFIRMED, DISMISSED);
            case ANALYZING -> EnumSet.of(PENDING, CONFIRMED, DISMISSED);
            case PENDING -> EnumSet.of(INVESTIGATING, CONFIRMED, DISMISSED);
            case INVESTIGATING -> EnumSet.of(PENDING, CONFIRMED, DISMISSED);
            case CONFIRMED, DISMISSED -> EnumSet.noneOf(IncidentStatus.class);
        };
    }

    public boolean canTransitionTo(IncidentStatus next) {
        return next != null && successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
