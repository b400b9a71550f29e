package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.IncidentStatus;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A tracked candidate. The candidate is immutable; status is the only mutable part and only
 * moves along {@link IncidentStatus#successors()}.
 */
public class Incident {

    private final IncidentCandidate candidate;
    private final LocalDateTime detectedAt;
    private final AtomicReference<IncidentStatus> status = new AtomicReference<>(IncidentStatus.DETECTED);

    public Incident(IncidentCandidate candidate, LocalDateTime detectedAt) {
        this.candidate = candidate;
        this.detectedAt = detectedAt;
    }

    public String id() {
        return candidate.id();
    }

    public IncidentCandidate candidate() {
        return candidate;
    }

    public LocalDateTime detectedAt() {
        return detectedAt;
    }

    public IncidentStatus status() {
        return status.get();
    }

    /**
     * Moves to {@code next} if that is a legal successor of the current status.
     *
     * @return {@code false} if the transition is not allowed; the status is then unchanged
     */
    public boolean transitionTo(IncidentStatus next) {
        while (true) {
            IncidentStatus current = status.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (status.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * Age reference: the candidate's creation time, or detection time when it has none.
     */
    LocalDateTime createdAt() {
        return candidate.createdAt() != null ? candidate.createdAt() : detectedAt;
    }
}
