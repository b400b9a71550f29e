package io.riskradar.ingestion.api.service.analysis;

import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.IncidentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory set of active incidents. New candidates that duplicate an active one are dropped,
 * not merged. Expiry evicts incidents older than {@link #EXPIRY_WINDOW}; it does not touch
 * anything persisted downstream.
 */
@Component
public class IncidentAggregator {

    private static final Logger logger = LoggerFactory.getLogger(IncidentAggregator.class);

    public static final Duration EXPIRY_WINDOW = Duration.ofHours(24);
    static final double TITLE_SIMILARITY_THRESHOLD = 0.8;
    static final int SHARED_KEYWORD_THRESHOLD = 2;

    private final Map<String, Incident> incidents = new LinkedHashMap<>();
    private final Clock clock;

    @Autowired
    public IncidentAggregator() {
        this(Clock.systemDefaultZone());
    }

    public IncidentAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Tracks the candidate unless it duplicates an active incident.
     *
     * @return the new incident, or empty when the candidate was a duplicate
     */
    public synchronized Optional<Incident> offer(IncidentCandidate candidate) {
        for (Incident existing : incidents.values()) {
            if (isDuplicate(candidate, existing.candidate())) {
                logger.debug("Dropping '{}' as duplicate of incident {}", candidate.title(), existing.id());
                return Optional.empty();
            }
        }

        Incident incident = new Incident(candidate, LocalDateTime.now(clock));
        incidents.put(incident.id(), incident);
        return Optional.of(incident);
    }

    public synchronized List<Incident> active() {
        return List.copyOf(incidents.values());
    }

    /**
     * Candidates of every active incident, for use as confirmation history.
     */
    public synchronized List<IncidentCandidate> history() {
        return incidents.values().stream()
                .map(Incident::candidate)
                .toList();
    }

    public synchronized Optional<Incident> find(String id) {
        return Optional.ofNullable(incidents.get(id));
    }

    /**
     * @throws NoSuchElementException if no active incident has this id
     * @throws IllegalStateException  if the transition is not allowed from the current status
     */
    public Incident transition(String id, IncidentStatus next) {
        Incident incident = find(id)
                .orElseThrow(() -> new NoSuchElementException("Unknown incident: " + id));

        IncidentStatus current = incident.status();
        if (!incident.transitionTo(next)) {
            throw new IllegalStateException("Cannot move incident " + id + " from " + current + " to " + next);
        }
        logger.info("Incident {} moved from {} to {}", id, current, next);
        return incident;
    }

    /**
     * @return number of incidents evicted
     */
    public synchronized int expire() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(EXPIRY_WINDOW);
        Collection<Incident> values = incidents.values();

        int before = values.size();
        values.removeIf(incident -> incident.createdAt().isBefore(cutoff));
        int removed = before - values.size();

        if (removed > 0) {
            logger.info("Expired {} incidents older than {}", removed, cutoff);
        }
        return removed;
    }

    public synchronized int size() {
        return incidents.size();
    }

    static boolean isDuplicate(IncidentCandidate candidate, IncidentCandidate existing) {
        return titleSimilarity(candidate.title(), existing.title()) > TITLE_SIMILARITY_THRESHOLD
                || sharedKeywords(candidate.keywords(), existing.keywords()) >= SHARED_KEYWORD_THRESHOLD;
    }

    /**
     * Jaccard similarity of the lower-cased whitespace tokens of two titles.
     */
    static double titleSimilarity(String first, String second) {
        Set<String> a = tokens(first);
        Set<String> b = tokens(second);
        if (a.isEmpty() && b.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static int sharedKeywords(List<String> first, List<String> second) {
        Set<String> a = new HashSet<>();
        first.forEach(keyword -> a.add(keyword.toLowerCase(Locale.ROOT)));

        Set<String> shared = new HashSet<>();
        for (String keyword : second) {
            String normalized = keyword.toLowerCase(Locale.ROOT);
            if (a.contains(normalized)) {
                shared.add(normalized);
            }
        }
        return shared.size();
    }

    private static Set<String> tokens(String title) {
        if (title == null || title.isBlank()) return Set.of();
        return new HashSet<>(Arrays.asList(title.toLowerCase(Locale.ROOT).trim().split("\\s+")));
    }
}
