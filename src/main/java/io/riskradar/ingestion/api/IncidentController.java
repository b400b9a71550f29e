package io.riskradar.ingestion.api;

import io.riskradar.ingestion.api.dto.ConfirmationStats;
import io.riskradar.ingestion.api.dto.IncidentView;
import io.riskradar.ingestion.api.dto.StatusUpdateRequest;
import io.riskradar.ingestion.api.service.analysis.ConfirmationCriteria;
import io.riskradar.ingestion.api.service.analysis.Incident;
import io.riskradar.ingestion.api.service.analysis.IncidentAggregator;
import io.riskradar.ingestion.api.service.analysis.ThreatConfirmer;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/v1/riskradar")
public class IncidentController {

    private final IncidentAggregator aggregator;
    private final ThreatConfirmer confirmer;

    public IncidentController(IncidentAggregator aggregator, ThreatConfirmer confirmer) {
        this.aggregator = aggregator;
        this.confirmer = confirmer;
    }

    @GetMapping("/incidents")
    public List<IncidentView> activeIncidents() {
        return aggregator.active().stream()
                .map(IncidentController::toView)
                .toList();
    }

    @GetMapping("/incidents/{id}")
    public IncidentView getIncident(@PathVariable String id) {
        return aggregator.find(id)
                .map(IncidentController::toView)
                .orElseThrow(() -> new NoSuchElementException("Unknown incident: " + id));
    }

    @PatchMapping("/incidents/{id}/status")
    public IncidentView updateStatus(@PathVariable String id, @RequestBody StatusUpdateRequest request) {
        if (request.status() == null) {
            throw new IllegalArgumentException("Status is required");
        }
        return toView(aggregator.transition(id, request.status()));
    }

    @GetMapping("/confirmation/criteria")
    public ConfirmationCriteria criteria() {
        return confirmer.criteria();
    }

    @PutMapping("/confirmation/criteria")
    public ConfirmationCriteria updateCriteria(@RequestBody ConfirmationCriteria criteria) {
        confirmer.updateCriteria(criteria);
        return confirmer.criteria();
    }

    @GetMapping("/confirmation/stats")
    public ConfirmationStats confirmationStats() {
        return confirmer.stats(confirmer.bulkEvaluate(aggregator.history(), List.of()));
    }

    private static IncidentView toView(Incident incident) {
        return new IncidentView(incident.id(), incident.status(), incident.detectedAt(), incident.candidate());
    }
}
