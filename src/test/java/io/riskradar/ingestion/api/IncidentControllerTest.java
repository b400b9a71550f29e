package io.riskradar.ingestion.api;

import io.riskradar.ingestion.api.dto.IncidentCandidate;
import io.riskradar.ingestion.api.dto.Severity;
import io.riskradar.ingestion.api.service.analysis.ConfirmationCriteria;
import io.riskradar.ingestion.api.service.analysis.IncidentAggregator;
import io.riskradar.ingestion.api.service.analysis.ThreatConfirmer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IncidentControllerTest {

    private MockMvc mockMvc;
    private IncidentAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new IncidentAggregator();
        ThreatConfirmer confirmer = new ThreatConfirmer(ConfirmationCriteria.defaults(), Clock.systemDefaultZone());

        mockMvc = MockMvcBuilders.standaloneSetup(new IncidentController(aggregator, confirmer))
                .setControllerAdvice(new ErrorHandler())
                .build();
    }

    @Test
    @DisplayName("Should list active incidents")
    void shouldListActiveIncidents() throws Exception {
        aggregator.offer(candidate("Ransomware hits Acme Corp"));

        mockMvc.perform(get("/api/v1/riskradar/incidents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("DETECTED"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown incident")
    void shouldReturnNotFoundForUnknownIncident() throws Exception {
        mockMvc.perform(get("/api/v1/riskradar/incidents/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Should move an incident forward and reject leaving a terminal status")
    void shouldApplyStatusTransitions() throws Exception {
        String id = aggregator.offer(candidate("Zero-day in mail server")).orElseThrow().id();

        mockMvc.perform(patch("/api/v1/riskradar/incidents/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"DISMISSED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DISMISSED"));

        mockMvc.perform(patch("/api/v1/riskradar/incidents/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"PENDING\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    @DisplayName("Should reject a status update without a status")
    void shouldRejectMissingStatus() throws Exception {
        String id = aggregator.offer(candidate("Botnet targets routers")).orElseThrow().id();

        mockMvc.perform(patch("/api/v1/riskradar/incidents/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Status is required"));
    }

    private static IncidentCandidate candidate(String title) {
        return new IncidentCandidate(null, title, title, List.of(), Severity.HIGH, 0.8, 7.0, -0.5,
                List.of("https://example.com/" + title.hashCode()), Map.of(), LocalDateTime.now(),
                Map.of("source_type", "news"));
    }
}
