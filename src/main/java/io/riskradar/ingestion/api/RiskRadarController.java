package io.riskradar.ingestion.api;

import io.riskradar.ingestion.api.dto.ScanSummary;
import io.riskradar.ingestion.api.dto.ScrapingStatus;
import io.riskradar.ingestion.api.dto.SourceValidation;
import io.riskradar.ingestion.api.dto.SourcesInfo;
import io.riskradar.ingestion.api.dto.TextAnalysis;
import io.riskradar.ingestion.api.dto.TextAnalysisRequest;
import io.riskradar.ingestion.api.service.ScheduledThreatScanService;
import io.riskradar.ingestion.api.service.analysis.ThreatAnalysisService;
import io.riskradar.ingestion.api.service.scraping.ScrapingCoordinatorFactory;
import io.riskradar.ingestion.config.RiskRadarConfig;
import io.riskradar.ingestion.config.SourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/riskradar")
public class RiskRadarController {

    private static final Logger logger = LoggerFactory.getLogger(RiskRadarController.class);

    private final ScheduledThreatScanService scanService;
    private final ScrapingCoordinatorFactory coordinatorFactory;
    private final ThreatAnalysisService analysisService;
    private final RiskRadarConfig config;

    public RiskRadarController(ScheduledThreatScanService scanService,
                               ScrapingCoordinatorFactory coordinatorFactory,
                               ThreatAnalysisService analysisService,
                               RiskRadarConfig config) {
        this.scanService = scanService;
        this.coordinatorFactory = coordinatorFactory;
        this.analysisService = analysisService;
        this.config = config;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new LinkedHashMap<>();
        healthInfo.put("status", "UP");
        healthInfo.put("service", "RiskRadar Threat Ingestion Service");
        healthInfo.put("timestamp", LocalDateTime.now());
        healthInfo.put("scraping", scanService.status().state());
        return ResponseEntity.ok(healthInfo);
    }

    @PostMapping("/scan")
    public ScanSummary runScan() {
        logger.info("Manual scan requested");
        return scanService.runScan();
    }

    @PostMapping("/scan/stop")
    public ResponseEntity<Map<String, Object>> stopScan() {
        boolean stopped = scanService.stop();
        return ResponseEntity.ok(Map.of(
                "stopped", stopped,
                "message", stopped
                        ? "Stop requested; tasks already running will finish"
                        : "No scan has run yet"
        ));
    }

    @GetMapping("/scan/status")
    public ScrapingStatus scanStatus() {
        return scanService.status();
    }

    @GetMapping("/sources")
    public SourcesInfo getSources() {
        Map<String, List<SourceDescriptor>> byCategory = config.sources().stream()
                .collect(Collectors.groupingBy(SourceDescriptor::category, TreeMap::new, Collectors.toList()));

        return new SourcesInfo(byCategory, config.sources().size(), config.getEnabledSources().size(),
                LocalDateTime.now());
    }

    @GetMapping("/sources/types")
    public List<String> supportedSourceTypes() {
        return coordinatorFactory.create().supportedSourceTypes();
    }

    @PostMapping("/sources/validate")
    public SourceValidation validateSource(@RequestBody SourceDescriptor source) {
        return coordinatorFactory.create().validate(source);
    }

    @PostMapping("/analysis/text")
    public TextAnalysis analyzeText(@RequestBody TextAnalysisRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            throw new IllegalArgumentException("Text must not be empty");
        }
        return analysisService.analyzeText(request.text());
    }
}
