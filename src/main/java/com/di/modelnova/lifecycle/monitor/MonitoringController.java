package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.lifecycle.alert.Alert;
import com.di.modelnova.lifecycle.backend.PredictionRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Prediction intake, on-demand drift and decay evaluation, findings and health reports.
 */
@RestController
@RequestMapping("/api/lifecycle/monitoring")
@RequiredArgsConstructor
public class MonitoringController {

    private final DriftDecayMonitor monitor;
    private final ProductionMonitoringService productionMonitoring;

    @PostMapping(value = "/{modelId}/predictions", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PredictionRecord> record(@PathVariable String modelId,
                                                   @Valid @RequestBody PredictionRequest request) {
        PredictionRecord record = monitor.recordPrediction(modelId, request.getFeatures(), request.getPrediction(),
                request.getProbability(), request.getGroundTruth(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @GetMapping(value = "/{modelId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitoringStatus> status(@PathVariable String modelId) {
        return ResponseEntity.ok(monitor.getMonitoringStatus(modelId));
    }

    @PostMapping(value = "/{modelId}/drift", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitoringFinding> drift(@PathVariable String modelId) {
        return ResponseEntity.ok(monitor.evaluateDrift(modelId));
    }

    @PostMapping(value = "/{modelId}/decay", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitoringFinding> decay(@PathVariable String modelId) {
        return ResponseEntity.ok(monitor.evaluateDecay(modelId));
    }

    @GetMapping(value = "/{modelId}/findings", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<MonitoringFinding>> findings(@PathVariable String modelId,
                                                            @RequestParam(required = false) FindingType type,
                                                            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(monitor.findings(modelId, type, limit));
    }

    @PostMapping(value = "/{modelId}/arm", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitoringStatus> arm(@PathVariable String modelId) {
        monitor.arm(modelId);
        return ResponseEntity.ok(monitor.getMonitoringStatus(modelId));
    }

    @PostMapping(value = "/{modelId}/disarm", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitoringStatus> disarm(@PathVariable String modelId) {
        monitor.disarm(modelId);
        return ResponseEntity.ok(monitor.getMonitoringStatus(modelId));
    }

    @GetMapping(value = "/{modelId}/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ModelHealthReport> health(@PathVariable String modelId) {
        return ResponseEntity.ok(productionMonitoring.monitorSingleModel(modelId));
    }

    @GetMapping(value = "/production", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, ModelHealthReport>> production() {
        return ResponseEntity.ok(productionMonitoring.monitorProductionModels());
    }

    @PostMapping(value = "/ab-balance", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Alert>> abBalance() {
        return ResponseEntity.ok(productionMonitoring.checkAbTestBalance());
    }

    @Data
    public static class PredictionRequest {
        @NotNull
        private Map<String, Double> features;
        @NotNull
        private Double prediction;
        private Double probability;
        private Double groundTruth;
        private Map<String, String> metadata;
    }
}
