package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.abtest.AbTestManager;
import com.di.modelnova.lifecycle.abtest.AbTestResults;
import com.di.modelnova.lifecycle.alert.Alert;
import com.di.modelnova.lifecycle.alert.AlertCategory;
import com.di.modelnova.lifecycle.alert.AlertService;
import com.di.modelnova.lifecycle.alert.AlertSeverity;
import com.di.modelnova.lifecycle.backend.PredictionRecord;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.VersionRegistryService;
import com.di.modelnova.util.StatisticalTests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health reports for production models on top of {@link DriftDecayMonitor}, plus the alerts the monitor itself
 * does not raise: serving-segment changes and A/B traffic imbalance.
 */
@Slf4j
@Service
public class ProductionMonitoringService {

    static final double DRIFT_PENALTY = 0.2;
    static final double MAX_DECAY_PENALTY = 0.3;

    private final DriftDecayMonitor monitor;
    private final VersionRegistryService versionRegistry;
    private final AbTestManager abTestManager;
    private final AlertService alertService;
    private final LifecycleProperties props;

    private final Map<String, Set<String>> lastSegments = new ConcurrentHashMap<>();

    public ProductionMonitoringService(DriftDecayMonitor monitor, VersionRegistryService versionRegistry,
                                       AbTestManager abTestManager, AlertService alertService,
                                       LifecycleProperties props) {
        this.monitor = monitor;
        this.versionRegistry = versionRegistry;
        this.abTestManager = abTestManager;
        this.alertService = alertService;
        this.props = props;
    }

    /** Reports on the production version of every model, keyed by version id. */
    public Map<String, ModelHealthReport> monitorProductionModels() {
        Map<String, ModelHealthReport> reports = new LinkedHashMap<>();
        for (ModelVersion version : versionRegistry.listProductionVersions()) {
            try {
                reports.put(version.getVersionId(), monitorSingleModel(version.getVersionId()));
            } catch (RuntimeException e) {
                log.error("[MONITOR] Health check of {} failed: {}", version.getVersionId(), e.getMessage(), e);
            }
        }
        return reports;
    }

    public ModelHealthReport monitorSingleModel(String modelId) {
        MonitoringFinding drift = monitor.evaluateDrift(modelId);
        MonitoringFinding decay = monitor.evaluateDecay(modelId);
        List<PredictionRecord> window = monitor.recentWindow(modelId);
        return ModelHealthReport.builder()
                .modelId(modelId)
                .armed(monitor.isArmed(modelId))
                .drift(drift)
                .decay(decay)
                .predictionDistribution(distributionOf(window))
                .segments(checkSegments(modelId, window))
                .healthScore(healthScore(drift, decay))
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * Compares the observed treatment share of each active test with its configured fraction and raises a
     * WARNING for every test off by more than {@code imbalance-tolerance}. Tests without enough predictions in
     * both arms are skipped, as are tests that still have an unresolved imbalance alert.
     */
    public List<Alert> checkAbTestBalance() {
        List<Alert> raised = new ArrayList<>();
        double tolerance = props.getAbtest().getImbalanceTolerance();
        int minPerArm = props.getAbtest().getMinSamplesPerArm();
        abTestManager.listActiveTests().stream()
                .filter(test -> !alertService.hasOpenAlert(familyOf(test.getControlVersionId()),
                        AlertCategory.AB_TRAFFIC_IMBALANCE, test.getTestId()))
                .forEach(test -> abTestManager.getResults(test.getTestId()).toOptional()
                        .filter(r -> r.getControl().getPredictions() + r.getTreatment().getPredictions() >= 2L * minPerArm)
                        .filter(r -> Math.abs(r.getObservedTreatmentShare() - r.getTrafficFraction()) > tolerance)
                        .flatMap(r -> raiseImbalance(test.getControlVersionId(), r, tolerance))
                        .ifPresent(raised::add));
        return raised;
    }

    static double healthScore(MonitoringFinding drift, MonitoringFinding decay) {
        double score = 1.0;
        if (drift != null && drift.isDetected()) {
            score -= DRIFT_PENALTY;
        }
        if (decay != null && decay.isDetected()) {
            FindingDetail accuracy = decay.getDetails().get("accuracy");
            double drop = accuracy != null ? Math.max(0.0, accuracy.getBaseline() - accuracy.getStatistic()) : 0.0;
            score -= Math.min(MAX_DECAY_PENALTY, drop);
        }
        return Math.max(0.0, score);
    }

    private Optional<Alert> raiseImbalance(String controlVersionId, AbTestResults results, double tolerance) {
        String modelId = familyOf(controlVersionId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("testId", results.getTestId());
        details.put("configuredFraction", results.getTrafficFraction());
        details.put("observedShare", results.getObservedTreatmentShare());
        details.put("tolerance", tolerance);
        return alertService.raise(modelId, AlertCategory.AB_TRAFFIC_IMBALANCE, AlertSeverity.WARNING,
                String.format("A/B test %s routes %.1f%% to treatment, configured %.1f%%", results.getTestId(),
                        results.getObservedTreatmentShare() * 100, results.getTrafficFraction() * 100),
                details, results.getTestId());
    }

    private String familyOf(String versionId) {
        return versionRegistry.getVersion(versionId)
                .map(ModelVersion::getModelId)
                .orElse(versionId);
    }

    private static ModelHealthReport.PredictionDistribution distributionOf(List<PredictionRecord> window) {
        if (window.isEmpty()) {
            return null;
        }
        double[] values = window.stream().mapToDouble(PredictionRecord::getPrediction).toArray();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return ModelHealthReport.PredictionDistribution.builder()
                .samples(values.length)
                .mean(StatisticalTests.mean(values))
                .std(StatisticalTests.std(values))
                .min(min)
                .max(max)
                .build();
    }

    private ModelHealthReport.SegmentSummary checkSegments(String modelId, List<PredictionRecord> window) {
        String key = props.getMonitor().getSegmentKey();
        if (key == null || key.isBlank()) {
            return null;
        }
        Map<String, Long> counts = new TreeMap<>();
        for (PredictionRecord record : window) {
            String value = record.getMetadata().get(key);
            if (value != null) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        Set<String> current = Set.copyOf(counts.keySet());
        Set<String> previous = lastSegments.put(modelId, current);
        boolean changed = previous != null ? !previous.equals(current) : current.size() > 1;
        if (changed && !current.isEmpty()) {
            alertService.raise(modelId, AlertCategory.SEGMENT_CHANGE, AlertSeverity.INFO,
                    "Serving segments changed: " + current.size() + " distinct " + key + " value(s)",
                    Map.of("key", key, "segments", counts, "previous", previous != null ? previous : Set.of()),
                    null);
        }
        return ModelHealthReport.SegmentSummary.builder()
                .key(key)
                .counts(counts)
                .changed(changed)
                .build();
    }
}
