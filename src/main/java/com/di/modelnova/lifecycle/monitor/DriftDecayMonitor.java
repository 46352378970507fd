package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.alert.AlertCategory;
import com.di.modelnova.lifecycle.alert.AlertService;
import com.di.modelnova.lifecycle.alert.AlertSeverity;
import com.di.modelnova.lifecycle.backend.FeatureBaseline;
import com.di.modelnova.lifecycle.backend.ModelInfo;
import com.di.modelnova.lifecycle.backend.ModelRegistryClient;
import com.di.modelnova.lifecycle.backend.PredictionLogStore;
import com.di.modelnova.lifecycle.backend.PredictionRecord;
import com.di.modelnova.lifecycle.backend.RegistryException;
import com.di.modelnova.util.LifecycleMetrics;
import com.di.modelnova.util.StatisticalTests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Watches served models for data drift (feature distributions moving away from training) and decay
 * (accuracy or F1 falling below the training baseline).
 * <p>
 * Every evaluation is persisted as a {@link MonitoringFinding}. A DETECTED finding raises exactly one alert,
 * CRITICAL when its magnitude exceeds {@code critical-multiplier} times the threshold, WARNING otherwise.
 * Models are keyed by the id they are registered under in the model registry (a version id).
 */
@Slf4j
@Service
public class DriftDecayMonitor {

    private final LifecycleProperties.Monitor config;
    private final RecentPredictionBuffer buffer;
    private final PredictionLogStore predictionLog;
    private final ModelRegistryClient registryClient;
    private final FindingStore findingStore;
    private final AlertService alertService;
    private final LifecycleMetrics metrics;
    private final Set<String> armed = ConcurrentHashMap.newKeySet();

    public DriftDecayMonitor(LifecycleProperties props, RecentPredictionBuffer buffer, PredictionLogStore predictionLog,
                             ModelRegistryClient registryClient, FindingStore findingStore, AlertService alertService,
                             LifecycleMetrics metrics) {
        this.config = props.getMonitor();
        this.buffer = buffer;
        this.predictionLog = predictionLog;
        this.registryClient = registryClient;
        this.findingStore = findingStore;
        this.alertService = alertService;
        this.metrics = metrics;
    }

    // --- Recording and arming ---

    /**
     * Appends a served prediction to the prediction log and the recent window. A failing log write is reported
     * to the caller; the in-memory window is only updated once the log accepted the record.
     */
    public PredictionRecord recordPrediction(String modelId, Map<String, Double> features, double prediction,
                                             Double probability, Double groundTruth, Map<String, String> metadata) {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId is required");
        }
        PredictionRecord record = PredictionRecord.builder()
                .modelId(modelId)
                .features(withoutNulls(features))
                .prediction(prediction)
                .probability(probability)
                .groundTruth(groundTruth)
                .metadata(withoutNulls(metadata))
                .recordedAt(Instant.now())
                .build();
        predictionLog.logPrediction(record);
        buffer.append(record);
        return record;
    }

    public void arm(String modelId) {
        if (armed.add(modelId)) {
            log.info("[MONITOR] Armed monitoring for {}", modelId);
        }
    }

    public void disarm(String modelId) {
        if (armed.remove(modelId)) {
            log.info("[MONITOR] Disarmed monitoring for {}", modelId);
        }
    }

    public boolean isArmed(String modelId) {
        return armed.contains(modelId);
    }

    public Set<String> armedModels() {
        return Set.copyOf(armed);
    }

    /** True when at least {@code min-samples} new predictions (labelled ones for decay) arrived since the last evaluation. */
    public boolean isReadyForEvaluation(String modelId, FindingType type) {
        return buffer.newSinceEvaluation(modelId, type) >= config.getMinSamples();
    }

    // --- Drift ---

    public MonitoringFinding evaluateDrift(String modelId) {
        buffer.markEvaluated(modelId, FindingType.DATA_DRIFT);
        Optional<ModelInfo> info = lookup(modelId);
        if (info.isEmpty() || info.get().getBaselineStatistics().isEmpty()) {
            return persist(skeleton(modelId, FindingType.DATA_DRIFT, FindingOutcome.UNKNOWN, 0,
                    info.isEmpty() ? "model not found in registry" : "no baseline feature statistics"));
        }
        List<PredictionRecord> recent = recentWindow(modelId);
        if (recent.size() < config.getMinSamples()) {
            return persist(skeleton(modelId, FindingType.DATA_DRIFT, FindingOutcome.INSUFFICIENT_DATA, recent.size(),
                    "need " + config.getMinSamples() + " recent predictions, have " + recent.size()));
        }

        Random random = config.getRandomSeed() != null ? new Random(config.getRandomSeed()) : new Random();
        double threshold = config.getDriftThreshold();
        Map<String, FindingDetail> details = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (Map.Entry<String, FeatureBaseline> e : info.get().getBaselineStatistics().entrySet()) {
            String feature = e.getKey();
            double[] values = recent.stream()
                    .map(r -> r.getFeatures().get(feature))
                    .filter(v -> v != null && !v.isNaN())
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            if (values.length < config.getMinFeatureSamples()) {
                skipped.add(feature);
                continue;
            }
            int referenceSize = Math.min(config.getReferenceSampleCap(), values.length);
            double[] reference = StatisticalTests.normalSample(e.getValue().getMean(), e.getValue().getStd(),
                    referenceSize, random);
            double ks = StatisticalTests.ksStatistic(values, reference);
            details.put(feature, FindingDetail.builder()
                    .name(feature)
                    .statistic(ks)
                    .threshold(threshold)
                    .baseline(e.getValue().getMean())
                    .pValue(StatisticalTests.ksPValue(ks, values.length, referenceSize))
                    .sampleSize(values.length)
                    .detected(ks > threshold)
                    .build());
        }
        if (details.isEmpty()) {
            return persist(skeleton(modelId, FindingType.DATA_DRIFT, FindingOutcome.INSUFFICIENT_DATA, recent.size(),
                    "no feature had " + config.getMinFeatureSamples() + " values").toBuilder()
                    .skippedFeatures(skipped).build());
        }

        List<String> drifted = details.values().stream()
                .filter(FindingDetail::isDetected)
                .map(FindingDetail::getName)
                .collect(Collectors.toList());
        double magnitude = details.values().stream()
                .filter(FindingDetail::isDetected)
                .mapToDouble(d -> d.getStatistic() / threshold)
                .max().orElse(0.0);
        MonitoringFinding finding = skeleton(modelId, FindingType.DATA_DRIFT,
                drifted.isEmpty() ? FindingOutcome.NOT_DETECTED : FindingOutcome.DETECTED, recent.size(),
                drifted.isEmpty() ? "no feature above threshold " + threshold : "drifted features: " + drifted)
                .toBuilder()
                .details(details)
                .skippedFeatures(skipped)
                .magnitude(magnitude)
                .build();
        persist(finding);
        if (finding.isDetected()) {
            raiseAlert(finding, AlertCategory.DATA_DRIFT,
                    "Data drift detected in " + drifted.size() + " feature(s): " + String.join(", ", drifted),
                    Map.of("driftedFeatures", drifted, "threshold", threshold));
        }
        return finding;
    }

    // --- Decay ---

    public MonitoringFinding evaluateDecay(String modelId) {
        buffer.markEvaluated(modelId, FindingType.MODEL_DECAY);
        Optional<ModelInfo> info = lookup(modelId);
        Double baselineAccuracy = info.map(i -> i.metric("accuracy")).orElse(null);
        Double baselineF1 = info.map(i -> i.metric("f1_score")).orElse(null);
        if (info.isEmpty() || (baselineAccuracy == null && baselineF1 == null)) {
            return persist(skeleton(modelId, FindingType.MODEL_DECAY, FindingOutcome.UNKNOWN, 0,
                    info.isEmpty() ? "model not found in registry" : "no baseline accuracy or f1_score"));
        }
        List<PredictionRecord> labelled = recentWindow(modelId).stream()
                .filter(PredictionRecord::hasGroundTruth)
                .collect(Collectors.toList());
        if (labelled.size() < config.getMinSamples()) {
            return persist(skeleton(modelId, FindingType.MODEL_DECAY, FindingOutcome.INSUFFICIENT_DATA, labelled.size(),
                    "need " + config.getMinSamples() + " labelled predictions, have " + labelled.size()));
        }

        List<Double> truth = labelled.stream().map(PredictionRecord::getGroundTruth).collect(Collectors.toList());
        List<Double> predicted = labelled.stream().map(PredictionRecord::getPrediction).collect(Collectors.toList());
        double threshold = config.getDecayThreshold();
        Map<String, FindingDetail> details = new LinkedHashMap<>();
        if (baselineAccuracy != null) {
            details.put("accuracy", decayDetail("accuracy", StatisticalTests.accuracy(truth, predicted),
                    baselineAccuracy, threshold, labelled.size()));
        }
        if (baselineF1 != null) {
            details.put("f1_score", decayDetail("f1_score", StatisticalTests.weightedF1(truth, predicted),
                    baselineF1, threshold, labelled.size()));
        }
        List<String> decayed = details.values().stream()
                .filter(FindingDetail::isDetected)
                .map(FindingDetail::getName)
                .collect(Collectors.toList());
        double magnitude = details.values().stream()
                .filter(FindingDetail::isDetected)
                .mapToDouble(d -> (d.getBaseline() - d.getStatistic()) / threshold)
                .max().orElse(0.0);
        MonitoringFinding finding = skeleton(modelId, FindingType.MODEL_DECAY,
                decayed.isEmpty() ? FindingOutcome.NOT_DETECTED : FindingOutcome.DETECTED, labelled.size(),
                decayed.isEmpty() ? "metrics within " + threshold + " of baseline" : "decayed metrics: " + decayed)
                .toBuilder()
                .details(details)
                .magnitude(magnitude)
                .build();
        persist(finding);
        if (finding.isDetected()) {
            Map<String, Object> alertDetails = new LinkedHashMap<>();
            details.values().forEach(d -> alertDetails.put(d.getName() + "_drop", d.getBaseline() - d.getStatistic()));
            alertDetails.put("threshold", threshold);
            raiseAlert(finding, AlertCategory.MODEL_DECAY, "Model decay detected: " + String.join(", ", decayed)
                    + " dropped more than " + threshold + " below baseline", alertDetails);
        }
        return finding;
    }

    // --- Read paths ---

    public MonitoringStatus getMonitoringStatus(String modelId) {
        List<PredictionRecord> window = buffer.snapshot(modelId);
        return MonitoringStatus.builder()
                .modelId(modelId)
                .armed(isArmed(modelId))
                .bufferSize(window.size())
                .bufferCapacity(buffer.capacity())
                .labelledInBuffer((int) window.stream().filter(PredictionRecord::hasGroundTruth).count())
                .newSinceDriftEvaluation(buffer.newSinceEvaluation(modelId, FindingType.DATA_DRIFT))
                .newSinceDecayEvaluation(buffer.newSinceEvaluation(modelId, FindingType.MODEL_DECAY))
                .latestDrift(findingStore.findLatest(modelId, FindingType.DATA_DRIFT).orElse(null))
                .latestDecay(findingStore.findLatest(modelId, FindingType.MODEL_DECAY).orElse(null))
                .recentAlerts(alertService.getAlerts(modelId, null, null, 10))
                .build();
    }

    public Optional<MonitoringFinding> latestFinding(String modelId, FindingType type) {
        return findingStore.findLatest(modelId, type);
    }

    public List<MonitoringFinding> findings(String modelId, FindingType type, int limit) {
        return findingStore.find(modelId, type, Math.max(1, limit));
    }

    /** The recent window, falling back to the prediction log when the buffer is empty (e.g. after a restart). */
    public List<PredictionRecord> recentWindow(String modelId) {
        List<PredictionRecord> recent = buffer.snapshot(modelId);
        if (!recent.isEmpty()) {
            return recent;
        }
        return predictionLog.recentPredictions(modelId, buffer.capacity());
    }

    // --- Helpers ---

    private Optional<ModelInfo> lookup(String modelId) {
        try {
            return registryClient.get(modelId);
        } catch (RegistryException e) {
            log.warn("[MONITOR] Registry lookup failed for {}: {}", modelId, e.getMessage());
            return Optional.empty();
        }
    }

    private static <V> Map<String, V> withoutNulls(Map<String, V> map) {
        if (map == null) return Map.of();
        return map.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    private static FindingDetail decayDetail(String name, double current, double baseline, double threshold, int n) {
        return FindingDetail.builder()
                .name(name)
                .statistic(current)
                .baseline(baseline)
                .threshold(threshold)
                .sampleSize(n)
                .detected(baseline - current > threshold)
                .build();
    }

    private static MonitoringFinding skeleton(String modelId, FindingType type, FindingOutcome outcome, int sampleSize,
                                              String reason) {
        return MonitoringFinding.builder()
                .findingId("finding-" + UUID.randomUUID())
                .modelId(modelId)
                .type(type)
                .outcome(outcome)
                .details(Map.of())
                .skippedFeatures(List.of())
                .sampleSize(sampleSize)
                .reason(reason)
                .evaluatedAt(Instant.now())
                .build();
    }

    private MonitoringFinding persist(MonitoringFinding finding) {
        findingStore.save(finding);
        metrics.recordEvaluation(finding.getType().name(), finding.getOutcome().name());
        log.info("[MONITOR] {} evaluation for {}: {} (n={}) {}", finding.getType(), finding.getModelId(),
                finding.getOutcome(), finding.getSampleSize(), finding.getReason());
        return finding;
    }

    private void raiseAlert(MonitoringFinding finding, AlertCategory category, String message,
                            Map<String, Object> extra) {
        AlertSeverity severity = finding.getMagnitude() > config.getCriticalMultiplier()
                ? AlertSeverity.CRITICAL
                : AlertSeverity.WARNING;
        Map<String, Object> details = new LinkedHashMap<>(extra);
        details.put("findingId", finding.getFindingId());
        details.put("magnitude", finding.getMagnitude());
        alertService.raise(finding.getModelId(), category, severity, message, details, finding.getFindingId());
    }
}
