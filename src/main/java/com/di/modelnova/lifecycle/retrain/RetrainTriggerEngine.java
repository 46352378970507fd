package com.di.modelnova.lifecycle.retrain;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.OperationResult;
import com.di.modelnova.lifecycle.abtest.AbTest;
import com.di.modelnova.lifecycle.abtest.AbTestManager;
import com.di.modelnova.lifecycle.backend.ModelInfo;
import com.di.modelnova.lifecycle.backend.ModelRegistryClient;
import com.di.modelnova.lifecycle.backend.RegistryException;
import com.di.modelnova.lifecycle.monitor.DriftDecayMonitor;
import com.di.modelnova.lifecycle.monitor.FindingType;
import com.di.modelnova.lifecycle.monitor.MonitoringFinding;
import com.di.modelnova.lifecycle.pipeline.PipelineOrchestrator;
import com.di.modelnova.lifecycle.pipeline.PipelineRun;
import com.di.modelnova.lifecycle.pipeline.PipelineStatus;
import com.di.modelnova.lifecycle.pipeline.TriggerReason;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.VersionRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Decides when a served model needs retraining and submits the pipeline run.
 * <p>
 * Reasons are evaluated independently: drift, decay, then schedule age. Any reason submits one run for the
 * model's family with the first reason that held. A family that already has a run in flight, or an active A/B
 * test, is not submitted again.
 * <p>
 * Drift and decay are only re-evaluated once enough new predictions arrived; otherwise the latest stored
 * finding is reused as long as it is newer than the family's newest trained version. Schedule age is measured
 * from that newest version, so a candidate trained by an earlier run resets the clock.
 */
@Slf4j
@Service
public class RetrainTriggerEngine {

    private final DriftDecayMonitor monitor;
    private final ModelRegistryClient registryClient;
    private final VersionRegistryService versionRegistry;
    private final PipelineOrchestrator orchestrator;
    private final AbTestManager abTestManager;
    private final LifecycleProperties.Retrain config;
    private final Clock clock;

    private final Deque<RetrainingRecord> history = new ArrayDeque<>();

    @Autowired
    public RetrainTriggerEngine(DriftDecayMonitor monitor, ModelRegistryClient registryClient,
                                VersionRegistryService versionRegistry, PipelineOrchestrator orchestrator,
                                AbTestManager abTestManager, LifecycleProperties props) {
        this(monitor, registryClient, versionRegistry, orchestrator, abTestManager, props, Clock.systemUTC());
    }

    public RetrainTriggerEngine(DriftDecayMonitor monitor, ModelRegistryClient registryClient,
                                VersionRegistryService versionRegistry, PipelineOrchestrator orchestrator,
                                AbTestManager abTestManager, LifecycleProperties props, Clock clock) {
        this.monitor = monitor;
        this.registryClient = registryClient;
        this.versionRegistry = versionRegistry;
        this.orchestrator = orchestrator;
        this.abTestManager = abTestManager;
        this.config = props.getRetrain();
        this.clock = clock;
    }

    /**
     * Evaluates drift, decay and schedule age for a served model (a version id) and submits a retrain if any
     * of them calls for it.
     */
    public OperationResult<RetrainDecision> checkAndMaybeRetrain(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "modelId is required");
        }
        Optional<ModelInfo> info;
        try {
            info = registryClient.get(modelId);
        } catch (RegistryException e) {
            return OperationResult.failure(FailureKind.BACKEND_ERROR,
                    "Model registry lookup failed for " + modelId + ": " + e.getMessage());
        }
        if (info.isEmpty()) {
            return OperationResult.notFound("Model not found in registry: " + modelId);
        }
        String family = familyOf(info.get());
        Instant trainedAt = newestTrainedAt(family, info.get().getTrainedAt());

        List<TriggerReason> reasons = new ArrayList<>();
        if (detected(modelId, FindingType.DATA_DRIFT, trainedAt)) {
            reasons.add(TriggerReason.DRIFT_DETECTED);
        }
        if (detected(modelId, FindingType.MODEL_DECAY, trainedAt)) {
            reasons.add(TriggerReason.DECAY_DETECTED);
        }
        if (trainedAt != null && Duration.between(trainedAt, clock.instant()).compareTo(config.getScheduledInterval()) >= 0) {
            reasons.add(TriggerReason.SCHEDULED);
        }

        RetrainDecision.RetrainDecisionBuilder decision = RetrainDecision.builder()
                .modelId(modelId)
                .modelFamily(family)
                .reasons(List.copyOf(reasons))
                .decidedAt(clock.instant());
        if (reasons.isEmpty()) {
            log.debug("[RETRAIN] {}: no retrain needed", modelId);
            return OperationResult.ok(decision.triggered(false).message("No retrain needed").build());
        }
        Optional<AbTest> activeTest = activeTestFor(family);
        if (activeTest.isPresent()) {
            log.info("[RETRAIN] {}: {} held but A/B test {} is still active for {}", modelId, reasons,
                    activeTest.get().getTestId(), family);
            return OperationResult.ok(decision.triggered(false)
                    .message("A/B test " + activeTest.get().getTestId() + " is still active for " + family).build());
        }

        OperationResult<PipelineRun> submitted = orchestrator.submitPipeline(family, reasons.get(0));
        if (submitted.isFailure()) {
            if (submitted.getFailureKind() == FailureKind.CONFLICT) {
                log.info("[RETRAIN] {}: {} held but {} already has a run in flight", modelId, reasons, family);
                return OperationResult.ok(decision.triggered(false).message(submitted.getMessage()).build());
            }
            return submitted.asFailure();
        }
        String runId = submitted.getValue().getRunId();
        record(modelId, family, reasons, runId);
        log.info("[RETRAIN] {}: submitted run {} for {} (reasons={})", modelId, runId, family, reasons);
        return OperationResult.ok(decision.triggered(true).runId(runId)
                .message("Retrain submitted for " + reasons.get(0)).build());
    }

    public OperationResult<RetrainDecision> triggerManual(String modelFamily) {
        OperationResult<PipelineRun> submitted = orchestrator.submitPipeline(modelFamily, TriggerReason.MANUAL);
        if (submitted.isFailure()) {
            return submitted.asFailure();
        }
        PipelineRun run = submitted.getValue();
        record(null, run.getModelFamily(), List.of(TriggerReason.MANUAL), run.getRunId());
        log.info("[RETRAIN] Manual retrain of {} submitted as {}", run.getModelFamily(), run.getRunId());
        return OperationResult.ok(RetrainDecision.builder()
                .modelFamily(run.getModelFamily())
                .triggered(true)
                .reasons(List.of(TriggerReason.MANUAL))
                .runId(run.getRunId())
                .message("Manual retrain submitted")
                .decidedAt(clock.instant())
                .build());
    }

    /** Checks every model the monitor is watching. */
    public List<RetrainDecision> checkArmedModels() {
        return checkAll(List.copyOf(monitor.armedModels()));
    }

    /** Checks the production version of every model. */
    public List<RetrainDecision> sweepProductionModels() {
        return checkAll(versionRegistry.listProductionVersions().stream()
                .map(ModelVersion::getVersionId)
                .collect(Collectors.toList()));
    }

    /** Newest first; {@code modelFamily} may be null. */
    public List<RetrainingRecord> getHistory(String modelFamily, int limit) {
        synchronized (history) {
            return history.stream()
                    .filter(r -> modelFamily == null || modelFamily.equals(r.getModelFamily()))
                    .limit(Math.max(1, limit))
                    .collect(Collectors.toList());
        }
    }

    public RetrainStats getStats() {
        List<RetrainingRecord> records;
        synchronized (history) {
            records = new ArrayList<>(history);
        }
        long successful = 0;
        long failed = 0;
        long inProgress = 0;
        double totalHours = 0;
        int timed = 0;
        for (RetrainingRecord r : records) {
            Optional<PipelineRun> run = orchestrator.getRun(r.getRunId());
            if (run.isEmpty() || !run.get().isTerminal()) {
                inProgress++;
                continue;
            }
            if (run.get().getStatus() == PipelineStatus.SUCCESS) {
                successful++;
            } else {
                failed++;
            }
            Duration duration = run.get().getDuration();
            if (duration != null) {
                totalHours += duration.toMillis() / 3_600_000.0;
                timed++;
            }
        }
        Map<TriggerReason, Long> counts = new EnumMap<>(TriggerReason.class);
        records.forEach(r -> counts.merge(r.getReason(), 1L, Long::sum));
        Map<String, Long> byTrigger = new LinkedHashMap<>();
        counts.forEach((reason, n) -> byTrigger.put(reason.name(), n));
        long finished = successful + failed;
        return RetrainStats.builder()
                .totalRetrains(records.size())
                .successful(successful)
                .failed(failed)
                .inProgress(inProgress)
                .successRate(finished == 0 ? 0.0 : (double) successful / finished)
                .byTrigger(byTrigger)
                .averageDurationHours(timed == 0 ? 0.0 : totalHours / timed)
                .build();
    }

    private List<RetrainDecision> checkAll(List<String> modelIds) {
        List<RetrainDecision> decisions = new ArrayList<>();
        for (String modelId : modelIds) {
            try {
                OperationResult<RetrainDecision> result = checkAndMaybeRetrain(modelId);
                if (result.isSuccess()) {
                    decisions.add(result.getValue());
                } else {
                    log.warn("[RETRAIN] Check of {} failed: {} {}", modelId, result.getFailureKind(), result.getMessage());
                }
            } catch (RuntimeException e) {
                log.error("[RETRAIN] Check of {} crashed: {}", modelId, e.getMessage(), e);
            }
        }
        return decisions;
    }

    private void record(String modelId, String family, List<TriggerReason> reasons, String runId) {
        RetrainingRecord entry = RetrainingRecord.builder()
                .recordId("retrain-" + UUID.randomUUID())
                .modelId(modelId)
                .modelFamily(family)
                .reason(reasons.get(0))
                .allReasons(List.copyOf(reasons))
                .runId(runId)
                .triggeredAt(clock.instant())
                .build();
        synchronized (history) {
            history.addFirst(entry);
            while (history.size() > config.getHistoryLimit()) {
                history.removeLast();
            }
        }
    }

    private boolean detected(String modelId, FindingType type, Instant newestTrainedAt) {
        if (monitor.isReadyForEvaluation(modelId, type)) {
            MonitoringFinding finding = type == FindingType.DATA_DRIFT
                    ? monitor.evaluateDrift(modelId)
                    : monitor.evaluateDecay(modelId);
            return finding.isDetected();
        }
        return monitor.latestFinding(modelId, type)
                .filter(f -> newestTrainedAt == null || f.getEvaluatedAt() == null
                        || f.getEvaluatedAt().isAfter(newestTrainedAt))
                .map(MonitoringFinding::isDetected)
                .orElse(false);
    }

    private Instant newestTrainedAt(String family, Instant fallback) {
        return versionRegistry.getVersions(family).stream()
                .map(ModelVersion::getTrainedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(fallback);
    }

    private Optional<AbTest> activeTestFor(String family) {
        return abTestManager.listActiveTests().stream()
                .filter(t -> family.equals(familyOfVersion(t.getControlVersionId()))
                        || family.equals(familyOfVersion(t.getTreatmentVersionId())))
                .findFirst();
    }

    private String familyOfVersion(String versionId) {
        return versionRegistry.getVersion(versionId).map(ModelVersion::getModelId).orElse(null);
    }

    private String familyOf(ModelInfo info) {
        if (info.getFamily() != null && !info.getFamily().isBlank()) {
            return info.getFamily();
        }
        return versionRegistry.getVersion(info.getModelId())
                .map(ModelVersion::getModelId)
                .orElse(info.getModelId());
    }
}
