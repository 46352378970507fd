package com.di.modelnova.lifecycle.pipeline;

import com.di.modelnova.config.ExecutorConfig;
import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.OperationResult;
import com.di.modelnova.lifecycle.abtest.AbTest;
import com.di.modelnova.lifecycle.abtest.AbTestManager;
import com.di.modelnova.lifecycle.alert.AlertCategory;
import com.di.modelnova.lifecycle.alert.AlertService;
import com.di.modelnova.lifecycle.alert.AlertSeverity;
import com.di.modelnova.lifecycle.backend.DataValidationReport;
import com.di.modelnova.lifecycle.backend.DatasetHandle;
import com.di.modelnova.lifecycle.backend.DatasetValidator;
import com.di.modelnova.lifecycle.backend.TrainingBackend;
import com.di.modelnova.lifecycle.backend.TrainingDataSource;
import com.di.modelnova.lifecycle.backend.TrainingResult;
import com.di.modelnova.lifecycle.monitor.DriftDecayMonitor;
import com.di.modelnova.lifecycle.registry.ModelLocks;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.NewVersionRequest;
import com.di.modelnova.lifecycle.registry.VersionRegistryService;
import com.di.modelnova.util.LifecycleMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Takes a model family from raw data to a deployed (or staged) candidate version.
 * <p>
 * Stages run strictly in {@link PipelineStage} order. The first failing stage ends the run as FAILED with its
 * message as the run error; production is only ever changed by the deployment stage, so an earlier failure leaves
 * it untouched. At most one run per family is pending or running. Cancellation is checked between stages up to
 * deployment.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    static final String MDC_RUN_ID = "pipeline_run_id";
    static final String MDC_FAMILY = "model_family";

    private final TrainingDataSource dataSource;
    private final DatasetValidator datasetValidator;
    private final TrainingBackend trainingBackend;
    private final VersionRegistryService versionRegistry;
    private final CandidateTestSuite testSuite;
    private final AbTestManager abTestManager;
    private final DriftDecayMonitor monitor;
    private final AlertService alertService;
    private final PipelineRunStore runStore;
    private final ModelLocks locks;
    private final LifecycleProperties.Pipeline config;
    private final LifecycleMetrics metrics;
    private final ExecutorService pipelineExecutor;
    private final ExecutorService trainingExecutor;

    private final Set<String> inFlightFamilies = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public PipelineOrchestrator(TrainingDataSource dataSource,
                                DatasetValidator datasetValidator,
                                TrainingBackend trainingBackend,
                                VersionRegistryService versionRegistry,
                                CandidateTestSuite testSuite,
                                AbTestManager abTestManager,
                                DriftDecayMonitor monitor,
                                AlertService alertService,
                                PipelineRunStore runStore,
                                ModelLocks locks,
                                LifecycleProperties props,
                                LifecycleMetrics metrics,
                                @Qualifier(ExecutorConfig.PIPELINE_EXECUTOR) ExecutorService pipelineExecutor,
                                @Qualifier(ExecutorConfig.TRAINING_EXECUTOR) ExecutorService trainingExecutor) {
        this.dataSource = dataSource;
        this.datasetValidator = datasetValidator;
        this.trainingBackend = trainingBackend;
        this.versionRegistry = versionRegistry;
        this.testSuite = testSuite;
        this.abTestManager = abTestManager;
        this.monitor = monitor;
        this.alertService = alertService;
        this.runStore = runStore;
        this.locks = locks;
        this.config = props.getPipeline();
        this.metrics = metrics;
        this.pipelineExecutor = pipelineExecutor;
        this.trainingExecutor = trainingExecutor;
    }

    // --- Entry points ---

    public PipelineRun runPipeline(String modelFamily, TriggerReason reason) {
        return runPipeline(modelFamily, reason, Map.of());
    }

    /**
     * Runs every stage on the calling thread and returns the terminal run.
     *
     * @throws IllegalArgumentException when the family is blank
     * @throws IllegalStateException    when a run for the family is already pending or running
     */
    public PipelineRun runPipeline(String modelFamily, TriggerReason reason, Map<String, Object> hyperparameters) {
        if (modelFamily == null || modelFamily.isBlank()) {
            throw new IllegalArgumentException("modelFamily is required");
        }
        String family = modelFamily.trim();
        if (!inFlightFamilies.add(family)) {
            throw new IllegalStateException("A pipeline run for " + family + " is already in flight");
        }
        try {
            PipelineRun run = newRun(family, reason);
            runStore.save(run);
            return execute(run.getRunId(), hyperparameters);
        } finally {
            inFlightFamilies.remove(family);
        }
    }

    public OperationResult<PipelineRun> submitPipeline(String modelFamily, TriggerReason reason) {
        return submitPipeline(modelFamily, reason, Map.of());
    }

    /**
     * Creates a PENDING run and executes it on the pipeline pool. Returns at once.
     */
    public OperationResult<PipelineRun> submitPipeline(String modelFamily, TriggerReason reason,
                                                       Map<String, Object> hyperparameters) {
        if (modelFamily == null || modelFamily.isBlank()) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "modelFamily is required");
        }
        String family = modelFamily.trim();
        if (!inFlightFamilies.add(family)) {
            return OperationResult.failure(FailureKind.CONFLICT, "A pipeline run for " + family + " is already in flight");
        }
        PipelineRun run = newRun(family, reason);
        runStore.save(run);
        try {
            pipelineExecutor.submit(() -> {
                try {
                    execute(run.getRunId(), hyperparameters);
                } catch (RuntimeException e) {
                    log.error("[PIPELINE] Run {} crashed: {}", run.getRunId(), e.getMessage(), e);
                } finally {
                    inFlightFamilies.remove(family);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlightFamilies.remove(family);
            PipelineRun failed = run.toBuilder()
                    .status(PipelineStatus.FAILED)
                    .error("Pipeline executor rejected the run: " + e.getMessage())
                    .finishedAt(Instant.now())
                    .build();
            runStore.save(failed);
            return OperationResult.failure(FailureKind.BACKEND_ERROR, failed.getError());
        }
        log.info("[PIPELINE] Submitted run {} for {} ({})", run.getRunId(), family, run.getTriggerReason());
        return OperationResult.ok(run);
    }

    /**
     * A PENDING run is cancelled immediately. A RUNNING run is cancelled before its next stage starts; the
     * returned snapshot may still show RUNNING. Once deployment has succeeded the request is ignored and the run
     * completes monitoring setup.
     */
    public OperationResult<PipelineRun> cancel(String runId) {
        return locks.withLock(runLockKey(runId), () -> {
            Optional<PipelineRun> found = runStore.findById(runId);
            if (found.isEmpty()) {
                return OperationResult.<PipelineRun>notFound("Pipeline run not found: " + runId);
            }
            PipelineRun run = found.get();
            if (run.isTerminal()) {
                return OperationResult.<PipelineRun>invariant("Run " + runId + " is already " + run.getStatus());
            }
            if (run.getStatus() == PipelineStatus.PENDING) {
                PipelineRun cancelled = run.toBuilder()
                        .status(PipelineStatus.CANCELLED)
                        .error("Cancelled before start")
                        .finishedAt(Instant.now())
                        .build();
                runStore.save(cancelled);
                log.info("[PIPELINE] Run {} cancelled while pending", runId);
                return OperationResult.ok(cancelled);
            }
            cancelRequested.add(runId);
            log.info("[PIPELINE] Cancellation requested for running run {}", runId);
            return OperationResult.ok(run);
        });
    }

    public Optional<PipelineRun> getRun(String runId) {
        return runStore.findById(runId);
    }

    public List<PipelineRun> listRuns(String modelFamily, int limit) {
        return runStore.findRecent(modelFamily, Math.max(1, limit));
    }

    public boolean isInFlight(String modelFamily) {
        return modelFamily != null && inFlightFamilies.contains(modelFamily);
    }

    // --- Execution ---

    private PipelineRun execute(String runId, Map<String, Object> hyperparameters) {
        PipelineRun started = locks.withLock(runLockKey(runId), () -> {
            PipelineRun current = runStore.findById(runId).orElseThrow();
            if (!current.getStatus().canTransitionTo(PipelineStatus.RUNNING)) {
                return current;
            }
            PipelineRun running = current.toBuilder().status(PipelineStatus.RUNNING).build();
            runStore.save(running);
            return running;
        });
        if (started.getStatus() != PipelineStatus.RUNNING) {
            return started;
        }

        String previousRunId = MDC.get(MDC_RUN_ID);
        String previousFamily = MDC.get(MDC_FAMILY);
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_FAMILY, started.getModelFamily());
        try {
            log.info("[PIPELINE] Run {} started for {} ({})", runId, started.getModelFamily(), started.getTriggerReason());
            RunContext ctx = new RunContext(started, hyperparameters != null ? hyperparameters : Map.of());
            for (PipelineStage stage : PipelineStage.values()) {
                if (cancelRequested.remove(runId)) {
                    if (stage.compareTo(PipelineStage.MODEL_DEPLOYMENT) <= 0) {
                        return finish(ctx, PipelineStatus.CANCELLED, "Cancelled before " + stage);
                    }
                    // the candidate is already deployed; it must end up monitored
                    log.info("[PIPELINE] Cancellation of {} ignored, {} is already deployed", runId,
                            ctx.candidate.getVersionId());
                }
                if (!runStage(ctx, stage)) {
                    return finish(ctx, PipelineStatus.FAILED, ctx.error);
                }
            }
            return finish(ctx, PipelineStatus.SUCCESS, null);
        } finally {
            cancelRequested.remove(runId);
            restoreMdc(MDC_RUN_ID, previousRunId);
            restoreMdc(MDC_FAMILY, previousFamily);
        }
    }

    private boolean runStage(RunContext ctx, PipelineStage stage) {
        Instant start = Instant.now();
        StageResult result;
        try {
            Map<String, Object> details = perform(ctx, stage);
            result = StageResult.builder()
                    .stage(stage)
                    .success(true)
                    .timestamp(Instant.now())
                    .details(details)
                    .build();
            log.info("[PIPELINE] {} ok {}", stage, details);
        } catch (StageFailedException e) {
            result = failedStage(stage, e.getMessage(), e.getDetails(), e.getCause());
        } catch (RuntimeException e) {
            result = failedStage(stage, stage + " failed unexpectedly: " + describe(e), Map.of(), e);
        }
        ctx.run = ctx.run.withStage(result);
        runStore.save(ctx.run);
        metrics.recordStage(stage.name(), result.isSuccess(), Duration.between(start, Instant.now()));
        if (!result.isSuccess()) {
            ctx.error = result.getError();
        }
        return result.isSuccess();
    }

    private StageResult failedStage(PipelineStage stage, String message, Map<String, Object> details, Throwable cause) {
        Map<String, Object> all = new LinkedHashMap<>(details);
        if (cause != null) {
            all.put("causes", causeChain(cause));
        }
        log.warn("[PIPELINE] {} failed: {}", stage, message, cause);
        return StageResult.builder()
                .stage(stage)
                .success(false)
                .timestamp(Instant.now())
                .details(all)
                .error(message)
                .build();
    }

    private Map<String, Object> perform(RunContext ctx, PipelineStage stage) throws StageFailedException {
        switch (stage) {
            case DATA_COLLECTION:
                return collectData(ctx);
            case DATA_VALIDATION:
                return validateData(ctx);
            case MODEL_TRAINING:
                return trainModel(ctx);
            case MODEL_VALIDATION:
                return validateModel(ctx);
            case MODEL_TESTING:
                return testModel(ctx);
            case AB_TEST_SETUP:
                return setUpAbTest(ctx);
            case MODEL_DEPLOYMENT:
                return deploy(ctx);
            case MONITORING_SETUP:
                return setUpMonitoring(ctx);
            default:
                throw new IllegalStateException("Unhandled stage " + stage);
        }
    }

    // --- Stages ---

    private Map<String, Object> collectData(RunContext ctx) throws StageFailedException {
        try {
            ctx.dataset = dataSource.acquire(ctx.family());
        } catch (Exception e) {
            throw new StageFailedException("Data collection failed: " + describe(e), Map.of(), e);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("datasetId", ctx.dataset.getDatasetId());
        details.put("location", ctx.dataset.getLocation());
        if (ctx.dataset.getRecordCount() != null) {
            details.put("recordCount", ctx.dataset.getRecordCount());
        }
        return details;
    }

    private Map<String, Object> validateData(RunContext ctx) throws StageFailedException {
        DataValidationReport report;
        try {
            report = datasetValidator.validate(ctx.dataset);
        } catch (Exception e) {
            throw new StageFailedException("Data validation errored: " + describe(e), Map.of(), e);
        }
        if (report == null || !report.isPassed()) {
            Map<String, Object> details = new LinkedHashMap<>();
            if (report != null) {
                details.put("checks", report.getChecks());
                details.put("problems", report.getProblems());
            }
            throw new StageFailedException("Data validation failed: "
                    + (report != null ? report.getProblems() : "no report"), details);
        }
        return Map.of("checks", report.getChecks());
    }

    private Map<String, Object> trainModel(RunContext ctx) throws StageFailedException {
        ctx.production = versionRegistry.getCurrentProduction(ctx.family()).orElse(null);
        Duration timeout = config.getTrainingTimeout();
        Future<TrainingResult> future = trainingExecutor.submit(
                () -> trainingBackend.train(ctx.family(), ctx.dataset, ctx.hyperparameters));
        TrainingResult result;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageFailedException("Training timed out after " + timeout, Map.of("timeout", timeout.toString()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StageFailedException("Training failed: " + describe(cause), Map.of(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StageFailedException("Training interrupted", Map.of(), e);
        }
        if (result == null) {
            throw new StageFailedException("Training backend returned no result");
        }

        OperationResult<ModelVersion> created = versionRegistry.createVersion(NewVersionRequest.builder()
                .modelId(ctx.family())
                .artifactLocation(result.getArtifactLocation())
                .metrics(result.getMetrics())
                .parentVersion(ctx.production != null ? ctx.production.getVersionId() : null)
                .changelog("Trained by pipeline run " + ctx.run.getRunId() + " (" + ctx.run.getTriggerReason() + ")")
                .featureNames(result.getFeatureNames())
                .baselineStatistics(result.getBaselineStatistics())
                .build());
        if (created.isFailure()) {
            throw new StageFailedException("Registering the trained model failed: " + created.getMessage(),
                    Map.of("failureKind", created.getFailureKind().name()));
        }
        ctx.candidate = created.getValue();
        ctx.run = ctx.run.toBuilder()
                .modelVersionId(ctx.candidate.getVersionId())
                .metrics(ctx.candidate.getMetrics())
                .build();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("versionId", ctx.candidate.getVersionId());
        details.put("versionNumber", ctx.candidate.getVersionNumber());
        details.put("metrics", ctx.candidate.getMetrics());
        if (result.getTrainingDurationSeconds() != null) {
            details.put("trainingDurationSeconds", result.getTrainingDurationSeconds());
        }
        return details;
    }

    private Map<String, Object> validateModel(RunContext ctx) throws StageFailedException {
        String metric = config.getGateMetric();
        Double value = ctx.candidate.getMetrics().get(metric);
        if (value == null) {
            throw new StageFailedException("Metric " + metric + " missing from training result",
                    Map.of("metric", metric));
        }
        Map<String, Object> details = Map.of("metric", metric, "value", value, "minimum", config.getMinAccuracy());
        if (value < config.getMinAccuracy()) {
            throw new StageFailedException(String.format("%s %.4f below minimum %.4f", metric, value,
                    config.getMinAccuracy()), details);
        }
        return details;
    }

    private Map<String, Object> testModel(RunContext ctx) throws StageFailedException {
        CandidateTestReport report = testSuite.run(ctx.candidate, ctx.production);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("checks", report.getChecks());
        if (ctx.production != null) {
            details.put("comparedWith", ctx.production.getVersionId());
        }
        if (!report.isPassed()) {
            details.put("problems", report.getProblems());
            throw new StageFailedException("Model testing failed: " + report.getProblems(), details);
        }
        return details;
    }

    private Map<String, Object> setUpAbTest(RunContext ctx) throws StageFailedException {
        if (!config.isAbTestingEnabled() || ctx.production == null) {
            return Map.of("mode", "direct",
                    "reason", config.isAbTestingEnabled() ? "no production version" : "A/B testing disabled");
        }
        OperationResult<AbTest> created = abTestManager.createTest(
                ctx.family() + " " + ctx.candidate.getVersionNumber() + " vs " + ctx.production.getVersionNumber(),
                ctx.production.getVersionId(),
                ctx.candidate.getVersionId(),
                config.getAbTrafficFraction(),
                config.getGateMetric());
        if (created.isFailure()) {
            throw new StageFailedException("A/B test setup failed: " + created.getMessage());
        }
        ctx.run = ctx.run.toBuilder().abTestId(created.getValue().getTestId()).build();
        return Map.of("mode", "ab_test",
                "testId", created.getValue().getTestId(),
                "trafficFraction", config.getAbTrafficFraction());
    }

    private Map<String, Object> deploy(RunContext ctx) throws StageFailedException {
        boolean abPending = ctx.run.getAbTestId() != null;
        OperationResult<ModelVersion> deployed = abPending
                ? versionRegistry.promoteToStaging(ctx.candidate.getVersionId())
                : versionRegistry.promoteToProduction(ctx.candidate.getVersionId());
        if (deployed.isFailure()) {
            throw new StageFailedException("Deployment failed: " + deployed.getMessage(),
                    Map.of("failureKind", deployed.getFailureKind().name()));
        }
        return Map.of("deployment", abPending ? "staged" : "production",
                "versionId", deployed.getValue().getVersionId(),
                "status", deployed.getValue().getStatus().name());
    }

    private Map<String, Object> setUpMonitoring(RunContext ctx) {
        monitor.arm(ctx.candidate.getVersionId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("armed", ctx.candidate.getVersionId());
        if (ctx.run.getAbTestId() == null && ctx.production != null) {
            monitor.disarm(ctx.production.getVersionId());
            details.put("disarmed", ctx.production.getVersionId());
        }
        return details;
    }

    // --- Helpers ---

    private PipelineRun finish(RunContext ctx, PipelineStatus status, String error) {
        PipelineRun done = ctx.run.toBuilder()
                .status(status)
                .error(error)
                .finishedAt(Instant.now())
                .build();
        runStore.save(done);
        metrics.recordPipelineRun(done.getModelFamily(), status.name(), done.getDuration());
        if (status == PipelineStatus.SUCCESS) {
            log.info("[PIPELINE] Run {} succeeded: version={} abTest={}", done.getRunId(), done.getModelVersionId(),
                    done.getAbTestId());
        } else if (status == PipelineStatus.CANCELLED) {
            log.info("[PIPELINE] Run {} cancelled: {}", done.getRunId(), error);
        } else {
            log.error("[PIPELINE] Run {} failed: {}", done.getRunId(), error);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("runId", done.getRunId());
            details.put("triggerReason", done.getTriggerReason().name());
            if (!done.getStages().isEmpty()) {
                details.put("failedStage", done.getStages().get(done.getStages().size() - 1).getStage().name());
            }
            alertService.raise(done.getModelFamily(), AlertCategory.PIPELINE_FAILURE, AlertSeverity.WARNING,
                    "Pipeline run " + done.getRunId() + " failed: " + error, details, done.getRunId());
        }
        return done;
    }

    private static PipelineRun newRun(String family, TriggerReason reason) {
        return PipelineRun.builder()
                .runId("run-" + UUID.randomUUID())
                .modelFamily(family)
                .triggerReason(reason != null ? reason : TriggerReason.MANUAL)
                .stages(List.of())
                .status(PipelineStatus.PENDING)
                .startedAt(Instant.now())
                .build();
    }

    private static String runLockKey(String runId) {
        return "run:" + runId;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static List<String> causeChain(Throwable t) {
        List<String> chain = new ArrayList<>();
        Throwable current = t;
        while (current != null && chain.size() < 10) {
            chain.add(current.getClass().getName() + ": " + current.getMessage());
            current = current.getCause() == current ? null : current.getCause();
        }
        return chain;
    }

    private static void restoreMdc(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }

    /** Mutable state carried from stage to stage within one run. */
    private static final class RunContext {
        private PipelineRun run;
        private final Map<String, Object> hyperparameters;
        private DatasetHandle dataset;
        private ModelVersion production;
        private ModelVersion candidate;
        private String error;

        private RunContext(PipelineRun run, Map<String, Object> hyperparameters) {
            this.run = run;
            this.hyperparameters = hyperparameters;
        }

        private String family() {
            return run.getModelFamily();
        }
    }
}
