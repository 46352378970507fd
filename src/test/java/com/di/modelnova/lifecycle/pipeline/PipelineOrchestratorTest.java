package com.di.modelnova.lifecycle.pipeline;

import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.LifecycleFixture;
import com.di.modelnova.lifecycle.OperationResult;
import com.di.modelnova.lifecycle.abtest.AbTest;
import com.di.modelnova.lifecycle.alert.Alert;
import com.di.modelnova.lifecycle.alert.AlertCategory;
import com.di.modelnova.lifecycle.backend.BasicDatasetValidator;
import com.di.modelnova.lifecycle.backend.DatasetException;
import com.di.modelnova.lifecycle.backend.DatasetHandle;
import com.di.modelnova.lifecycle.backend.FeatureBaseline;
import com.di.modelnova.lifecycle.backend.InMemoryModelRegistryClient;
import com.di.modelnova.lifecycle.backend.TrainingBackend;
import com.di.modelnova.lifecycle.backend.TrainingDataSource;
import com.di.modelnova.lifecycle.backend.TrainingException;
import com.di.modelnova.lifecycle.backend.TrainingResult;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.VersionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineOrchestrator Tests")
class PipelineOrchestratorTest {

    private static final String FAMILY = "age_model";

    private GatedRegistryClient registryClient;
    private LifecycleFixture fixture;
    private ScriptedDataSource dataSource;
    private ScriptedTrainingBackend backend;
    private InMemoryPipelineRunStore runStore;
    private ExecutorService pipelineExecutor;
    private ExecutorService trainingExecutor;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registryClient = new GatedRegistryClient();
        fixture = new LifecycleFixture(LifecycleFixture.defaultProperties(), registryClient);
        dataSource = new ScriptedDataSource();
        backend = new ScriptedTrainingBackend();
        runStore = new InMemoryPipelineRunStore();
        pipelineExecutor = Executors.newSingleThreadExecutor();
        trainingExecutor = Executors.newCachedThreadPool();
        orchestrator = new PipelineOrchestrator(dataSource, new BasicDatasetValidator(fixture.props), backend,
                fixture.versionRegistry, new RegressionGateTestSuite(fixture.props), fixture.abTestManager,
                fixture.monitor, fixture.alertService, runStore, fixture.locks, fixture.props, fixture.metrics,
                pipelineExecutor, trainingExecutor);
    }

    @AfterEach
    void tearDown() {
        pipelineExecutor.shutdownNow();
        trainingExecutor.shutdownNow();
    }

    // ============================================================================
    // Successful runs
    // ============================================================================

    @Test
    @DisplayName("Should deploy the first version of a family directly to production")
    void testRunPipeline_DirectDeployment() {
        backend.result.set(trainingResult(0.91));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.MANUAL);

        assertEquals(PipelineStatus.SUCCESS, run.getStatus(), run.getError());
        assertEquals(PipelineStage.values().length, run.getStages().size());
        assertTrue(run.getStages().stream().allMatch(StageResult::isSuccess));
        assertEquals("direct", stage(run, PipelineStage.AB_TEST_SETUP).getDetails().get("mode"));
        assertNull(run.getAbTestId());
        assertEquals("age_model_v1.0.0", run.getModelVersionId());
        assertEquals(0.91, run.getMetrics().get("accuracy"));
        assertNotNull(run.getFinishedAt());

        ModelVersion production = fixture.versionRegistry.getCurrentProduction(FAMILY).orElseThrow();
        assertEquals(run.getModelVersionId(), production.getVersionId());
        assertTrue(fixture.monitor.isArmed(production.getVersionId()));
        assertEquals(run, orchestrator.getRun(run.getRunId()).orElseThrow());
        assertFalse(orchestrator.isInFlight(FAMILY));
    }

    @Test
    @DisplayName("Should stage the candidate behind an A/B test when production exists")
    void testRunPipeline_AbTestPath() {
        ModelVersion production = fixture.createProduction(FAMILY, "1.0.0", 0.90);
        backend.result.set(trainingResult(0.92));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.DRIFT_DETECTED);

        assertEquals(PipelineStatus.SUCCESS, run.getStatus(), run.getError());
        assertNotNull(run.getAbTestId());
        ModelVersion candidate = fixture.versionRegistry.getVersion(run.getModelVersionId()).orElseThrow();
        assertEquals("1.0.1", candidate.getVersionNumber());
        assertEquals(VersionStatus.STAGING, candidate.getStatus());
        assertEquals(production.getVersionId(), candidate.getParentVersion());
        assertEquals(production.getVersionId(),
                fixture.versionRegistry.getCurrentProduction(FAMILY).orElseThrow().getVersionId());

        AbTest test = fixture.abTestManager.getTest(run.getAbTestId()).orElseThrow();
        assertEquals(production.getVersionId(), test.getControlVersionId());
        assertEquals(candidate.getVersionId(), test.getTreatmentVersionId());
        assertEquals(0.1, test.getTrafficFraction());
        assertEquals("staged", stage(run, PipelineStage.MODEL_DEPLOYMENT).getDetails().get("deployment"));
        assertTrue(fixture.monitor.isArmed(candidate.getVersionId()));
    }

    @Test
    @DisplayName("Should deploy directly and move monitoring when A/B testing is disabled")
    void testRunPipeline_AbTestingDisabled() {
        fixture.props.getPipeline().setAbTestingEnabled(false);
        ModelVersion production = fixture.createProduction(FAMILY, "1.0.0", 0.90);
        fixture.monitor.arm(production.getVersionId());
        backend.result.set(trainingResult(0.92));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.SCHEDULED);

        assertEquals(PipelineStatus.SUCCESS, run.getStatus(), run.getError());
        assertEquals(run.getModelVersionId(),
                fixture.versionRegistry.getCurrentProduction(FAMILY).orElseThrow().getVersionId());
        assertEquals(VersionStatus.ARCHIVED,
                fixture.versionRegistry.getVersion(production.getVersionId()).orElseThrow().getStatus());
        assertFalse(fixture.monitor.isArmed(production.getVersionId()));
        assertTrue(fixture.monitor.isArmed(run.getModelVersionId()));
    }

    // ============================================================================
    // Failing runs
    // ============================================================================

    @Test
    @DisplayName("Should fail at training without creating a version or touching production")
    void testRunPipeline_TrainingFails() {
        ModelVersion production = fixture.createProduction(FAMILY, "1.0.0", 0.90);
        backend.failure.set(new TrainingException("Training sidecar HTTP 500: out of memory"));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.DECAY_DETECTED);

        assertEquals(PipelineStatus.FAILED, run.getStatus());
        assertEquals(3, run.getStages().size());
        StageResult failed = run.getStages().get(2);
        assertEquals(PipelineStage.MODEL_TRAINING, failed.getStage());
        assertFalse(failed.isSuccess());
        assertTrue(run.getError().contains("out of memory"), run.getError());
        assertNotNull(failed.getDetails().get("causes"));
        assertNull(run.getModelVersionId());

        assertEquals(1, fixture.versionRegistry.getVersions(FAMILY).size());
        assertEquals(production.getVersionId(),
                fixture.versionRegistry.getCurrentProduction(FAMILY).orElseThrow().getVersionId());
        List<Alert> alerts = fixture.alertService.getAlerts(FAMILY, null, null, 10);
        assertEquals(1, alerts.size());
        assertEquals(AlertCategory.PIPELINE_FAILURE, alerts.get(0).getCategory());
        assertEquals(run.getRunId(), alerts.get(0).getSourceId());
    }

    @Test
    @DisplayName("Should fail the validation gate below the minimum accuracy")
    void testRunPipeline_ValidationGate() {
        backend.result.set(trainingResult(0.80));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.MANUAL);

        assertEquals(PipelineStatus.FAILED, run.getStatus());
        assertEquals(PipelineStage.MODEL_VALIDATION, lastStage(run).getStage());
        assertTrue(fixture.versionRegistry.getCurrentProduction(FAMILY).isEmpty());
        assertEquals(VersionStatus.DEVELOPMENT,
                fixture.versionRegistry.getVersion(run.getModelVersionId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should reject a candidate that regresses against production")
    void testRunPipeline_Regression() {
        fixture.createProduction(FAMILY, "1.0.0", 0.95);
        backend.result.set(trainingResult(0.90));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.SCHEDULED);

        assertEquals(PipelineStatus.FAILED, run.getStatus());
        StageResult testing = lastStage(run);
        assertEquals(PipelineStage.MODEL_TESTING, testing.getStage());
        assertEquals(Map.of("required_metrics", true, "artifact_location", true, "no_regression", false),
                testing.getDetails().get("checks"));
    }

    @Test
    @DisplayName("Should fail at data collection when no dataset is available")
    void testRunPipeline_NoData() {
        dataSource.failure.set(new DatasetException("no training data for age_model"));

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.MANUAL);

        assertEquals(PipelineStatus.FAILED, run.getStatus());
        assertEquals(1, run.getStages().size());
        assertEquals(PipelineStage.DATA_COLLECTION, lastStage(run).getStage());
        assertEquals(1, backend.calls.getCount());
    }

    @Test
    @DisplayName("Should fail data validation for a dataset that is too small")
    void testRunPipeline_DataTooSmall() {
        dataSource.records = 10L;

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.MANUAL);

        assertEquals(PipelineStatus.FAILED, run.getStatus());
        assertEquals(PipelineStage.DATA_VALIDATION, lastStage(run).getStage());
        assertTrue(run.getError().contains("10 records"), run.getError());
    }

    @Test
    @DisplayName("Should time out a training run that exceeds the stage timeout")
    void testRunPipeline_TrainingTimeout() {
        fixture.props.getPipeline().setTrainingTimeout(Duration.ofMillis(200));
        backend.block = new CountDownLatch(1);

        PipelineRun run = orchestrator.runPipeline(FAMILY, TriggerReason.MANUAL);

        assertEquals(PipelineStatus.FAILED, run.getStatus());
        assertEquals(PipelineStage.MODEL_TRAINING, lastStage(run).getStage());
        assertTrue(run.getError().contains("timed out"), run.getError());
    }

    @Test
    @DisplayName("Should reject a blank family")
    void testRunPipeline_BlankFamily() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.runPipeline(" ", TriggerReason.MANUAL));
        assertEquals(FailureKind.DATA_ERROR, orchestrator.submitPipeline(null, TriggerReason.MANUAL).getFailureKind());
    }

    // ============================================================================
    // Asynchronous submission and cancellation
    // ============================================================================

    @Test
    @DisplayName("Should run submitted pipelines in the background and allow one run per family")
    void testSubmitPipeline_OnePerFamily() throws Exception {
        backend.result.set(trainingResult(0.91));
        backend.block = new CountDownLatch(1);

        PipelineRun submitted = orchestrator.submitPipeline(FAMILY, TriggerReason.MANUAL).orElseThrow();
        assertEquals(PipelineStatus.PENDING, submitted.getStatus());
        assertTrue(orchestrator.isInFlight(FAMILY));

        OperationResult<PipelineRun> second = orchestrator.submitPipeline(FAMILY, TriggerReason.MANUAL);
        assertEquals(FailureKind.CONFLICT, second.getFailureKind());
        assertThrows(IllegalStateException.class, () -> orchestrator.runPipeline(FAMILY, TriggerReason.MANUAL));

        backend.block.countDown();
        PipelineRun finished = awaitTerminal(submitted.getRunId());
        assertEquals(PipelineStatus.SUCCESS, finished.getStatus(), finished.getError());
        awaitNotInFlight();
        assertEquals(1, orchestrator.listRuns(FAMILY, 10).size());
    }

    @Test
    @DisplayName("Should cancel a pending run before it starts")
    void testCancel_Pending() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        pipelineExecutor.submit(() -> {
            release.await();
            return null;
        });

        PipelineRun submitted = orchestrator.submitPipeline(FAMILY, TriggerReason.MANUAL).orElseThrow();
        PipelineRun cancelled = orchestrator.cancel(submitted.getRunId()).orElseThrow();

        assertEquals(PipelineStatus.CANCELLED, cancelled.getStatus());
        release.countDown();
        awaitNotInFlight();
        PipelineRun stored = orchestrator.getRun(submitted.getRunId()).orElseThrow();
        assertEquals(PipelineStatus.CANCELLED, stored.getStatus());
        assertTrue(stored.getStages().isEmpty());
        assertEquals(FailureKind.INVARIANT_VIOLATION, orchestrator.cancel(submitted.getRunId()).getFailureKind());
        assertEquals(FailureKind.NOT_FOUND, orchestrator.cancel("run-missing").getFailureKind());
    }

    @Test
    @DisplayName("Should stop a running run before its next stage")
    void testCancel_Running() throws Exception {
        backend.result.set(trainingResult(0.91));
        backend.block = new CountDownLatch(1);

        PipelineRun submitted = orchestrator.submitPipeline(FAMILY, TriggerReason.MANUAL).orElseThrow();
        assertTrue(backend.calls.await(5, TimeUnit.SECONDS));
        orchestrator.cancel(submitted.getRunId()).orElseThrow();
        backend.block.countDown();

        PipelineRun finished = awaitTerminal(submitted.getRunId());
        assertEquals(PipelineStatus.CANCELLED, finished.getStatus());
        assertEquals(PipelineStage.MODEL_TRAINING, lastStage(finished).getStage());
        assertTrue(fixture.versionRegistry.getCurrentProduction(FAMILY).isEmpty());
    }

    @Test
    @DisplayName("Should finish monitoring setup when cancelled while the candidate is being deployed")
    void testCancel_DuringDeployment() throws Exception {
        backend.result.set(trainingResult(0.91));
        registryClient.gate = new CountDownLatch(1);

        PipelineRun submitted = orchestrator.submitPipeline(FAMILY, TriggerReason.MANUAL).orElseThrow();
        assertTrue(registryClient.entered.await(5, TimeUnit.SECONDS));
        orchestrator.cancel(submitted.getRunId()).orElseThrow();
        registryClient.gate.countDown();

        PipelineRun finished = awaitTerminal(submitted.getRunId());
        assertEquals(PipelineStatus.SUCCESS, finished.getStatus(), finished.getError());
        assertEquals(PipelineStage.MONITORING_SETUP, lastStage(finished).getStage());
        assertEquals(finished.getModelVersionId(),
                fixture.versionRegistry.getCurrentProduction(FAMILY).orElseThrow().getVersionId());
        assertTrue(fixture.monitor.isArmed(finished.getModelVersionId()));
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private PipelineRun awaitTerminal(String runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            PipelineRun run = orchestrator.getRun(runId).orElseThrow();
            if (run.isTerminal()) {
                return run;
            }
            Thread.sleep(20);
        }
        fail("Run " + runId + " did not finish");
        return null;
    }

    private void awaitNotInFlight() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (orchestrator.isInFlight(FAMILY) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(orchestrator.isInFlight(FAMILY));
    }

    private static StageResult stage(PipelineRun run, PipelineStage stage) {
        return run.getStages().stream().filter(s -> s.getStage() == stage).findFirst().orElseThrow();
    }

    private static StageResult lastStage(PipelineRun run) {
        return run.getStages().get(run.getStages().size() - 1);
    }

    private static TrainingResult trainingResult(double accuracy) {
        return TrainingResult.builder()
                .artifactLocation("gs://models/age_model/" + accuracy + "/model.pkl")
                .metrics(Map.of("accuracy", accuracy, "f1_score", accuracy - 0.01))
                .featureNames(List.of("age"))
                .baselineStatistics(Map.of("age", FeatureBaseline.builder().mean(60.0).std(10.0).build()))
                .trainingDurationSeconds(12.5)
                .build();
    }

    static class ScriptedDataSource implements TrainingDataSource {
        final AtomicReference<DatasetException> failure = new AtomicReference<>();
        volatile Long records = 500L;

        @Override
        public DatasetHandle acquire(String modelFamily) throws DatasetException {
            if (failure.get() != null) {
                throw failure.get();
            }
            return DatasetHandle.builder()
                    .datasetId(modelFamily + "-dataset")
                    .modelFamily(modelFamily)
                    .location("data/training/" + modelFamily + ".csv")
                    .recordCount(records)
                    .columns(List.of("age", "label"))
                    .acquiredAt(Instant.now())
                    .build();
        }
    }

    /** Holds {@code setProduction} open while {@link #gate} is set. */
    static class GatedRegistryClient extends InMemoryModelRegistryClient {
        final CountDownLatch entered = new CountDownLatch(1);
        volatile CountDownLatch gate;

        @Override
        public void setProduction(String modelId) {
            CountDownLatch current = gate;
            if (current != null) {
                entered.countDown();
                try {
                    current.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            super.setProduction(modelId);
        }
    }

    static class ScriptedTrainingBackend implements TrainingBackend {
        final AtomicReference<TrainingResult> result = new AtomicReference<>(trainingResult(0.91));
        final AtomicReference<TrainingException> failure = new AtomicReference<>();
        final CountDownLatch calls = new CountDownLatch(1);
        volatile CountDownLatch block;

        @Override
        public TrainingResult train(String modelType, DatasetHandle dataset, Map<String, Object> hyperparameters)
                throws TrainingException {
            calls.countDown();
            if (block != null) {
                try {
                    block.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TrainingException("interrupted", e);
                }
            }
            if (failure.get() != null) {
                throw failure.get();
            }
            return result.get();
        }
    }
}
