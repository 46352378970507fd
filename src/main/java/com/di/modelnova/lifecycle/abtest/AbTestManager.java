package com.di.modelnova.lifecycle.abtest;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.OperationResult;
import com.di.modelnova.lifecycle.monitor.DriftDecayMonitor;
import com.di.modelnova.lifecycle.registry.ModelLocks;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.VersionRegistryService;
import com.di.modelnova.lifecycle.registry.VersionStatus;
import com.di.modelnova.util.LifecycleMetrics;
import com.di.modelnova.util.StatisticalTests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs traffic-split comparisons between a control and a treatment version.
 * <p>
 * Arm selection is sticky for a caller identity: the SHA-256 of {@code testId:caller} is mapped into [0, 100)
 * and compared with the treatment share. Stopping a test with a winner promotes it through the
 * {@link VersionRegistryService}; if the promotion fails the test stays ACTIVE.
 */
@Slf4j
@Service
public class AbTestManager {

    private final AbTestStore store;
    private final VersionRegistryService versionRegistry;
    private final DriftDecayMonitor monitor;
    private final ModelLocks locks;
    private final LifecycleProperties.AbTest config;
    private final LifecycleMetrics metrics;

    public AbTestManager(AbTestStore store, VersionRegistryService versionRegistry, DriftDecayMonitor monitor,
                         ModelLocks locks, LifecycleProperties props, LifecycleMetrics metrics) {
        this.store = store;
        this.versionRegistry = versionRegistry;
        this.monitor = monitor;
        this.locks = locks;
        this.config = props.getAbtest();
        this.metrics = metrics;
    }

    public OperationResult<AbTest> createTest(String label, String controlVersionId, String treatmentVersionId,
                                              double trafficFraction, String metric) {
        if (isBlank(controlVersionId) || isBlank(treatmentVersionId)) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "control and treatment version ids are required");
        }
        if (controlVersionId.equals(treatmentVersionId)) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "control and treatment must differ");
        }
        if (Double.isNaN(trafficFraction) || trafficFraction < 0.0 || trafficFraction > 1.0) {
            return OperationResult.failure(FailureKind.DATA_ERROR,
                    "trafficFraction must be within [0, 1], got " + trafficFraction);
        }
        Optional<ModelVersion> control = versionRegistry.getVersion(controlVersionId);
        Optional<ModelVersion> treatment = versionRegistry.getVersion(treatmentVersionId);
        if (control.isEmpty()) {
            return OperationResult.notFound("Control version not found: " + controlVersionId);
        }
        if (treatment.isEmpty()) {
            return OperationResult.notFound("Treatment version not found: " + treatmentVersionId);
        }
        if (!control.get().getModelId().equals(treatment.get().getModelId())) {
            return OperationResult.invariant("Control and treatment belong to different models: "
                    + control.get().getModelId() + " vs " + treatment.get().getModelId());
        }

        AbTest test = AbTest.builder()
                .testId("abtest-" + UUID.randomUUID().toString().substring(0, 8))
                .label(isBlank(label) ? control.get().getModelId() + " " + treatmentVersionId : label)
                .controlVersionId(controlVersionId)
                .treatmentVersionId(treatmentVersionId)
                .trafficFraction(trafficFraction)
                .metric(isBlank(metric) ? "accuracy" : metric)
                .status(AbTestStatus.ACTIVE)
                .control(ArmStats.EMPTY)
                .treatment(ArmStats.EMPTY)
                .createdAt(Instant.now())
                .build();
        store.save(test);
        log.info("[ABTEST] Created {} '{}': control={} treatment={} fraction={}", test.getTestId(), test.getLabel(),
                controlVersionId, treatmentVersionId, trafficFraction);
        return OperationResult.ok(test);
    }

    /**
     * Picks the arm for one request. With a caller identity the choice is deterministic for the test; without
     * one it is a fresh random draw.
     */
    public OperationResult<ArmAssignment> selectArm(String testId, String callerIdentity) {
        Optional<AbTest> found = store.findById(testId);
        if (found.isEmpty()) {
            return OperationResult.notFound("A/B test not found: " + testId);
        }
        AbTest test = found.get();
        if (!test.isActive()) {
            return OperationResult.invariant("A/B test " + testId + " is " + test.getStatus());
        }
        boolean sticky = !isBlank(callerIdentity);
        double bucket = sticky ? bucketOf(testId + ":" + callerIdentity) : ThreadLocalRandom.current().nextDouble(100.0);
        Arm arm = bucket < test.getTrafficFraction() * 100.0 ? Arm.TREATMENT : Arm.CONTROL;
        return OperationResult.ok(new ArmAssignment(testId, arm, test.versionFor(arm), sticky));
    }

    public OperationResult<AbTest> recordOutcome(String testId, Arm arm, double prediction, Double groundTruth,
                                                 Map<String, Double> outcomeMetrics) {
        if (arm == null) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "arm is required");
        }
        AtomicReference<AbTestStatus> statusSeen = new AtomicReference<>();
        Optional<AbTest> updated = store.update(testId, current -> {
            statusSeen.set(current.getStatus());
            if (!current.isActive()) {
                return current;
            }
            ArmStats next = current.stats(arm).record(prediction, groundTruth, outcomeMetrics);
            return arm == Arm.CONTROL
                    ? current.toBuilder().control(next).build()
                    : current.toBuilder().treatment(next).build();
        });
        if (updated.isEmpty()) {
            return OperationResult.notFound("A/B test not found: " + testId);
        }
        if (statusSeen.get() != AbTestStatus.ACTIVE) {
            return OperationResult.invariant("A/B test " + testId + " is " + statusSeen.get()
                    + "; outcomes are no longer recorded");
        }
        metrics.recordAbOutcome(arm.name(), groundTruth != null);
        return OperationResult.ok(updated.get());
    }

    public OperationResult<AbTestResults> getResults(String testId) {
        return store.findById(testId)
                .map(test -> OperationResult.ok(resultsOf(test)))
                .orElseGet(() -> OperationResult.notFound("A/B test not found: " + testId));
    }

    /**
     * Completes the test. With a winner, the winning version is promoted to production first and the other arm
     * archived; monitoring follows the winner.
     */
    public OperationResult<AbTest> stopTest(String testId, Arm winner) {
        return locks.withLock("abtest:" + testId, () -> {
            Optional<AbTest> found = store.findById(testId);
            if (found.isEmpty()) {
                return OperationResult.<AbTest>notFound("A/B test not found: " + testId);
            }
            AbTest test = found.get();
            if (!test.isActive()) {
                return OperationResult.<AbTest>invariant("A/B test " + testId + " is already " + test.getStatus());
            }
            if (winner != null) {
                String winnerVersion = test.versionFor(winner);
                String loserVersion = test.versionFor(winner.other());
                OperationResult<ModelVersion> promoted = versionRegistry.promoteToProduction(winnerVersion);
                if (promoted.isFailure()) {
                    log.warn("[ABTEST] Stop of {} aborted, promotion of {} failed: {}", testId, winnerVersion,
                            promoted.getMessage());
                    return promoted.<AbTest>asFailure();
                }
                archiveLoser(testId, loserVersion);
                monitor.arm(winnerVersion);
                monitor.disarm(loserVersion);
            }
            AbTest completed = store.update(testId, current -> current.toBuilder()
                    .status(AbTestStatus.COMPLETED)
                    .winner(winner)
                    .completedAt(Instant.now())
                    .build()).orElseThrow();
            log.info("[ABTEST] Stopped {} winner={}", testId, winner != null ? completed.versionFor(winner) : "none");
            return OperationResult.ok(completed);
        });
    }

    public List<AbTest> listActiveTests() {
        return store.findByStatus(AbTestStatus.ACTIVE);
    }

    public List<AbTest> listTests(int limit) {
        return store.findRecent(Math.max(1, limit));
    }

    public Optional<AbTest> getTest(String testId) {
        return store.findById(testId);
    }

    AbTestResults resultsOf(AbTest test) {
        ArmStats control = test.getControl();
        ArmStats treatment = test.getTreatment();
        long total = control.getPredictions() + treatment.getPredictions();
        AbTestResults.Significance significance = null;
        if (control.getPredictions() > config.getMinSamplesPerArm()
                && treatment.getPredictions() > config.getMinSamplesPerArm()) {
            StatisticalTests.ChiSquare chi = StatisticalTests.chiSquare2x2(
                    control.getCorrect(), control.getPredictions() - control.getCorrect(),
                    treatment.getCorrect(), treatment.getPredictions() - treatment.getCorrect());
            significance = AbTestResults.Significance.builder()
                    .chiSquare(chi.getStatistic())
                    .pValue(chi.getPValue())
                    .alpha(config.getSignificanceLevel())
                    .significant(chi.getPValue() < config.getSignificanceLevel())
                    .build();
        }
        return AbTestResults.builder()
                .testId(test.getTestId())
                .label(test.getLabel())
                .status(test.getStatus())
                .metric(test.getMetric())
                .trafficFraction(test.getTrafficFraction())
                .observedTreatmentShare(total == 0 ? 0.0 : (double) treatment.getPredictions() / total)
                .control(armResult(test.getControlVersionId(), control))
                .treatment(armResult(test.getTreatmentVersionId(), treatment))
                .improvement(treatment.accuracy() - control.accuracy())
                .significance(significance)
                .winner(test.getWinner())
                .build();
    }

    private void archiveLoser(String testId, String loserVersion) {
        Optional<ModelVersion> loser = versionRegistry.getVersion(loserVersion);
        if (loser.isEmpty() || loser.get().getStatus() == VersionStatus.ARCHIVED
                || loser.get().getStatus() == VersionStatus.PRODUCTION) {
            return;
        }
        OperationResult<ModelVersion> archived = versionRegistry.archive(loserVersion);
        if (archived.isFailure()) {
            log.warn("[ABTEST] {}: could not archive losing version {}: {}", testId, loserVersion,
                    archived.getMessage());
        }
    }

    private static AbTestResults.ArmResult armResult(String versionId, ArmStats stats) {
        return AbTestResults.ArmResult.builder()
                .versionId(versionId)
                .predictions(stats.getPredictions())
                .correct(stats.getCorrect())
                .labelled(stats.getLabelled())
                .accuracy(stats.accuracy())
                .metricMeans(stats.metricMeans())
                .build();
    }

    /** First eight bytes of SHA-256 as an unsigned number, reduced to [0, 100). */
    static double bucketOf(String key) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            long value = 0;
            for (int i = 0; i < 8; i++) {
                value = (value << 8) | (digest[i] & 0xFF);
            }
            return Long.remainderUnsigned(value, 100L);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
