package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.lifecycle.LifecycleFixture;
import com.di.modelnova.lifecycle.alert.Alert;
import com.di.modelnova.lifecycle.alert.AlertCategory;
import com.di.modelnova.lifecycle.alert.AlertSeverity;
import com.di.modelnova.lifecycle.backend.ModelInfo;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DriftDecayMonitor Tests")
class DriftDecayMonitorTest {

    private LifecycleFixture fixture;
    private DriftDecayMonitor monitor;
    private String modelId;

    @BeforeEach
    void setUp() {
        fixture = new LifecycleFixture();
        monitor = fixture.monitor;
        ModelVersion version = fixture.createVersion("age_model", "1.0.0", 0.90);
        modelId = version.getVersionId();
    }

    // ============================================================================
    // Drift
    // ============================================================================

    @Test
    @DisplayName("Should detect drift when age moves from 60 to 75 and raise one critical alert")
    void testEvaluateDrift_Detected() {
        recordAges(200, 75.0, new Random(1));

        MonitoringFinding finding = monitor.evaluateDrift(modelId);

        assertEquals(FindingOutcome.DETECTED, finding.getOutcome());
        assertEquals(200, finding.getSampleSize());
        FindingDetail age = finding.getDetails().get("age");
        assertNotNull(age);
        assertTrue(age.isDetected());
        assertTrue(age.getStatistic() > 0.1, "KS " + age.getStatistic());
        assertTrue(finding.getMagnitude() > 2.0);

        List<Alert> alerts = fixture.alertService.getAlerts(modelId, null, null, 10);
        assertEquals(1, alerts.size());
        assertEquals(AlertCategory.DATA_DRIFT, alerts.get(0).getCategory());
        assertEquals(AlertSeverity.CRITICAL, alerts.get(0).getSeverity());
        assertEquals(finding.getFindingId(), alerts.get(0).getSourceId());
        assertEquals(finding, monitor.findings(modelId, FindingType.DATA_DRIFT, 5).get(0));
    }

    @Test
    @DisplayName("Should not detect drift for data matching the baseline")
    void testEvaluateDrift_NotDetected() {
        recordAges(1000, 60.0, new Random(2));

        MonitoringFinding finding = monitor.evaluateDrift(modelId);

        assertEquals(FindingOutcome.NOT_DETECTED, finding.getOutcome());
        assertEquals(0.0, finding.getMagnitude());
        assertTrue(fixture.alertService.getAlerts(modelId, null, null, 10).isEmpty());
    }

    @Test
    @DisplayName("Should report insufficient data below the minimum sample count")
    void testEvaluateDrift_InsufficientData() {
        recordAges(50, 75.0, new Random(3));

        MonitoringFinding finding = monitor.evaluateDrift(modelId);

        assertEquals(FindingOutcome.INSUFFICIENT_DATA, finding.getOutcome());
        assertFalse(finding.isDetected());
        assertTrue(fixture.alertService.getAlerts(modelId, null, null, 10).isEmpty());
    }

    @Test
    @DisplayName("Should report UNKNOWN for models without a registry entry or baseline")
    void testEvaluateDrift_Unknown() {
        assertEquals(FindingOutcome.UNKNOWN, monitor.evaluateDrift("missing_model_v1.0.0").getOutcome());

        fixture.registryClient.put(ModelInfo.builder().modelId("bare_v1.0.0").family("bare").build());
        assertEquals(FindingOutcome.UNKNOWN, monitor.evaluateDrift("bare_v1.0.0").getOutcome());
    }

    @Test
    @DisplayName("Should skip features with too few values")
    void testEvaluateDrift_SkippedFeature() {
        for (int i = 0; i < 150; i++) {
            monitor.recordPrediction(modelId, Map.of("height", 170.0), 1.0, null, null, null);
        }

        MonitoringFinding finding = monitor.evaluateDrift(modelId);

        assertEquals(FindingOutcome.INSUFFICIENT_DATA, finding.getOutcome());
        assertEquals(List.of("age"), finding.getSkippedFeatures());
    }

    // ============================================================================
    // Decay
    // ============================================================================

    @Test
    @DisplayName("Should detect decay when accuracy falls from 0.90 to 0.70")
    void testEvaluateDecay_Detected() {
        recordLabelled(200, 140);

        MonitoringFinding finding = monitor.evaluateDecay(modelId);

        assertEquals(FindingOutcome.DETECTED, finding.getOutcome());
        assertEquals(0.70, finding.getDetails().get("accuracy").getStatistic(), 1e-9);
        assertEquals(0.90, finding.getDetails().get("accuracy").getBaseline(), 1e-9);
        List<Alert> alerts = fixture.alertService.getAlerts(modelId, AlertSeverity.CRITICAL, false, 10);
        assertEquals(1, alerts.size());
        assertEquals(AlertCategory.MODEL_DECAY, alerts.get(0).getCategory());
    }

    @Test
    @DisplayName("Should not detect decay while accuracy holds")
    void testEvaluateDecay_Stable() {
        recordLabelled(200, 180);

        MonitoringFinding finding = monitor.evaluateDecay(modelId);

        assertEquals(FindingOutcome.NOT_DETECTED, finding.getOutcome());
        assertEquals(0.90, finding.getDetails().get("accuracy").getStatistic(), 1e-9);
        assertEquals(0.90, finding.getDetails().get("f1_score").getStatistic(), 1e-9);
    }

    @Test
    @DisplayName("Should only count labelled predictions for decay")
    void testEvaluateDecay_UnlabelledIgnored() {
        recordAges(300, 60.0, new Random(4));
        recordLabelled(20, 20);

        MonitoringFinding finding = monitor.evaluateDecay(modelId);

        assertEquals(FindingOutcome.INSUFFICIENT_DATA, finding.getOutcome());
        assertEquals(20, finding.getSampleSize());
    }

    // ============================================================================
    // Recording, readiness and status
    // ============================================================================

    @Test
    @DisplayName("Should become ready after min-samples new predictions and reset on evaluation")
    void testReadiness() {
        recordAges(99, 60.0, new Random(5));
        assertFalse(monitor.isReadyForEvaluation(modelId, FindingType.DATA_DRIFT));

        recordAges(1, 60.0, new Random(6));
        assertTrue(monitor.isReadyForEvaluation(modelId, FindingType.DATA_DRIFT));
        assertFalse(monitor.isReadyForEvaluation(modelId, FindingType.MODEL_DECAY));

        monitor.evaluateDrift(modelId);
        assertFalse(monitor.isReadyForEvaluation(modelId, FindingType.DATA_DRIFT));
    }

    @Test
    @DisplayName("Should fall back to the prediction log when the recent window is empty")
    void testRecentWindow_FallsBackToLog() {
        recordAges(120, 75.0, new Random(7));
        DriftDecayMonitor restarted = new DriftDecayMonitor(fixture.props,
                new RecentPredictionBuffer(fixture.props), fixture.predictionLog, fixture.registryClient,
                fixture.findingStore, fixture.alertService, fixture.metrics);

        assertEquals(120, restarted.recentWindow(modelId).size());
        assertEquals(FindingOutcome.DETECTED, restarted.evaluateDrift(modelId).getOutcome());
    }

    @Test
    @DisplayName("Should reject a prediction without model id")
    void testRecordPrediction_Blank() {
        assertThrows(IllegalArgumentException.class,
                () -> monitor.recordPrediction(" ", Map.of(), 1.0, null, null, null));
    }

    @Test
    @DisplayName("Should report arming and latest findings in the status view")
    void testMonitoringStatus() {
        monitor.arm(modelId);
        recordLabelled(10, 10);
        monitor.evaluateDrift(modelId);

        MonitoringStatus status = monitor.getMonitoringStatus(modelId);

        assertTrue(status.isArmed());
        assertEquals(10, status.getBufferSize());
        assertEquals(10, status.getLabelledInBuffer());
        assertEquals(0, status.getNewSinceDriftEvaluation());
        assertEquals(10, status.getNewSinceDecayEvaluation());
        assertEquals(FindingOutcome.INSUFFICIENT_DATA, status.getLatestDrift().getOutcome());
        assertNull(status.getLatestDecay());

        monitor.disarm(modelId);
        assertFalse(monitor.isArmed(modelId));
    }

    private void recordAges(int count, double mean, Random random) {
        for (int i = 0; i < count; i++) {
            monitor.recordPrediction(modelId, Map.of("age", mean + 10.0 * random.nextGaussian()), 1.0, null, null,
                    Map.of("equipment_id", "scanner-1"));
        }
    }

    /** Alternating labels; the first {@code correct} predictions match, the rest are flipped. */
    private void recordLabelled(int count, int correct) {
        for (int i = 0; i < count; i++) {
            double truth = i % 2;
            double prediction = i < correct ? truth : 1.0 - truth;
            monitor.recordPrediction(modelId, Map.of("age", 60.0), prediction, null, truth, null);
        }
    }
}
