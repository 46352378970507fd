package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.lifecycle.LifecycleFixture;
import com.di.modelnova.lifecycle.abtest.AbTest;
import com.di.modelnova.lifecycle.abtest.Arm;
import com.di.modelnova.lifecycle.alert.Alert;
import com.di.modelnova.lifecycle.alert.AlertCategory;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MonitorWatchLoop Tests")
class MonitorWatchLoopTest {

    private LifecycleFixture fixture;
    private ExecutorService evaluationExecutor;
    private MonitorWatchLoop loop;

    @BeforeEach
    void setUp() {
        fixture = new LifecycleFixture();
        evaluationExecutor = Executors.newSingleThreadExecutor();
        ProductionMonitoringService productionMonitoring = new ProductionMonitoringService(fixture.monitor,
                fixture.versionRegistry, fixture.abTestManager, fixture.alertService, fixture.props);
        loop = new MonitorWatchLoop(fixture.monitor, productionMonitoring, evaluationExecutor, fixture.props, false);
    }

    @AfterEach
    void tearDown() {
        evaluationExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Should evaluate an armed model only once enough new predictions arrived")
    void testTick_EvaluatesReadyModels() {
        ModelVersion production = fixture.createProduction("age_model", "1.0.0", 0.90);
        fixture.monitor.arm(production.getVersionId());
        assertEquals(0, loop.tick());

        Random random = new Random(5);
        for (int i = 0; i < 150; i++) {
            fixture.monitor.recordPrediction(production.getVersionId(),
                    Map.of("age", 75.0 + 10.0 * random.nextGaussian()), 1.0, null, null, null);
        }

        assertEquals(1, loop.tick());
        assertEquals(0, loop.tick());
        assertTrue(fixture.monitor.latestFinding(production.getVersionId(), FindingType.DATA_DRIFT)
                .orElseThrow().isDetected());
    }

    @Test
    @DisplayName("Should raise an imbalance alert from the loop without repeating it on later ticks")
    void testTick_ChecksAbTestBalance() {
        ModelVersion control = fixture.createProduction("age_model", "1.0.0", 0.90);
        ModelVersion treatment = fixture.createVersion("age_model", "1.0.1", 0.92);
        AbTest test = fixture.abTestManager.createTest("balance", control.getVersionId(), treatment.getVersionId(),
                0.1, "accuracy").orElseThrow();
        for (int i = 0; i < 40; i++) {
            fixture.abTestManager.recordOutcome(test.getTestId(), Arm.CONTROL, 1.0, 1.0, null);
            fixture.abTestManager.recordOutcome(test.getTestId(), Arm.TREATMENT, 1.0, 1.0, null);
        }

        loop.tick();
        loop.tick();

        List<Alert> alerts = fixture.alertService.getAlerts("age_model", null, false, 10);
        assertEquals(1, alerts.size());
        assertEquals(AlertCategory.AB_TRAFFIC_IMBALANCE, alerts.get(0).getCategory());
        assertEquals(test.getTestId(), alerts.get(0).getSourceId());
    }
}
