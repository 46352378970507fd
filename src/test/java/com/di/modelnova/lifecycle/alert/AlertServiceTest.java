package com.di.modelnova.lifecycle.alert;

import com.di.modelnova.util.LifecycleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlertService Tests")
class AlertServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new AlertService(new InMemoryAlertStore(), new LifecycleMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Should persist a raised alert as unresolved and count it")
    void testRaise() {
        Alert alert = service.raise("age_model_v1.0.0", AlertCategory.DATA_DRIFT, AlertSeverity.CRITICAL,
                "Drift detected", Map.of("age", 0.42), "finding-1").orElseThrow();

        assertTrue(alert.getAlertId().startsWith("alert-"));
        assertFalse(alert.isResolved());
        assertNull(alert.getResolvedAt());
        assertEquals("finding-1", alert.getSourceId());
        assertEquals(alert, service.getAlert(alert.getAlertId()).orElseThrow());
        assertEquals(1.0, meterRegistry.get("modelnova.alerts.raised")
                .tag("category", "DATA_DRIFT")
                .tag("severity", "CRITICAL")
                .counter().count());
    }

    @Test
    @DisplayName("Should default missing details to an empty map")
    void testRaise_NullDetails() {
        Alert alert = service.raise("m_v1.0.0", AlertCategory.MODEL_DECAY, AlertSeverity.WARNING, "decay", null, null)
                .orElseThrow();

        assertEquals(Map.of(), alert.getDetails());
    }

    @Test
    @DisplayName("Should filter by model, severity and resolution")
    void testGetAlerts_Filters() {
        service.raise("a_v1.0.0", AlertCategory.DATA_DRIFT, AlertSeverity.CRITICAL, "a1", null, null);
        Alert second = service.raise("a_v1.0.0", AlertCategory.SEGMENT_CHANGE, AlertSeverity.INFO, "a2", null, null)
                .orElseThrow();
        service.raise("b_v1.0.0", AlertCategory.MODEL_DECAY, AlertSeverity.CRITICAL, "b1", null, null);
        service.resolve(second.getAlertId());

        assertEquals(3, service.getAlerts(null, null, null, 10).size());
        assertEquals(2, service.getAlerts("a_v1.0.0", null, null, 10).size());
        assertEquals(2, service.getAlerts(null, AlertSeverity.CRITICAL, null, 10).size());
        assertEquals(List.of(second.getAlertId()),
                service.getAlerts(null, null, true, 10).stream().map(Alert::getAlertId).toList());
        assertEquals(1, service.getAlerts(null, null, null, 1).size());
    }

    @Test
    @DisplayName("Should resolve known alerts and ignore unknown ids")
    void testResolve() {
        Alert alert = service.raise("m_v1.0.0", AlertCategory.DATA_DRIFT, AlertSeverity.WARNING, "drift", null, null)
                .orElseThrow();

        Alert resolved = service.resolve(alert.getAlertId()).orElseThrow();

        assertTrue(resolved.isResolved());
        assertNotNull(resolved.getResolvedAt());
        assertTrue(service.getAlert(alert.getAlertId()).orElseThrow().isResolved());
        assertTrue(service.resolve("alert-missing").isEmpty());
    }

    @Test
    @DisplayName("Should return empty instead of throwing when the store fails")
    void testRaise_StoreFailure() {
        AlertService broken = new AlertService(new FailingAlertStore(), new LifecycleMetrics(meterRegistry));

        Optional<Alert> raised = assertDoesNotThrow(() -> broken.raise("m_v1.0.0", AlertCategory.DATA_DRIFT,
                AlertSeverity.CRITICAL, "drift", null, null));

        assertTrue(raised.isEmpty());
        assertTrue(meterRegistry.find("modelnova.alerts.raised").counters().isEmpty());
    }

    static class FailingAlertStore implements AlertStore {
        @Override
        public void save(Alert alert) {
            throw new IllegalStateException("alert store offline");
        }

        @Override
        public Optional<Alert> findById(String alertId) {
            return Optional.empty();
        }

        @Override
        public Optional<Alert> markResolved(String alertId, Instant resolvedAt) {
            return Optional.empty();
        }

        @Override
        public List<Alert> find(String modelId, AlertSeverity severity, Boolean resolved, int limit) {
            return List.of();
        }
    }
}
