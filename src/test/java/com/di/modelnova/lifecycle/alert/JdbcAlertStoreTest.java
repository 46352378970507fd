package com.di.modelnova.lifecycle.alert;

import com.di.modelnova.sql.JdbcTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcAlertStore Tests")
class JdbcAlertStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private JdbcTestDatabase db;
    private JdbcAlertStore store;

    @BeforeEach
    void setUp() {
        db = new JdbcTestDatabase();
        store = new JdbcAlertStore(db.jdbc, db.sql, db.objectMapper);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    @DisplayName("Should read back an alert with its details")
    void testSaveAndFind() {
        Alert alert = alert("alert-1", "age_model_v1.0.0", AlertSeverity.CRITICAL).toBuilder()
                .details(Map.of("feature", "age", "magnitude", 4.5))
                .build();

        store.save(alert);

        assertEquals(alert, store.findById("alert-1").orElseThrow());
        assertTrue(store.findById("alert-missing").isEmpty());
    }

    @Test
    @DisplayName("Should resolve once and keep the first resolution time")
    void testMarkResolved() {
        store.save(alert("alert-1", "age_model_v1.0.0", AlertSeverity.WARNING));

        Alert resolved = store.markResolved("alert-1", T0.plusSeconds(60)).orElseThrow();
        Alert again = store.markResolved("alert-1", T0.plusSeconds(120)).orElseThrow();

        assertTrue(resolved.isResolved());
        assertEquals(T0.plusSeconds(60), resolved.getResolvedAt());
        assertEquals(T0.plusSeconds(60), again.getResolvedAt());
        assertTrue(store.markResolved("alert-missing", T0).isEmpty());
    }

    @Test
    @DisplayName("Should list alerts newest first with any combination of filters")
    void testFind_Filters() {
        store.save(alert("alert-1", "age_model_v1.0.0", AlertSeverity.WARNING));
        store.save(alert("alert-2", "age_model_v1.0.0", AlertSeverity.CRITICAL));
        store.save(alert("alert-3", "bmi_model_v1.0.0", AlertSeverity.WARNING));
        store.save(alert("alert-4", "age_model_v1.0.0", AlertSeverity.WARNING));
        store.markResolved("alert-4", T0.plusSeconds(30));

        assertEquals(List.of("alert-4", "alert-3", "alert-2", "alert-1"), ids(store.find(null, null, null, 10)));
        assertEquals(List.of("alert-4", "alert-2"), ids(store.find("age_model_v1.0.0", null, null, 2)));
        assertEquals(List.of("alert-3", "alert-1"), ids(store.find(null, AlertSeverity.WARNING, false, 10)));
        assertEquals(List.of("alert-4"), ids(store.find("age_model_v1.0.0", AlertSeverity.WARNING, true, 10)));
        assertTrue(store.find("unknown", null, null, 10).isEmpty());
    }

    private static Alert alert(String id, String modelId, AlertSeverity severity) {
        return Alert.builder()
                .alertId(id)
                .modelId(modelId)
                .category(AlertCategory.DATA_DRIFT)
                .severity(severity)
                .message("drift on " + modelId)
                .details(Map.of())
                .sourceId("finding-" + id)
                .createdAt(T0)
                .resolved(false)
                .build();
    }

    private static List<String> ids(List<Alert> alerts) {
        return alerts.stream().map(Alert::getAlertId).collect(Collectors.toList());
    }
}
