package com.di.modelnova.lifecycle.alert;

import com.di.modelnova.util.LifecycleMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Raises, lists and resolves alerts. Raising never throws: a broken alert store must not break the monitor or
 * a pipeline run.
 */
@Slf4j
@Service
public class AlertService {

    private static final int OPEN_ALERT_SCAN_LIMIT = 500;

    private final AlertStore store;
    private final LifecycleMetrics metrics;

    public AlertService(AlertStore store, LifecycleMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public Optional<Alert> raise(String modelId, AlertCategory category, AlertSeverity severity, String message,
                                 Map<String, Object> details, String sourceId) {
        Alert alert = Alert.builder()
                .alertId("alert-" + UUID.randomUUID())
                .modelId(modelId)
                .category(category)
                .severity(severity)
                .message(message)
                .details(details != null ? details : Map.of())
                .sourceId(sourceId)
                .createdAt(Instant.now())
                .resolved(false)
                .build();
        try {
            store.save(alert);
        } catch (RuntimeException e) {
            log.error("[ALERT] Could not persist {} alert for {}: {}", category, modelId, e.getMessage(), e);
            return Optional.empty();
        }
        metrics.recordAlert(category.name(), severity.name());
        if (severity == AlertSeverity.CRITICAL) {
            log.error("[ALERT] {} {} model={} {}", severity, category, modelId, message);
        } else {
            log.warn("[ALERT] {} {} model={} {}", severity, category, modelId, message);
        }
        return Optional.of(alert);
    }

    public Optional<Alert> resolve(String alertId) {
        Optional<Alert> resolved = store.markResolved(alertId, Instant.now());
        resolved.ifPresent(a -> log.info("[ALERT] Resolved {} ({} model={})", alertId, a.getCategory(), a.getModelId()));
        return resolved;
    }

    public Optional<Alert> getAlert(String alertId) {
        return store.findById(alertId);
    }

    /** True when {@code modelId} has an unresolved alert of the category raised for {@code sourceId}. */
    public boolean hasOpenAlert(String modelId, AlertCategory category, String sourceId) {
        return store.find(modelId, null, false, OPEN_ALERT_SCAN_LIMIT).stream()
                .anyMatch(a -> a.getCategory() == category && Objects.equals(a.getSourceId(), sourceId));
    }

    /** Newest first; any filter may be null. */
    public List<Alert> getAlerts(String modelId, AlertSeverity severity, Boolean resolved, int limit) {
        return store.find(modelId, severity, resolved, Math.max(1, limit));
    }
}
