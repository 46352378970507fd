package com.di.modelnova.lifecycle.alert;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory alert store keeping insertion order for newest-first listing.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, Alert> byId = new ConcurrentHashMap<>();
    private final List<String> insertionOrder = new ArrayList<>();

    @Override
    public void save(Alert alert) {
        if (alert == null || alert.getAlertId() == null) return;
        if (byId.put(alert.getAlertId(), alert) == null) {
            synchronized (insertionOrder) {
                insertionOrder.add(alert.getAlertId());
            }
        }
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return alertId == null ? Optional.empty() : Optional.ofNullable(byId.get(alertId));
    }

    @Override
    public Optional<Alert> markResolved(String alertId, Instant resolvedAt) {
        if (alertId == null) return Optional.empty();
        return Optional.ofNullable(byId.computeIfPresent(alertId, (id, existing) -> existing.isResolved()
                ? existing
                : existing.toBuilder().resolved(true).resolvedAt(resolvedAt).build()));
    }

    @Override
    public List<Alert> find(String modelId, AlertSeverity severity, Boolean resolved, int limit) {
        List<Alert> out = new ArrayList<>();
        synchronized (insertionOrder) {
            for (int i = insertionOrder.size() - 1; i >= 0 && out.size() < limit; i--) {
                Alert a = byId.get(insertionOrder.get(i));
                if (a == null) continue;
                if ((modelId == null || modelId.equals(a.getModelId()))
                        && (severity == null || severity == a.getSeverity())
                        && (resolved == null || resolved == a.isResolved())) {
                    out.add(a);
                }
            }
        }
        return out;
    }
}
