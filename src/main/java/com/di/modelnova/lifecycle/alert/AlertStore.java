package com.di.modelnova.lifecycle.alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AlertStore {

    void save(Alert alert);

    Optional<Alert> findById(String alertId);

    /** Marks the alert resolved; returns the updated alert, or empty when unknown. */
    Optional<Alert> markResolved(String alertId, Instant resolvedAt);

    /** Newest first. Null filters match everything. */
    List<Alert> find(String modelId, AlertSeverity severity, Boolean resolved, int limit);
}
