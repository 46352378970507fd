package com.di.modelnova.lifecycle.alert;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Operator-facing notification. Immutable apart from resolution, which produces a new instance.
 */
@Value
@Builder(toBuilder = true)
public class Alert {
    String alertId;
    String modelId;
    AlertCategory category;
    AlertSeverity severity;
    String message;
    Map<String, Object> details;
    /** Finding or A/B test the alert was derived from, if any. */
    String sourceId;
    Instant createdAt;
    boolean resolved;
    Instant resolvedAt;
}
