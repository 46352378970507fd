package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.lifecycle.alert.Alert;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of a model's monitoring state: recent window, latest findings and recent alerts.
 */
@Value
@Builder
public class MonitoringStatus {
    String modelId;
    boolean armed;
    int bufferSize;
    int bufferCapacity;
    int labelledInBuffer;
    long newSinceDriftEvaluation;
    long newSinceDecayEvaluation;
    MonitoringFinding latestDrift;
    MonitoringFinding latestDecay;
    List<Alert> recentAlerts;
}
