package com.di.modelnova.lifecycle.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one drift or decay evaluation window. Written once, never updated.
 */
@Value
@Builder(toBuilder = true)
public class MonitoringFinding {
    String findingId;
    String modelId;
    FindingType type;
    FindingOutcome outcome;
    Map<String, FindingDetail> details;
    /** Features left out because they had too few values in the window. */
    List<String> skippedFeatures;
    int sampleSize;
    /** Largest flagged statistic relative to its threshold; 0 when nothing was flagged. */
    double magnitude;
    String reason;
    Instant evaluatedAt;

    public boolean isDetected() {
        return outcome == FindingOutcome.DETECTED;
    }

    public Map<String, FindingDetail> getDetails() {
        return details != null ? details : Map.of();
    }

    public List<String> getSkippedFeatures() {
        return skippedFeatures != null ? skippedFeatures : List.of();
    }
}
