package com.di.modelnova.lifecycle.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time health of one served model.
 */
@Value
@Builder
public class ModelHealthReport {
    String modelId;
    boolean armed;
    MonitoringFinding drift;
    MonitoringFinding decay;
    PredictionDistribution predictionDistribution;
    SegmentSummary segments;
    /** 1.0 minus 0.2 for drift and minus the accuracy drop (capped at 0.3) for decay; never below 0. */
    double healthScore;
    Instant generatedAt;

    @Value
    @Builder
    public static class PredictionDistribution {
        int samples;
        double mean;
        double std;
        double min;
        double max;
    }

    @Value
    @Builder
    public static class SegmentSummary {
        String key;
        /** Predictions per distinct metadata value in the recent window. */
        Map<String, Long> counts;
        /** True when the set of values differs from the previous report for this model. */
        boolean changed;
    }
}
