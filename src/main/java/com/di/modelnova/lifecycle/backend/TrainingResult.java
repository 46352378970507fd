package com.di.modelnova.lifecycle.backend;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Response of the training backend for one run.
 */
@Value
@Builder
@Jacksonized
public class TrainingResult {
    String artifactLocation;
    Map<String, Double> metrics;
    List<String> featureNames;
    Map<String, FeatureBaseline> baselineStatistics;
    Double trainingDurationSeconds;

    public Map<String, Double> getMetrics() {
        return metrics != null ? metrics : Map.of();
    }

    public List<String> getFeatureNames() {
        return featureNames != null ? featureNames : List.of();
    }

    public Map<String, FeatureBaseline> getBaselineStatistics() {
        return baselineStatistics != null ? baselineStatistics : Map.of();
    }
}
