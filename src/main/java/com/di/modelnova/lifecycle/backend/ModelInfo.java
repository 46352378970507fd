package com.di.modelnova.lifecycle.backend;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What the model registry knows about one trained artifact. The pipeline registers every candidate under its
 * version id, so {@code modelId} here is the {@code versionId} of a {@link com.di.modelnova.lifecycle.registry.ModelVersion}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelInfo {
    String modelId;
    /** Model family (the version registry's model id). */
    String family;
    String artifactLocation;
    Map<String, Double> metrics;
    List<String> featureNames;
    Map<String, FeatureBaseline> baselineStatistics;
    Instant trainedAt;
    boolean production;

    public Map<String, Double> getMetrics() {
        return metrics != null ? metrics : Map.of();
    }

    public List<String> getFeatureNames() {
        return featureNames != null ? featureNames : List.of();
    }

    public Map<String, FeatureBaseline> getBaselineStatistics() {
        return baselineStatistics != null ? baselineStatistics : Map.of();
    }

    public Double metric(String name) {
        return getMetrics().get(name);
    }
}
