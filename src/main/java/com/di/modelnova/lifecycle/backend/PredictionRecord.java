package com.di.modelnova.lifecycle.backend;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One served prediction. Numeric inputs go in {@code features}; categorical context such as the serving
 * device or a population segment goes in {@code metadata}.
 */
@Value
@Builder
public class PredictionRecord {
    String modelId;
    Map<String, Double> features;
    double prediction;
    Double probability;
    Double groundTruth;
    Map<String, String> metadata;
    Instant recordedAt;

    public Map<String, Double> getFeatures() {
        return features != null ? features : Map.of();
    }

    public Map<String, String> getMetadata() {
        return metadata != null ? metadata : Map.of();
    }

    public boolean hasGroundTruth() {
        return groundTruth != null;
    }
}
