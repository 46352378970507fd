package com.di.modelnova.lifecycle.registry;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One trained artifact of a model family. Never deleted; only {@code status} and {@code deployedAt} change,
 * and only through {@link VersionRegistryService}.
 */
@Value
@Builder(toBuilder = true)
public class ModelVersion {
    /** {@code <modelId>_v<versionNumber>} */
    String versionId;
    String modelId;
    String versionNumber;
    String artifactLocation;
    Map<String, Double> metrics;
    Instant trainedAt;
    Instant deployedAt;
    VersionStatus status;
    String parentVersion;
    String changelog;

    public static String versionIdOf(String modelId, String versionNumber) {
        return modelId + "_v" + versionNumber;
    }

    public Map<String, Double> getMetrics() {
        return metrics != null ? metrics : Map.of();
    }

    public SemanticVersion semanticVersion() {
        return SemanticVersion.parse(versionNumber);
    }
}
