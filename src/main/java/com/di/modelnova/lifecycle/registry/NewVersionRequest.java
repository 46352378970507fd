package com.di.modelnova.lifecycle.registry;

import com.di.modelnova.lifecycle.backend.FeatureBaseline;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input to {@link VersionRegistryService#createVersion}. A null {@code versionNumber} bumps the patch of the
 * newest existing version (or starts at 1.0.0). Feature names and baselines are forwarded to the model registry.
 */
@Value
@Builder
public class NewVersionRequest {
    String modelId;
    String artifactLocation;
    Map<String, Double> metrics;
    String versionNumber;
    String parentVersion;
    String changelog;
    List<String> featureNames;
    Map<String, FeatureBaseline> baselineStatistics;
}
