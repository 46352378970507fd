package com.di.modelnova.lifecycle.backend;

import java.util.Optional;

/**
 * Durable store of artifact location, metrics, baseline feature statistics and the production flag,
 * keyed by model identifier. Implementations throw {@link RegistryException} when the registry is unreachable.
 */
public interface ModelRegistryClient {

    Optional<ModelInfo> get(String modelId);

    /** Creates or replaces the entry and returns its model id. */
    String put(ModelInfo info);

    /** Marks the model as the production model of its family and clears the flag on its siblings. */
    void setProduction(String modelId);
}
