package com.di.modelnova.lifecycle.backend;

import java.util.Map;

/**
 * Trains one model. Implementations must be safe to call again with the same arguments after a failure.
 */
public interface TrainingBackend {

    TrainingResult train(String modelType, DatasetHandle dataset, Map<String, Object> hyperparameters)
            throws TrainingException;
}
