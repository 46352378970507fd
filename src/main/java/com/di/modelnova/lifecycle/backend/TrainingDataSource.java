package com.di.modelnova.lifecycle.backend;

/**
 * Locates the training data for a model family.
 */
public interface TrainingDataSource {

    /**
     * @throws DatasetException when no dataset can be resolved for the family
     */
    DatasetHandle acquire(String modelFamily) throws DatasetException;
}
