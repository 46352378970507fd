package com.di.modelnova.lifecycle.backend;

/**
 * Decides whether a dataset is fit to train on. Implementations report problems instead of throwing; the
 * pipeline treats an exception as a failed validation.
 */
public interface DatasetValidator {

    DataValidationReport validate(DatasetHandle dataset);
}
