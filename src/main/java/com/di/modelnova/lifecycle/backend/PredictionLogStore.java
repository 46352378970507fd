package com.di.modelnova.lifecycle.backend;

import java.util.List;

/**
 * Append-only log of served predictions keyed by model id and time.
 */
public interface PredictionLogStore {

    void logPrediction(PredictionRecord record);

    /** Up to {@code window} most recent records for the model, oldest first. */
    List<PredictionRecord> recentPredictions(String modelId, int window);
}
