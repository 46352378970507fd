package com.di.modelnova.lifecycle.pipeline;

/**
 * Stages of a pipeline run, in execution order.
 */
public enum PipelineStage {
    DATA_COLLECTION,
    DATA_VALIDATION,
    MODEL_TRAINING,
    MODEL_VALIDATION,
    MODEL_TESTING,
    AB_TEST_SETUP,
    MODEL_DEPLOYMENT,
    MONITORING_SETUP
}
