package com.di.modelnova.lifecycle.pipeline;

import com.di.modelnova.lifecycle.registry.ModelVersion;

/**
 * Pre-deployment checks for a freshly trained candidate.
 */
public interface CandidateTestSuite {

    /**
     * @param candidate  the DEVELOPMENT version produced by the current run
     * @param production the serving version of the same model, or null when there is none
     */
    CandidateTestReport run(ModelVersion candidate, ModelVersion production);
}
