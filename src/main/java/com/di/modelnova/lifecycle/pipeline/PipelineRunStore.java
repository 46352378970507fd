package com.di.modelnova.lifecycle.pipeline;

import java.util.List;
import java.util.Optional;

public interface PipelineRunStore {

    /** Inserts or replaces the run with the same id. */
    void save(PipelineRun run);

    Optional<PipelineRun> findById(String runId);

    /** Newest first; {@code modelFamily} may be null for all families. */
    List<PipelineRun> findRecent(String modelFamily, int limit);
}
