package com.di.modelnova.lifecycle.retrain;

import com.di.modelnova.lifecycle.pipeline.TriggerReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one retrain check. {@code reasons} lists every condition that held, in priority order;
 * {@code runId} is set when a pipeline run was submitted.
 */
@Value
@Builder
public class RetrainDecision {
    String modelId;
    String modelFamily;
    boolean triggered;
    List<TriggerReason> reasons;
    String runId;
    String message;
    Instant decidedAt;
}
