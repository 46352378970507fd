package com.di.modelnova.lifecycle.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One execution of the training pipeline for a model family. Stage results are append-only.
 */
@Value
@Builder(toBuilder = true)
public class PipelineRun {
    String runId;
    String modelFamily;
    TriggerReason triggerReason;
    List<StageResult> stages;
    PipelineStatus status;
    Instant startedAt;
    Instant finishedAt;
    /** Candidate version created by the training stage. */
    String modelVersionId;
    String abTestId;
    String error;
    /** Metrics reported by the training backend. */
    Map<String, Double> metrics;

    public List<StageResult> getStages() {
        return stages != null ? stages : List.of();
    }

    public PipelineRun withStage(StageResult result) {
        List<StageResult> next = new ArrayList<>(getStages());
        next.add(result);
        return toBuilder().stages(List.copyOf(next)).build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return null;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
