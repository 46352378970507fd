package com.di.modelnova.lifecycle.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageResult {
    PipelineStage stage;
    boolean success;
    Instant timestamp;
    Map<String, Object> details;
    String error;

    public Map<String, Object> getDetails() {
        return details != null ? details : Map.of();
    }
}
