package com.di.modelnova.lifecycle.retrain;

import com.di.modelnova.lifecycle.pipeline.TriggerReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RetrainingRecord {
    String recordId;
    /** Version the check ran against; null for manual triggers. */
    String modelId;
    String modelFamily;
    TriggerReason reason;
    List<TriggerReason> allReasons;
    String runId;
    Instant triggeredAt;
}
