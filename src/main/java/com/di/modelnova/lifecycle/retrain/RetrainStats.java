package com.di.modelnova.lifecycle.retrain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RetrainStats {
    long totalRetrains;
    long successful;
    long failed;
    /** Runs still pending or running. */
    long inProgress;
    /** Successful over finished runs; 0 when none finished. */
    double successRate;
    Map<String, Long> byTrigger;
    /** Mean duration of finished runs, in hours. */
    double averageDurationHours;
}
