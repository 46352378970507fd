package com.di.modelnova.lifecycle.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-feature (drift) or per-metric (decay) evidence inside a {@link MonitoringFinding}.
 * For drift, {@code statistic} is the KS statistic and {@code baseline} the training mean; for decay,
 * {@code statistic} is the current metric value and {@code baseline} the training value.
 */
@Value
@Builder
@Jacksonized
public class FindingDetail {
    String name;
    double statistic;
    double threshold;
    Double baseline;
    @JsonProperty("pValue")
    Double pValue;
    int sampleSize;
    boolean detected;
}
