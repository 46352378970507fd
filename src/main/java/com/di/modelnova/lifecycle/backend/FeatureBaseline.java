package com.di.modelnova.lifecycle.backend;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Training-time distribution summary of one numeric feature.
 */
@Value
@Builder
@Jacksonized
public class FeatureBaseline {
    double mean;
    double std;
    Double min;
    Double max;
}
