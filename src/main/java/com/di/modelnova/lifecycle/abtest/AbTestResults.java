package com.di.modelnova.lifecycle.abtest;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of an A/B test's arms and, once both arms have enough predictions, its significance verdict.
 */
@Value
@Builder
public class AbTestResults {
    String testId;
    String label;
    AbTestStatus status;
    String metric;
    double trafficFraction;
    /** Treatment share of all recorded predictions. */
    double observedTreatmentShare;
    ArmResult control;
    ArmResult treatment;
    /** Treatment accuracy minus control accuracy. */
    double improvement;
    /** Null until both arms exceed the minimum sample count. */
    Significance significance;
    Arm winner;

    @Value
    @Builder
    public static class ArmResult {
        String versionId;
        long predictions;
        long correct;
        long labelled;
        double accuracy;
        Map<String, Double> metricMeans;
    }

    @Value
    @Builder
    public static class Significance {
        double chiSquare;
        double pValue;
        double alpha;
        boolean significant;
    }
}
