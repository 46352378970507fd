package com.di.modelnova.lifecycle.abtest;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of one arm. Immutable; {@link #record} returns the updated copy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ArmStats {

    public static final ArmStats EMPTY = ArmStats.builder()
            .metricSums(Map.of())
            .metricCounts(Map.of())
            .build();

    long predictions;
    /** Outcomes whose prediction matched the supplied ground truth. */
    long correct;
    /** Outcomes that came with ground truth. */
    long labelled;
    Map<String, Double> metricSums;
    Map<String, Long> metricCounts;

    public ArmStats record(double prediction, Double groundTruth, Map<String, Double> metrics) {
        Map<String, Double> sums = new HashMap<>(metricSums);
        Map<String, Long> counts = new HashMap<>(metricCounts);
        if (metrics != null) {
            metrics.forEach((name, value) -> {
                if (name != null && value != null && !value.isNaN()) {
                    sums.merge(name, value, Double::sum);
                    counts.merge(name, 1L, Long::sum);
                }
            });
        }
        boolean hit = groundTruth != null && groundTruth == prediction;
        return toBuilder()
                .predictions(predictions + 1)
                .labelled(labelled + (groundTruth != null ? 1 : 0))
                .correct(correct + (hit ? 1 : 0))
                .metricSums(Map.copyOf(sums))
                .metricCounts(Map.copyOf(counts))
                .build();
    }

    /** Correct outcomes over all recorded predictions; 0 before the first prediction. */
    public double accuracy() {
        return predictions == 0 ? 0.0 : (double) correct / predictions;
    }

    public Map<String, Double> metricMeans() {
        Map<String, Double> means = new LinkedHashMap<>();
        metricSums.forEach((name, sum) -> means.put(name, sum / metricCounts.getOrDefault(name, 1L)));
        return means;
    }
}
