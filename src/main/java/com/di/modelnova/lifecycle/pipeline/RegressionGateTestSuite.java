package com.di.modelnova.lifecycle.pipeline;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that the candidate reports every required metric, points at an artifact, and does not fall more than
 * {@code regression-tolerance} below production on any required metric.
 */
@Component
public class RegressionGateTestSuite implements CandidateTestSuite {

    private final List<String> requiredMetrics;
    private final double tolerance;

    public RegressionGateTestSuite(LifecycleProperties props) {
        this.requiredMetrics = List.copyOf(props.getPipeline().getRequiredMetrics());
        this.tolerance = props.getPipeline().getRegressionTolerance();
    }

    @Override
    public CandidateTestReport run(ModelVersion candidate, ModelVersion production) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        Map<String, Double> metrics = candidate.getMetrics() != null ? candidate.getMetrics() : Map.of();

        List<String> missing = new ArrayList<>();
        for (String name : requiredMetrics) {
            Double value = metrics.get(name);
            if (value == null || value.isNaN() || value.isInfinite()) {
                missing.add(name);
            }
        }
        checks.put("required_metrics", missing.isEmpty());
        if (!missing.isEmpty()) {
            problems.add("Missing required metrics: " + missing);
        }

        boolean hasArtifact = candidate.getArtifactLocation() != null && !candidate.getArtifactLocation().isBlank();
        checks.put("artifact_location", hasArtifact);
        if (!hasArtifact) {
            problems.add("Candidate has no artifact location");
        }

        if (production != null && production.getMetrics() != null) {
            boolean regressionFree = true;
            for (String name : requiredMetrics) {
                Double current = production.getMetrics().get(name);
                Double next = metrics.get(name);
                if (current == null || next == null) {
                    continue;
                }
                if (next < current - tolerance) {
                    regressionFree = false;
                    problems.add(String.format("%s regressed from %.4f to %.4f (tolerance %.4f) against %s",
                            name, current, next, tolerance, production.getVersionId()));
                }
            }
            checks.put("no_regression", regressionFree);
        }

        return CandidateTestReport.builder()
                .passed(problems.isEmpty())
                .checks(checks)
                .problems(problems)
                .build();
    }
}
