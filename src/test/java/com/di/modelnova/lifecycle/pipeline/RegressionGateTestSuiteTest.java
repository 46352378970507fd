package com.di.modelnova.lifecycle.pipeline;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.VersionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegressionGateTestSuite Tests")
class RegressionGateTestSuiteTest {

    private final RegressionGateTestSuite suite = new RegressionGateTestSuite(new LifecycleProperties());

    @Test
    @DisplayName("Should pass a complete first candidate without a regression check")
    void testRun_NoProduction() {
        CandidateTestReport report = suite.run(version("1.0.0", 0.9, 0.88, "m.pkl"), null);

        assertTrue(report.isPassed());
        assertFalse(report.getChecks().containsKey("no_regression"));
    }

    @Test
    @DisplayName("Should flag missing metrics and a missing artifact")
    void testRun_Incomplete() {
        ModelVersion candidate = version("1.0.1", 0.9, null, null);

        CandidateTestReport report = suite.run(candidate, null);

        assertFalse(report.isPassed());
        assertFalse(report.getChecks().get("required_metrics"));
        assertFalse(report.getChecks().get("artifact_location"));
        assertTrue(report.getProblems().get(0).contains("f1_score"));
    }

    @ParameterizedTest(name = "production {0} candidate {1} -> {2}")
    @CsvSource({
            "0.90, 0.90, true",
            "0.90, 0.885, true",
            "0.90, 0.87, false",
            "0.80, 0.95, true"
    })
    @DisplayName("Should allow drops within the regression tolerance")
    void testRun_Regression(double productionAccuracy, double candidateAccuracy, boolean expected) {
        ModelVersion production = version("1.0.0", productionAccuracy, 0.85, "p.pkl");
        ModelVersion candidate = version("1.0.1", candidateAccuracy, 0.85, "c.pkl");

        CandidateTestReport report = suite.run(candidate, production);

        assertEquals(expected, report.isPassed());
        assertEquals(expected, report.getChecks().get("no_regression"));
    }

    private static ModelVersion version(String number, Double accuracy, Double f1, String artifact) {
        Map<String, Double> metrics = new HashMap<>();
        metrics.put("accuracy", accuracy);
        if (f1 != null) {
            metrics.put("f1_score", f1);
        }
        return ModelVersion.builder()
                .versionId(ModelVersion.versionIdOf("age_model", number))
                .modelId("age_model")
                .versionNumber(number)
                .artifactLocation(artifact)
                .metrics(metrics)
                .status(VersionStatus.DEVELOPMENT)
                .build();
    }
}
