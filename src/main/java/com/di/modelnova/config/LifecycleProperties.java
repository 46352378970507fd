package com.di.modelnova.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for every lifecycle threshold and schedule. Values come from {@code application.yml};
 * a missing or out-of-range threshold fails startup instead of falling back to a guess.
 *
 * <pre>
 * modelnova:
 *   monitor:
 *     drift-threshold: 0.1
 *     decay-threshold: 0.05
 *     min-samples: 100
 *   abtest:
 *     min-samples-per-arm: 30
 *   pipeline:
 *     min-accuracy: 0.85
 *     ab-traffic-fraction: 0.1
 *   retrain:
 *     check-interval: 1h
 *     daily-sweep-time: "02:00"
 *     scheduled-interval: 30d
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "modelnova")
public class LifecycleProperties {

    /** When true, versions, pipeline runs and the prediction log are kept in the configured database. */
    private boolean persistenceEnabled = false;

    @Valid
    @NotNull
    private Monitor monitor = new Monitor();

    @Valid
    @NotNull
    private AbTest abtest = new AbTest();

    @Valid
    @NotNull
    private Pipeline pipeline = new Pipeline();

    @Valid
    @NotNull
    private Retrain retrain = new Retrain();

    @Data
    public static class Monitor {

        /** KS statistic above which a feature is flagged as drifted. */
        @NotNull
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private Double driftThreshold = 0.1;

        /** Absolute drop in accuracy or F1 (from the training baseline) that counts as decay. */
        @NotNull
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private Double decayThreshold = 0.05;

        /** Recent predictions required before drift or decay is evaluated at all. */
        @Min(1)
        private int minSamples = 100;

        /** Non-null values a single feature needs before it is compared with its baseline. */
        @Min(2)
        private int minFeatureSamples = 30;

        @Min(1)
        private int bufferCapacity = 1000;

        /** Upper bound on the size of the synthetic baseline sample. */
        @Min(1)
        private int referenceSampleCap = 1000;

        /** A finding whose magnitude exceeds threshold times this factor raises a CRITICAL alert. */
        @DecimalMin("1.0")
        private double criticalMultiplier = 2.0;

        @NotNull
        private Duration watchInterval = Duration.ofSeconds(60);

        @NotNull
        private Duration evaluationTimeout = Duration.ofSeconds(30);

        /** Prediction metadata key whose distinct values are reported as serving segments. */
        private String segmentKey = "equipment_id";

        /** Fixed seed for the baseline sampler; null draws a fresh seed per evaluation. */
        private Long randomSeed;
    }

    @Data
    public static class AbTest {

        /** Predictions each arm must exceed before a significance verdict is computed. */
        @Min(1)
        private int minSamplesPerArm = 30;

        @NotNull
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private Double significanceLevel = 0.05;

        /** Allowed gap between the configured and the observed treatment share. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double imbalanceTolerance = 0.1;
    }

    @Data
    public static class Pipeline {

        /** Minimum value of {@link #gateMetric} a candidate must reach in validation. */
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double minAccuracy = 0.85;

        @NotBlank
        private String gateMetric = "accuracy";

        private boolean abTestingEnabled = true;

        /** Share of traffic routed to a candidate during its A/B test. */
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double abTrafficFraction = 0.1;

        @NotNull
        private Duration trainingTimeout = Duration.ofMinutes(30);

        @Min(1)
        private long minTrainingRecords = 100;

        /** How far a candidate metric may fall below production before testing rejects it. */
        @DecimalMin("0.0")
        private double regressionTolerance = 0.02;

        @Min(1)
        private int workerThreads = 4;

        /** Metrics the training backend must report for a candidate to pass testing. */
        private List<String> requiredMetrics = new ArrayList<>(List.of("accuracy", "f1_score"));
    }

    @Data
    public static class Retrain {

        /** Turns the background retrain scheduler on or off. Manual and API-driven checks always work. */
        private boolean enabled = true;

        @NotNull
        private Duration checkInterval = Duration.ofHours(1);

        /** Local time (HH:mm) of the daily full sweep. */
        @NotNull
        @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$")
        private String dailySweepTime = "02:00";

        /** Age of the training run after which a scheduled retrain is due. */
        @NotNull
        private Duration scheduledInterval = Duration.ofDays(30);

        @Min(1)
        private int historyLimit = 100;
    }
}
