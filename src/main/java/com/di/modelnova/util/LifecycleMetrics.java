package com.di.modelnova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the lifecycle components: pipeline runs and stages, monitor evaluations, alerts,
 * version transitions and A/B outcomes. Recording never throws.
 */
@Slf4j
@Component
public class LifecycleMetrics {

    private final MeterRegistry meterRegistry;

    public LifecycleMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordPipelineRun(String family, String status, Duration duration) {
        safely(() -> {
            Counter.builder("modelnova.pipeline.runs")
                    .description("Pipeline runs by terminal status")
                    .tag("family", family)
                    .tag("status", status)
                    .register(meterRegistry)
                    .increment();
            if (duration != null) {
                Timer.builder("modelnova.pipeline.run.duration")
                        .description("End-to-end pipeline run duration")
                        .tag("status", status)
                        .register(meterRegistry)
                        .record(duration);
            }
        });
    }

    public void recordStage(String stage, boolean success, Duration duration) {
        safely(() -> Timer.builder("modelnova.pipeline.stage.duration")
                .description("Duration of a single pipeline stage")
                .tag("stage", stage)
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .record(duration));
    }

    public void recordEvaluation(String type, String outcome) {
        safely(() -> Counter.builder("modelnova.monitor.evaluations")
                .description("Drift and decay evaluations by outcome")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment());
    }

    public void recordAlert(String category, String severity) {
        safely(() -> Counter.builder("modelnova.alerts.raised")
                .description("Alerts raised by category and severity")
                .tag("category", category)
                .tag("severity", severity)
                .register(meterRegistry)
                .increment());
    }

    public void recordVersionTransition(String action, boolean success) {
        safely(() -> Counter.builder("modelnova.registry.transitions")
                .description("Promotions, rollbacks and archivals")
                .tag("action", action)
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .increment());
    }

    public void recordAbOutcome(String arm, boolean labelled) {
        safely(() -> Counter.builder("modelnova.abtest.outcomes")
                .description("Recorded A/B outcomes")
                .tag("arm", arm)
                .tag("labelled", String.valueOf(labelled))
                .register(meterRegistry)
                .increment());
    }

    private void safely(Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.debug("Metric recording failed: {}", e.getMessage());
        }
    }
}
