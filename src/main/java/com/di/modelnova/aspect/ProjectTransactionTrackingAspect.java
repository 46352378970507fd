package com.di.modelnova.aspect;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Tracks every API request (and, when enabled, every lifecycle component call) with a {@code txId} in MDC,
 * start/end/failure log lines and Micrometer timers. Failures are tagged with their {@link ErrorCategory}.
 * Never throws on its own account; logging or metric failures do not affect the call.
 * <p>
 * Configure via {@code modelnova.aspect.*}. Work handed to the lifecycle executors keeps the {@code txId}
 * through {@link com.di.modelnova.util.MdcPropagation}.
 */
@Slf4j
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ProjectTransactionTrackingAspect {

    static final String MDC_TX_ID = "txId";
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_FAILURE = "failure";

    private final boolean trackControllers;
    private final boolean trackServices;
    private final boolean metricsEnabled;
    private final String metricNamePrefix;
    private final boolean structuredLogging;
    private final MeterRegistry meterRegistry;

    public ProjectTransactionTrackingAspect(
            @Value("${modelnova.aspect.track-controllers:true}") boolean trackControllers,
            @Value("${modelnova.aspect.track-services:false}") boolean trackServices,
            @Value("${modelnova.aspect.metrics-enabled:true}") boolean metricsEnabled,
            @Value("${modelnova.aspect.metric-name-prefix:modelnova.tx}") String metricNamePrefix,
            @Value("${modelnova.aspect.structured-logging:false}") boolean structuredLogging,
            @Autowired(required = false) MeterRegistry meterRegistry) {
        this.trackControllers = trackControllers;
        this.trackServices = trackServices;
        this.metricsEnabled = metricsEnabled;
        this.metricNamePrefix = metricNamePrefix != null ? metricNamePrefix : "modelnova.tx";
        this.structuredLogging = structuredLogging;
        this.meterRegistry = meterRegistry;
        log.info("[ASPECT] Transaction tracking: controllers={}, services={}, metrics={}, structured-logging={}",
                trackControllers, trackServices, metricsEnabled, structuredLogging);
    }

    @Around("com.di.modelnova.aspect.TransactionTrackingPointcuts.restControllerMethods()")
    public Object trackController(ProceedingJoinPoint joinPoint) throws Throwable {
        return trackControllers ? track(joinPoint, "CONTROLLER") : joinPoint.proceed();
    }

    @Around("com.di.modelnova.aspect.TransactionTrackingPointcuts.serviceMethods()")
    public Object trackService(ProceedingJoinPoint joinPoint) throws Throwable {
        return trackServices ? track(joinPoint, "SERVICE") : joinPoint.proceed();
    }

    private Object track(ProceedingJoinPoint joinPoint, String layer) throws Throwable {
        String txId = MDC.get(MDC_TX_ID);
        boolean ownsTxId = txId == null || txId.isBlank();
        if (ownsTxId) {
            txId = "tx-" + UUID.randomUUID().toString().substring(0, 8);
            MDC.put(MDC_TX_ID, txId);
        }
        String operation = joinPoint.getTarget().getClass().getSimpleName() + "." + joinPoint.getSignature().getName();
        Timer.Sample sample = startTimer();
        logSafely(() -> {
            if (structuredLogging) {
                log.info("event=TX-START layer={} operation={}", layer, operation);
            } else {
                log.info("[TX-START] {} {}", layer, operation);
            }
        });
        long start = System.nanoTime();
        try {
            Object result = joinPoint.proceed();
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            record(layer, sample, STATUS_SUCCESS, null);
            logSafely(() -> {
                if (structuredLogging) {
                    log.info("event=TX-END layer={} operation={} durationMs={}", layer, operation, durationMs);
                } else {
                    log.info("[TX-END] {} {} durationMs={}", layer, operation, durationMs);
                }
            });
            return result;
        } catch (Throwable e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            ErrorCategory category = ErrorCategory.categorize(e);
            record(layer, sample, STATUS_FAILURE, category);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logSafely(() -> {
                if (structuredLogging) {
                    log.warn("event=TX-FAIL layer={} operation={} durationMs={} category={} error={}",
                            layer, operation, durationMs, category, error);
                } else {
                    log.warn("[TX-FAIL] {} {} durationMs={} category={} error={}",
                            layer, operation, durationMs, category, error);
                }
            });
            throw e;
        } finally {
            if (ownsTxId) {
                MDC.remove(MDC_TX_ID);
            }
        }
    }

    private Timer.Sample startTimer() {
        if (!metricsEnabled || meterRegistry == null) {
            return null;
        }
        try {
            return Timer.start(meterRegistry);
        } catch (Exception e) {
            log.debug("Aspect timer start failed: {}", e.getMessage());
            return null;
        }
    }

    private void record(String layer, Timer.Sample sample, String status, ErrorCategory category) {
        if (!metricsEnabled || meterRegistry == null) {
            return;
        }
        String categoryTag = category != null ? category.name() : "none";
        try {
            if (sample != null) {
                sample.stop(Timer.builder(metricNamePrefix + ".duration")
                        .description("Tracked invocation duration")
                        .tag("layer", layer)
                        .tag("status", status)
                        .register(meterRegistry));
            }
            Counter.builder(metricNamePrefix + ".count")
                    .description("Tracked invocation count")
                    .tag("layer", layer)
                    .tag("status", status)
                    .tag("category", categoryTag)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.debug("Aspect metrics failed: {}", e.getMessage());
        }
    }

    private static void logSafely(Runnable logging) {
        try {
            logging.run();
        } catch (Exception e) {
            log.debug("Aspect logging failed: {}", e.getMessage());
        }
    }
}
