package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.config.ExecutorConfig;
import com.di.modelnova.config.LifecycleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Periodically evaluates armed models once enough new predictions have arrived, then checks the traffic balance
 * of active A/B tests. Each evaluation runs on the monitor pool and is abandoned after
 * {@code modelnova.monitor.evaluation-timeout}.
 */
@Slf4j
@Component
public class MonitorWatchLoop implements SmartLifecycle {

    private final DriftDecayMonitor monitor;
    private final ProductionMonitoringService productionMonitoring;
    private final ExecutorService evaluationExecutor;
    private final Duration interval;
    private final Duration evaluationTimeout;
    private final boolean enabled;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> handle;

    public MonitorWatchLoop(DriftDecayMonitor monitor,
                            ProductionMonitoringService productionMonitoring,
                            @Qualifier(ExecutorConfig.MONITOR_EXECUTOR) ExecutorService evaluationExecutor,
                            LifecycleProperties props,
                            @Value("${modelnova.monitor.watch-enabled:true}") boolean enabled) {
        this.monitor = monitor;
        this.productionMonitoring = productionMonitoring;
        this.evaluationExecutor = evaluationExecutor;
        this.interval = props.getMonitor().getWatchInterval();
        this.evaluationTimeout = props.getMonitor().getEvaluationTimeout();
        this.enabled = enabled;
    }

    @Override
    public synchronized void start() {
        if (!enabled || isRunning()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "monitor-watch");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        handle = scheduler.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.info("[MONITOR] Watch loop started, interval={}", interval);
    }

    @Override
    public synchronized void stop() {
        if (handle != null) {
            handle.cancel(false);
            handle = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("[MONITOR] Watch loop stopped");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return handle != null && !handle.isCancelled();
    }

    /**
     * One pass over the armed models and the active A/B tests. Never throws, so the schedule keeps running.
     *
     * @return number of evaluations that completed
     */
    public int tick() {
        int completed = 0;
        for (String modelId : monitor.armedModels()) {
            for (FindingType type : FindingType.values()) {
                if (monitor.isReadyForEvaluation(modelId, type) && evaluate(modelId, type)) {
                    completed++;
                }
            }
        }
        checkAbTestBalance();
        return completed;
    }

    private void checkAbTestBalance() {
        try {
            int raised = productionMonitoring.checkAbTestBalance().size();
            if (raised > 0) {
                log.info("[MONITOR] Raised {} A/B traffic imbalance alert(s)", raised);
            }
        } catch (RuntimeException e) {
            log.error("[MONITOR] A/B balance check failed: {}", e.getMessage(), e);
        }
    }

    private boolean evaluate(String modelId, FindingType type) {
        Future<MonitoringFinding> future = evaluationExecutor.submit(() -> type == FindingType.DATA_DRIFT
                ? monitor.evaluateDrift(modelId)
                : monitor.evaluateDecay(modelId));
        try {
            future.get(evaluationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[MONITOR] {} evaluation for {} timed out after {}", type, modelId, evaluationTimeout);
        } catch (ExecutionException e) {
            log.error("[MONITOR] {} evaluation for {} failed: {}", type, modelId,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[MONITOR] Watch loop interrupted while evaluating {}", modelId);
        }
        return false;
    }
}
