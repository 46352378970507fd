package com.di.modelnova.lifecycle.retrain;

import com.di.modelnova.config.LifecycleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background retrain checks: the watched models every {@code check-interval}, and every production model once a
 * day at {@code daily-sweep-time} (server local time). Both tasks share one scheduler thread, so they never overlap.
 */
@Slf4j
@Component
public class RetrainScheduler implements SmartLifecycle {

    private final RetrainTriggerEngine engine;
    private final LifecycleProperties.Retrain config;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> checkHandle;
    private ScheduledFuture<?> sweepHandle;

    public RetrainScheduler(RetrainTriggerEngine engine, LifecycleProperties props) {
        this.engine = engine;
        this.config = props.getRetrain();
    }

    @Override
    public synchronized void start() {
        if (!config.isEnabled() || isRunning()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retrain-scheduler");
            t.setDaemon(true);
            return t;
        });
        long checkMillis = config.getCheckInterval().toMillis();
        checkHandle = scheduler.scheduleAtFixedRate(this::runCheck, checkMillis, checkMillis, TimeUnit.MILLISECONDS);
        LocalTime sweepAt = LocalTime.parse(config.getDailySweepTime());
        long sweepDelay = millisUntil(sweepAt, ZonedDateTime.now());
        sweepHandle = scheduler.scheduleAtFixedRate(this::runSweep, sweepDelay, Duration.ofDays(1).toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("[RETRAIN] Scheduler started: check every {}, daily sweep at {} (first in {} min)",
                config.getCheckInterval(), sweepAt, TimeUnit.MILLISECONDS.toMinutes(sweepDelay));
    }

    @Override
    public synchronized void stop() {
        if (checkHandle != null) {
            checkHandle.cancel(false);
            checkHandle = null;
        }
        if (sweepHandle != null) {
            sweepHandle.cancel(false);
            sweepHandle = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("[RETRAIN] Scheduler stopped");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    void runCheck() {
        try {
            List<RetrainDecision> decisions = engine.checkArmedModels();
            long triggered = decisions.stream().filter(RetrainDecision::isTriggered).count();
            log.info("[RETRAIN] Periodic check: {} model(s) checked, {} retrain(s) submitted", decisions.size(), triggered);
        } catch (RuntimeException e) {
            log.error("[RETRAIN] Periodic check failed: {}", e.getMessage(), e);
        }
    }

    void runSweep() {
        try {
            List<RetrainDecision> decisions = engine.sweepProductionModels();
            long triggered = decisions.stream().filter(RetrainDecision::isTriggered).count();
            log.info("[RETRAIN] Daily sweep: {} production model(s) checked, {} retrain(s) submitted",
                    decisions.size(), triggered);
        } catch (RuntimeException e) {
            log.error("[RETRAIN] Daily sweep failed: {}", e.getMessage(), e);
        }
    }

    /** Milliseconds from {@code now} to the next occurrence of {@code time}; a time equal to now is a day away. */
    static long millisUntil(LocalTime time, ZonedDateTime now) {
        ZonedDateTime next = now.with(time).withNano(0);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next).toMillis();
    }
}
