package com.di.modelnova.config;

import com.di.modelnova.util.MdcPropagation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools. Pipeline runs and training calls use separate pools so a hung training call cannot starve
 * run bookkeeping; monitor evaluations get their own pool so a slow statistic cannot delay a pipeline.
 * Every pool propagates MDC from the submitting thread.
 */
@Configuration
public class ExecutorConfig {

    public static final String PIPELINE_EXECUTOR = "pipelineExecutor";
    public static final String TRAINING_EXECUTOR = "trainingExecutor";
    public static final String MONITOR_EXECUTOR = "monitorExecutor";

    @Bean(name = PIPELINE_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(LifecycleProperties props) {
        return MdcPropagation.wrapExecutor(
                Executors.newFixedThreadPool(props.getPipeline().getWorkerThreads(), named("pipeline-run")));
    }

    @Bean(name = TRAINING_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService trainingExecutor(LifecycleProperties props) {
        return MdcPropagation.wrapExecutor(
                Executors.newFixedThreadPool(props.getPipeline().getWorkerThreads(), named("training-call")));
    }

    @Bean(name = MONITOR_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService monitorExecutor() {
        return MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(2, named("monitor-eval")));
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
