package com.di.modelnova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Carries SLF4J MDC (request id, {@code txId}, pipeline run id) from the submitting thread into worker threads.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> context = copyMdc();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(context);
            try {
                task.run();
            } finally {
                restore(previous);
            }
        };
    }

    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> context = copyMdc();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(context);
            try {
                return task.call();
            } finally {
                restore(previous);
            }
        };
    }

    /**
     * Executor whose {@code execute}/{@code submit} calls capture the caller's MDC.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /** Copy of the current MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void apply(Map<String, String> context) {
        MDC.clear();
        context.forEach(MDC::put);
    }

    private static void restore(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
