package com.di.modelnova.lifecycle.monitor;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.backend.PredictionRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-model window of the most recent predictions (oldest evicted first), plus counters of what
 * arrived since the last drift and decay evaluation. Only {@link DriftDecayMonitor} touches it.
 */
@Component
public class RecentPredictionBuffer {

    private final int capacity;
    private final Map<String, ModelWindow> windows = new ConcurrentHashMap<>();

    public RecentPredictionBuffer(LifecycleProperties props) {
        this(props.getMonitor().getBufferCapacity());
    }

    RecentPredictionBuffer(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public void append(PredictionRecord record) {
        windows.computeIfAbsent(record.getModelId(), k -> new ModelWindow()).append(record, capacity);
    }

    /** Oldest first. */
    public List<PredictionRecord> snapshot(String modelId) {
        ModelWindow w = windows.get(modelId);
        return w == null ? List.of() : w.snapshot();
    }

    public int size(String modelId) {
        ModelWindow w = windows.get(modelId);
        return w == null ? 0 : w.size();
    }

    /**
     * Predictions (for drift) or labelled predictions (for decay) appended since the last
     * {@link #markEvaluated}.
     */
    public long newSinceEvaluation(String modelId, FindingType type) {
        ModelWindow w = windows.get(modelId);
        return w == null ? 0 : w.newSince(type);
    }

    public void markEvaluated(String modelId, FindingType type) {
        ModelWindow w = windows.get(modelId);
        if (w != null) w.reset(type);
    }

    public int capacity() {
        return capacity;
    }

    private static final class ModelWindow {
        private final Deque<PredictionRecord> records = new ArrayDeque<>();
        private final Map<FindingType, Long> sinceEvaluation = new EnumMap<>(FindingType.class);

        synchronized void append(PredictionRecord record, int capacity) {
            records.addLast(record);
            while (records.size() > capacity) {
                records.removeFirst();
            }
            sinceEvaluation.merge(FindingType.DATA_DRIFT, 1L, Long::sum);
            if (record.hasGroundTruth()) {
                sinceEvaluation.merge(FindingType.MODEL_DECAY, 1L, Long::sum);
            }
        }

        synchronized List<PredictionRecord> snapshot() {
            return new ArrayList<>(records);
        }

        synchronized int size() {
            return records.size();
        }

        synchronized long newSince(FindingType type) {
            return sinceEvaluation.getOrDefault(type, 0L);
        }

        synchronized void reset(FindingType type) {
            sinceEvaluation.put(type, 0L);
        }
    }
}
