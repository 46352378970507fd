package com.di.modelnova.lifecycle.backend;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory prediction log, trimmed to the newest {@code modelnova.prediction-log.retention-per-model} records
 * per model. When {@code modelnova.persistence-enabled=true}, {@link JdbcPredictionLogStore} is used instead.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryPredictionLogStore implements PredictionLogStore {

    private final Map<String, Deque<PredictionRecord>> byModel = new ConcurrentHashMap<>();
    private final int retentionPerModel;

    public InMemoryPredictionLogStore(
            @Value("${modelnova.prediction-log.retention-per-model:10000}") int retentionPerModel) {
        this.retentionPerModel = Math.max(1, retentionPerModel);
    }

    @Override
    public void logPrediction(PredictionRecord record) {
        if (record == null || record.getModelId() == null) return;
        Deque<PredictionRecord> log = byModel.computeIfAbsent(record.getModelId(), k -> new ArrayDeque<>());
        synchronized (log) {
            log.addLast(record);
            while (log.size() > retentionPerModel) {
                log.removeFirst();
            }
        }
    }

    @Override
    public List<PredictionRecord> recentPredictions(String modelId, int window) {
        Deque<PredictionRecord> log = modelId != null ? byModel.get(modelId) : null;
        if (log == null || window <= 0) return List.of();
        synchronized (log) {
            List<PredictionRecord> all = new ArrayList<>(log);
            return all.subList(Math.max(0, all.size() - window), all.size());
        }
    }
}
