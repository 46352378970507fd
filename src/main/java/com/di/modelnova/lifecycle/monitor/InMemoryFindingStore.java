package com.di.modelnova.lifecycle.monitor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Findings grouped by model id in evaluation order.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryFindingStore implements FindingStore {

    private final Map<String, List<MonitoringFinding>> byModel = new ConcurrentHashMap<>();

    @Override
    public void save(MonitoringFinding finding) {
        if (finding == null || finding.getModelId() == null) return;
        List<MonitoringFinding> list = byModel.computeIfAbsent(finding.getModelId(), k -> new ArrayList<>());
        synchronized (list) {
            list.add(finding);
        }
    }

    @Override
    public Optional<MonitoringFinding> findLatest(String modelId, FindingType type) {
        List<MonitoringFinding> found = find(modelId, type, 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<MonitoringFinding> find(String modelId, FindingType type, int limit) {
        List<MonitoringFinding> list = modelId != null ? byModel.get(modelId) : null;
        if (list == null) return List.of();
        List<MonitoringFinding> out = new ArrayList<>();
        synchronized (list) {
            for (int i = list.size() - 1; i >= 0 && out.size() < limit; i--) {
                MonitoringFinding f = list.get(i);
                if (type == null || type == f.getType()) {
                    out.add(f);
                }
            }
        }
        return out;
    }
}
