package com.di.modelnova.lifecycle.pipeline;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryPipelineRunStore implements PipelineRunStore {

    private final Map<String, PipelineRun> byId = new ConcurrentHashMap<>();

    @Override
    public void save(PipelineRun run) {
        if (run == null || run.getRunId() == null) return;
        byId.put(run.getRunId(), run);
    }

    @Override
    public Optional<PipelineRun> findById(String runId) {
        return runId == null ? Optional.empty() : Optional.ofNullable(byId.get(runId));
    }

    @Override
    public List<PipelineRun> findRecent(String modelFamily, int limit) {
        return byId.values().stream()
                .filter(r -> modelFamily == null || modelFamily.equals(r.getModelFamily()))
                .sorted(Comparator.comparing(PipelineRun::getStartedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
