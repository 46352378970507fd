package com.di.modelnova.lifecycle.registry;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory version store. Suitable for single-node and testing.
 * When modelnova.persistence-enabled=true, JdbcModelVersionStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryModelVersionStore implements ModelVersionStore {

    private final Map<String, ModelVersion> byVersionId = new ConcurrentHashMap<>();
    private final List<String> insertionOrder = new ArrayList<>();

    @Override
    public void save(ModelVersion version) {
        if (version == null || version.getVersionId() == null) return;
        if (byVersionId.putIfAbsent(version.getVersionId(), version) == null) {
            synchronized (insertionOrder) {
                insertionOrder.add(version.getVersionId());
            }
        }
    }

    @Override
    public void updateStatus(String versionId, VersionStatus status, Instant deployedAt) {
        byVersionId.computeIfPresent(versionId, (id, existing) -> existing.toBuilder()
                .status(status)
                .deployedAt(deployedAt != null ? deployedAt : existing.getDeployedAt())
                .build());
    }

    @Override
    public Optional<ModelVersion> findByVersionId(String versionId) {
        return versionId == null ? Optional.empty() : Optional.ofNullable(byVersionId.get(versionId));
    }

    @Override
    public List<ModelVersion> findByModelId(String modelId) {
        List<String> ids;
        synchronized (insertionOrder) {
            ids = new ArrayList<>(insertionOrder);
        }
        return ids.stream()
                .map(byVersionId::get)
                .filter(v -> v != null && v.getModelId().equals(modelId))
                .collect(Collectors.toList());
    }

    @Override
    public List<ModelVersion> findByStatus(VersionStatus status) {
        return byVersionId.values().stream()
                .filter(v -> v.getStatus() == status)
                .sorted(Comparator.comparing(ModelVersion::getModelId))
                .collect(Collectors.toList());
    }
}
