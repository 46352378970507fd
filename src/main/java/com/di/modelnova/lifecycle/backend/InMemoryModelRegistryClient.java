package com.di.modelnova.lifecycle.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry used when {@code modelnova.registry.base-url} is blank, and by tests.
 */
@Slf4j
public class InMemoryModelRegistryClient implements ModelRegistryClient {

    private final Map<String, ModelInfo> models = new ConcurrentHashMap<>();

    @Override
    public Optional<ModelInfo> get(String modelId) {
        if (modelId == null) return Optional.empty();
        return Optional.ofNullable(models.get(modelId));
    }

    @Override
    public String put(ModelInfo info) {
        if (info == null || info.getModelId() == null || info.getModelId().isBlank()) {
            throw new RegistryException("Model info must carry a model id");
        }
        models.put(info.getModelId(), info);
        return info.getModelId();
    }

    @Override
    public synchronized void setProduction(String modelId) {
        ModelInfo target = models.get(modelId);
        if (target == null) {
            throw new RegistryException("Model not registered: " + modelId);
        }
        models.replaceAll((id, info) -> {
            if (id.equals(modelId)) {
                return info.toBuilder().production(true).build();
            }
            if (info.isProduction() && Objects.equals(info.getFamily(), target.getFamily())) {
                return info.toBuilder().production(false).build();
            }
            return info;
        });
        log.info("[REGISTRY] Production flag set: modelId={} family={}", modelId, target.getFamily());
    }
}
