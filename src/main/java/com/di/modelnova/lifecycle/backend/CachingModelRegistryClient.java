package com.di.modelnova.lifecycle.backend;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Cache in front of a remote registry. Baseline statistics are read on every drift evaluation but change only
 * when a model is registered or promoted, and both writes go through here and invalidate.
 */
public class CachingModelRegistryClient implements ModelRegistryClient {

    private final ModelRegistryClient delegate;
    private final Cache<String, ModelInfo> byModelId;

    public CachingModelRegistryClient(ModelRegistryClient delegate, int maxSize, int expireAfterWriteMinutes) {
        this.delegate = delegate;
        this.byModelId = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterWriteMinutes, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public Optional<ModelInfo> get(String modelId) {
        if (modelId == null || modelId.isBlank()) return Optional.empty();
        ModelInfo cached = byModelId.getIfPresent(modelId);
        if (cached != null) return Optional.of(cached);
        Optional<ModelInfo> fromRegistry = delegate.get(modelId);
        fromRegistry.ifPresent(info -> byModelId.put(modelId, info));
        return fromRegistry;
    }

    @Override
    public String put(ModelInfo info) {
        String modelId = delegate.put(info);
        byModelId.invalidate(modelId);
        return modelId;
    }

    @Override
    public void setProduction(String modelId) {
        delegate.setProduction(modelId);
        // siblings lost their flag too
        byModelId.invalidateAll();
    }
}
