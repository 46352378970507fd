package com.di.modelnova.config;

import com.di.modelnova.lifecycle.backend.CachingModelRegistryClient;
import com.di.modelnova.lifecycle.backend.HttpModelRegistryClient;
import com.di.modelnova.lifecycle.backend.InMemoryModelRegistryClient;
import com.di.modelnova.lifecycle.backend.ModelRegistryClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared OkHttp client for the training sidecar and the model registry, plus the registry client itself:
 * HTTP when {@code modelnova.registry.base-url} is set (optionally cached), in-memory otherwise.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(2))
                .readTimeout(Duration.ofSeconds(30))
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean
    public ModelRegistryClient modelRegistryClient(RegistryClientProperties props,
                                                   OkHttpClient okHttpClient,
                                                   ObjectMapper objectMapper) {
        if (!props.isRemote()) {
            log.info("[REGISTRY] No registry base-url configured; model metadata kept in memory");
            return new InMemoryModelRegistryClient();
        }
        ModelRegistryClient http = new HttpModelRegistryClient(okHttpClient, objectMapper, props);
        if (!props.isCacheEnabled()) {
            log.info("[REGISTRY] Using HTTP registry at {} (no cache)", props.getBaseUrl());
            return http;
        }
        log.info("[REGISTRY] Using HTTP registry at {} behind Caffeine cache (maxSize={}, ttlMinutes={})",
                props.getBaseUrl(), props.getCache().getMaxSize(), props.getCache().getExpireAfterWriteMinutes());
        return new CachingModelRegistryClient(http, props.getCache().getMaxSize(),
                props.getCache().getExpireAfterWriteMinutes());
    }
}
