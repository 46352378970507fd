package com.di.modelnova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the external model registry. A blank {@code base-url} keeps model metadata
 * in process memory.
 */
@Data
@ConfigurationProperties(prefix = "modelnova.registry")
public class RegistryClientProperties {

    private String baseUrl = "";

    private long connectTimeoutMs = 1000;
    private long readTimeoutMs = 5000;

    /** Wraps the client in a Caffeine cache; registry writes made through this service invalidate it. */
    private boolean cacheEnabled = true;

    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private int maxSize = 1000;
        private int expireAfterWriteMinutes = 10;
    }

    public boolean isRemote() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
