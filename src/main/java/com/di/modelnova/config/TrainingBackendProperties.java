package com.di.modelnova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "modelnova.training")
public class TrainingBackendProperties {

    /**
     * Training sidecar root, e.g. http://127.0.0.1:8001
     */
    private String baseUrl = "http://127.0.0.1:8001";

    /** Sent as X-API-KEY when set. */
    private String apiKey = "";

    private long connectTimeoutMs = 2000;

    /** Training is slow; the pipeline applies its own, usually shorter, stage timeout on top. */
    private long readTimeoutMs = 1_800_000;

    /** Dataset location handed to the backend; {family} and {date} are substituted. */
    private String dataPathTemplate = "data/training/{family}_{date}.csv";
}
