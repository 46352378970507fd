package com.di.modelnova.lifecycle.backend;

import com.di.modelnova.config.TrainingBackendProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Training backend running as an HTTP sidecar: {@code POST /train} with {@link TrainRequest},
 * answered by a {@link TrainingResult}.
 */
@Slf4j
@Component
public class SidecarTrainingBackend implements TrainingBackend {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final TrainingBackendProperties props;

    public SidecarTrainingBackend(OkHttpClient baseClient, ObjectMapper objectMapper, TrainingBackendProperties props) {
        this.baseClient = baseClient;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    private OkHttpClient clientWithTimeouts() {
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
    }

    @Override
    public TrainingResult train(String modelType, DatasetHandle dataset, Map<String, Object> hyperparameters)
            throws TrainingException {
        String url = props.getBaseUrl().replaceAll("/+$", "") + "/train";
        TrainRequest body = TrainRequest.builder()
                .modelType(modelType)
                .datasetId(dataset.getDatasetId())
                .datasetLocation(dataset.getLocation())
                .hyperparameters(hyperparameters != null ? hyperparameters : Map.of())
                .build();
        try {
            Request.Builder rb = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON));
            if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
                rb.header("X-API-KEY", props.getApiKey().trim());
            }
            try (Response resp = clientWithTimeouts().newCall(rb.build()).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";
                if (!resp.isSuccessful()) {
                    log.warn("[PIPELINE] Training sidecar error: POST /train -> {} body={}", resp.code(), shrink(respBody));
                    throw new TrainingException("Training sidecar HTTP " + resp.code() + ": " + shrink(respBody));
                }
                if (respBody.isBlank()) {
                    throw new TrainingException("Training sidecar returned an empty body for " + modelType);
                }
                TrainingResult result = objectMapper.readValue(respBody, TrainingResult.class);
                if (result.getArtifactLocation() == null || result.getArtifactLocation().isBlank()) {
                    throw new TrainingException("Training sidecar returned no artifact location for " + modelType);
                }
                return result;
            }
        } catch (IOException e) {
            throw new TrainingException("Training sidecar IO error: " + url + " -> " + e.getMessage(), e);
        }
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        return x.length() <= 400 ? x : x.substring(0, 400) + "...";
    }

    @Value
    @Builder
    public static class TrainRequest {
        String modelType;
        String datasetId;
        String datasetLocation;
        Map<String, Object> hyperparameters;
    }
}
