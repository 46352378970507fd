package com.di.modelnova.lifecycle.backend;

import com.di.modelnova.config.RegistryClientProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Model registry reached over HTTP/JSON:
 * {@code GET /models/{id}}, {@code PUT /models/{id}}, {@code POST /models/{id}/production}.
 */
@Slf4j
public class HttpModelRegistryClient implements ModelRegistryClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpModelRegistryClient(OkHttpClient baseClient, ObjectMapper objectMapper, RegistryClientProperties props) {
        this.client = baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
        this.objectMapper = objectMapper;
        this.baseUrl = props.getBaseUrl().replaceAll("/+$", "");
    }

    @Override
    public Optional<ModelInfo> get(String modelId) {
        if (modelId == null || modelId.isBlank()) return Optional.empty();
        Request request = new Request.Builder().url(modelUrl(modelId)).get().build();
        try (Response resp = client.newCall(request).execute()) {
            if (resp.code() == 404) {
                return Optional.empty();
            }
            String body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw new RegistryException("Registry HTTP " + resp.code() + " on GET " + modelId + ": " + shrink(body));
            }
            return Optional.of(objectMapper.readValue(body, ModelInfo.class));
        } catch (IOException e) {
            throw new RegistryException("Registry IO error on GET " + modelId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String put(ModelInfo info) {
        if (info == null || info.getModelId() == null) {
            throw new RegistryException("Model info must carry a model id");
        }
        try {
            String json = objectMapper.writeValueAsString(info);
            Request request = new Request.Builder()
                    .url(modelUrl(info.getModelId()))
                    .put(RequestBody.create(json, JSON))
                    .build();
            execute(request, "PUT " + info.getModelId());
            return info.getModelId();
        } catch (IOException e) {
            throw new RegistryException("Registry IO error on PUT " + info.getModelId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setProduction(String modelId) {
        Request request = new Request.Builder()
                .url(modelUrl(modelId) + "/production")
                .post(RequestBody.create("{}", JSON))
                .build();
        try {
            execute(request, "POST production " + modelId);
        } catch (IOException e) {
            throw new RegistryException("Registry IO error on set-production " + modelId + ": " + e.getMessage(), e);
        }
    }

    private void execute(Request request, String what) throws IOException {
        try (Response resp = client.newCall(request).execute()) {
            if (!resp.isSuccessful()) {
                String body = resp.body() != null ? resp.body().string() : "";
                log.warn("[REGISTRY] {} -> HTTP {} body={}", what, resp.code(), shrink(body));
                throw new RegistryException("Registry HTTP " + resp.code() + " on " + what + ": " + shrink(body));
            }
        }
    }

    private String modelUrl(String modelId) {
        return baseUrl + "/models/" + URLEncoder.encode(modelId, StandardCharsets.UTF_8);
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        return x.length() <= 400 ? x : x.substring(0, 400) + "...";
    }
}
