package com.di.modelnova.lifecycle.backend;

import com.di.modelnova.config.TrainingBackendProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SidecarTrainingBackend Tests")
class SidecarTrainingBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private TrainingBackendProperties props;
    private SidecarTrainingBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        props = new TrainingBackendProperties();
        props.setBaseUrl(server.url("/").toString());
        props.setReadTimeoutMs(5_000);
        backend = new SidecarTrainingBackend(new OkHttpClient(), objectMapper, props);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should POST the dataset to /train and parse metrics and baselines")
    void testTrain_Success() throws Exception {
        props.setApiKey(" secret ");
        server.enqueue(json(200, """
                {"artifactLocation":"models/age_model/1.0.1/model.pkl",
                 "metrics":{"accuracy":0.91,"f1_score":0.9},
                 "featureNames":["age"],
                 "baselineStatistics":{"age":{"mean":60.0,"std":10.0}},
                 "trainingDurationSeconds":12.5}
                """));

        TrainingResult result = backend.train("age_model", dataset(), Map.of("max_depth", 6));

        assertEquals("models/age_model/1.0.1/model.pkl", result.getArtifactLocation());
        assertEquals(0.91, result.getMetrics().get("accuracy"));
        assertEquals(List.of("age"), result.getFeatureNames());
        assertEquals(60.0, result.getBaselineStatistics().get("age").getMean());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals("/train", request.getPath());
        assertEquals("secret", request.getHeader("X-API-KEY"));
        JsonNode sent = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("age_model", sent.get("modelType").asText());
        assertEquals("age_model-2024-05-10", sent.get("datasetId").asText());
        assertEquals("data/training/age_model_2024-05-10.csv", sent.get("datasetLocation").asText());
        assertEquals(6, sent.get("hyperparameters").get("max_depth").asInt());
    }

    @Test
    @DisplayName("Should omit the API key header when none is configured")
    void testTrain_NoApiKey() throws Exception {
        server.enqueue(json(200, "{\"artifactLocation\":\"models/m.pkl\"}"));

        TrainingResult result = backend.train("age_model", dataset(), null);

        assertTrue(result.getMetrics().isEmpty());
        assertNull(server.takeRequest(1, TimeUnit.SECONDS).getHeader("X-API-KEY"));
    }

    @Test
    @DisplayName("Should fail on a non-2xx answer and carry the status code")
    void testTrain_HttpError() {
        server.enqueue(json(503, "{\"error\":\"gpu pool exhausted\"}"));

        TrainingException e = assertThrows(TrainingException.class,
                () -> backend.train("age_model", dataset(), Map.of()));

        assertTrue(e.getMessage().contains("503"));
        assertTrue(e.getMessage().contains("gpu pool exhausted"));
    }

    @Test
    @DisplayName("Should fail on an empty body or a missing artifact location")
    void testTrain_IncompleteAnswer() {
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(json(200, "{\"metrics\":{\"accuracy\":0.9}}"));

        assertThrows(TrainingException.class, () -> backend.train("age_model", dataset(), Map.of()));
        TrainingException missing = assertThrows(TrainingException.class,
                () -> backend.train("age_model", dataset(), Map.of()));
        assertTrue(missing.getMessage().contains("artifact"));
    }

    @Test
    @DisplayName("Should wrap connection failures as TrainingException")
    void testTrain_Unreachable() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        props.setBaseUrl(stopped.url("/").toString());
        stopped.shutdown();

        TrainingException e = assertThrows(TrainingException.class,
                () -> backend.train("age_model", dataset(), Map.of()));

        assertNotNull(e.getCause());
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse()
                .setResponseCode(code)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static DatasetHandle dataset() {
        return DatasetHandle.builder()
                .datasetId("age_model-2024-05-10")
                .modelFamily("age_model")
                .location("data/training/age_model_2024-05-10.csv")
                .acquiredAt(Instant.now())
                .build();
    }
}
