package com.di.modelnova.lifecycle.backend;

import com.di.modelnova.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JDBC prediction log (table {@code prediction_log}). Feature and metadata maps are stored as JSON text.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class JdbcPredictionLogStore implements PredictionLogStore {

    private static final TypeReference<Map<String, Double>> FEATURES = new TypeReference<>() { };
    private static final TypeReference<Map<String, String>> METADATA = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<PredictionRecord> rowMapper;

    public JdbcPredictionLogStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> PredictionRecord.builder()
                .modelId(rs.getString("model_id"))
                .features(fromJson(rs.getString("features_json"), FEATURES))
                .prediction(rs.getDouble("prediction"))
                .probability((Double) rs.getObject("probability"))
                .groundTruth((Double) rs.getObject("ground_truth"))
                .metadata(fromJson(rs.getString("metadata_json"), METADATA))
                .recordedAt(toInstant(rs.getTimestamp("recorded_at")))
                .build();
    }

    @Override
    public void logPrediction(PredictionRecord record) {
        if (record == null || record.getModelId() == null) return;
        jdbc.update(sql.getPredictions().getInsert(),
                record.getModelId(),
                toJson(record.getFeatures()),
                record.getPrediction(),
                record.getProbability(),
                record.getGroundTruth(),
                toJson(record.getMetadata()),
                Timestamp.from(record.getRecordedAt() != null ? record.getRecordedAt() : Instant.now()));
    }

    @Override
    public List<PredictionRecord> recentPredictions(String modelId, int window) {
        if (modelId == null || window <= 0) return List.of();
        return jdbc.query(sql.getPredictions().getFindRecent(), rowMapper, modelId, window);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise prediction payload", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt prediction payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
