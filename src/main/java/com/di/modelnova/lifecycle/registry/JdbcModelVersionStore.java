package com.di.modelnova.lifecycle.registry;

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
import java.util.Optional;

/**
 * JDBC version store (table {@code model_versions}); metrics are kept as JSON text.
 * Enable with modelnova.persistence-enabled=true and a configured datasource.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class JdbcModelVersionStore implements ModelVersionStore {

    private static final TypeReference<Map<String, Double>> METRICS = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<ModelVersion> rowMapper;

    public JdbcModelVersionStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> ModelVersion.builder()
                .versionId(rs.getString("version_id"))
                .modelId(rs.getString("model_id"))
                .versionNumber(rs.getString("version_number"))
                .artifactLocation(rs.getString("artifact_location"))
                .metrics(readMetrics(rs.getString("metrics_json")))
                .trainedAt(toInstant(rs.getTimestamp("trained_at")))
                .deployedAt(toInstant(rs.getTimestamp("deployed_at")))
                .status(VersionStatus.valueOf(rs.getString("status")))
                .parentVersion(rs.getString("parent_version"))
                .changelog(rs.getString("changelog"))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public void save(ModelVersion v) {
        if (v == null || v.getVersionId() == null) return;
        jdbc.update(sql.getVersions().getInsert(),
                v.getVersionId(),
                v.getModelId(),
                v.getVersionNumber(),
                v.getArtifactLocation(),
                writeMetrics(v.getMetrics()),
                toTimestamp(v.getTrainedAt() != null ? v.getTrainedAt() : Instant.now()),
                toTimestamp(v.getDeployedAt()),
                v.getStatus().name(),
                v.getParentVersion(),
                v.getChangelog());
    }

    @Override
    public void updateStatus(String versionId, VersionStatus status, Instant deployedAt) {
        if (versionId == null || status == null) return;
        Instant keep = deployedAt;
        if (keep == null) {
            keep = findByVersionId(versionId).map(ModelVersion::getDeployedAt).orElse(null);
        }
        jdbc.update(sql.getVersions().getUpdateStatus(), status.name(), toTimestamp(keep), versionId);
    }

    @Override
    public Optional<ModelVersion> findByVersionId(String versionId) {
        if (versionId == null) return Optional.empty();
        List<ModelVersion> list = jdbc.query(sql.getVersions().getFindByVersionId(), rowMapper, versionId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<ModelVersion> findByModelId(String modelId) {
        if (modelId == null) return List.of();
        return jdbc.query(sql.getVersions().getFindByModelId(), rowMapper, modelId);
    }

    @Override
    public List<ModelVersion> findByStatus(VersionStatus status) {
        return jdbc.query(sql.getVersions().getFindByStatus(), rowMapper, status.name());
    }

    private String writeMetrics(Map<String, Double> metrics) {
        try {
            return objectMapper.writeValueAsString(metrics != null ? metrics : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise version metrics", e);
        }
    }

    private Map<String, Double> readMetrics(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, METRICS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt version metrics: " + e.getOriginalMessage(), e);
        }
    }
}
