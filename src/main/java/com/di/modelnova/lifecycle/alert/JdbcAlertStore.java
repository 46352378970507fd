package com.di.modelnova.lifecycle.alert;

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
 * JDBC alert store (table {@code alerts}). Details are kept as JSON text.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class JdbcAlertStore implements AlertStore {

    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<Alert> rowMapper;

    public JdbcAlertStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> Alert.builder()
                .alertId(rs.getString("alert_id"))
                .modelId(rs.getString("model_id"))
                .category(AlertCategory.valueOf(rs.getString("category")))
                .severity(AlertSeverity.valueOf(rs.getString("severity")))
                .message(rs.getString("message"))
                .details(readDetails(rs.getString("details_json")))
                .sourceId(rs.getString("source_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .resolved(rs.getBoolean("resolved"))
                .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
                .build();
    }

    @Override
    public void save(Alert alert) {
        if (alert == null || alert.getAlertId() == null) return;
        jdbc.update(sql.getAlerts().getInsert(),
                alert.getAlertId(),
                alert.getModelId(),
                alert.getCategory().name(),
                alert.getSeverity().name(),
                alert.getMessage(),
                writeDetails(alert.getDetails()),
                alert.getSourceId(),
                Timestamp.from(alert.getCreatedAt() != null ? alert.getCreatedAt() : Instant.now()),
                alert.isResolved(),
                toTimestamp(alert.getResolvedAt()));
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        if (alertId == null) return Optional.empty();
        List<Alert> list = jdbc.query(sql.getAlerts().getFindById(), rowMapper, alertId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /** Resolving an already resolved alert keeps its original resolution time. */
    @Override
    public Optional<Alert> markResolved(String alertId, Instant resolvedAt) {
        if (alertId == null) return Optional.empty();
        jdbc.update(sql.getAlerts().getMarkResolved(), toTimestamp(resolvedAt), alertId);
        return findById(alertId);
    }

    @Override
    public List<Alert> find(String modelId, AlertSeverity severity, Boolean resolved, int limit) {
        String severityName = severity != null ? severity.name() : null;
        return jdbc.query(sql.getAlerts().getFind(), rowMapper,
                modelId, modelId,
                severityName, severityName,
                resolved, resolved,
                limit);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    private String writeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details != null ? details : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise alert details", e);
        }
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, DETAILS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt alert details: " + e.getOriginalMessage(), e);
        }
    }
}
