package com.di.modelnova.lifecycle.monitor;

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
 * JDBC finding store (table {@code monitoring_findings}). Per-feature details and skipped features are kept as
 * JSON text; newest first means highest insertion sequence first.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class JdbcFindingStore implements FindingStore {

    private static final TypeReference<Map<String, FindingDetail>> DETAILS = new TypeReference<>() { };
    private static final TypeReference<List<String>> SKIPPED = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<MonitoringFinding> rowMapper;

    public JdbcFindingStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> MonitoringFinding.builder()
                .findingId(rs.getString("finding_id"))
                .modelId(rs.getString("model_id"))
                .type(FindingType.valueOf(rs.getString("finding_type")))
                .outcome(FindingOutcome.valueOf(rs.getString("outcome")))
                .details(read(rs.getString("details_json"), DETAILS, Map.of()))
                .skippedFeatures(read(rs.getString("skipped_json"), SKIPPED, List.of()))
                .sampleSize(rs.getInt("sample_size"))
                .magnitude(rs.getDouble("magnitude"))
                .reason(rs.getString("reason"))
                .evaluatedAt(toInstant(rs.getTimestamp("evaluated_at")))
                .build();
    }

    @Override
    public void save(MonitoringFinding finding) {
        if (finding == null || finding.getModelId() == null) return;
        jdbc.update(sql.getFindings().getInsert(),
                finding.getFindingId(),
                finding.getModelId(),
                finding.getType().name(),
                finding.getOutcome().name(),
                write(finding.getDetails()),
                write(finding.getSkippedFeatures()),
                finding.getSampleSize(),
                finding.getMagnitude(),
                finding.getReason(),
                Timestamp.from(finding.getEvaluatedAt() != null ? finding.getEvaluatedAt() : Instant.now()));
    }

    @Override
    public Optional<MonitoringFinding> findLatest(String modelId, FindingType type) {
        List<MonitoringFinding> found = find(modelId, type, 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<MonitoringFinding> find(String modelId, FindingType type, int limit) {
        if (modelId == null) return List.of();
        if (type == null) {
            return jdbc.query(sql.getFindings().getFindByModel(), rowMapper, modelId, limit);
        }
        return jdbc.query(sql.getFindings().getFindByModelAndType(), rowMapper, modelId, type.name(), limit);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise monitoring finding", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type, T empty) {
        if (json == null || json.isBlank()) return empty;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt monitoring finding column: " + e.getOriginalMessage(), e);
        }
    }
}
