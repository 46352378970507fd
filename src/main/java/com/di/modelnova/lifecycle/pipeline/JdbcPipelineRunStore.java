package com.di.modelnova.lifecycle.pipeline;

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
 * JDBC run store (table {@code pipeline_runs}). Stage results and metrics are kept as JSON text; a run is
 * written on every state change and updated in place once its row exists.
 */
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class JdbcPipelineRunStore implements PipelineRunStore {

    private static final TypeReference<List<StageResult>> STAGES = new TypeReference<>() { };
    private static final TypeReference<Map<String, Double>> METRICS = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<PipelineRun> rowMapper;

    public JdbcPipelineRunStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> PipelineRun.builder()
                .runId(rs.getString("run_id"))
                .modelFamily(rs.getString("model_family"))
                .triggerReason(TriggerReason.valueOf(rs.getString("trigger_reason")))
                .status(PipelineStatus.valueOf(rs.getString("status")))
                .stages(read(rs.getString("stages_json"), STAGES, List.of()))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .modelVersionId(rs.getString("model_version_id"))
                .abTestId(rs.getString("ab_test_id"))
                .error(rs.getString("error"))
                .metrics(read(rs.getString("metrics_json"), METRICS, null))
                .build();
    }

    @Override
    public void save(PipelineRun run) {
        if (run == null || run.getRunId() == null) return;
        String stages = write(run.getStages());
        String metrics = run.getMetrics() != null ? write(run.getMetrics()) : null;
        int updated = jdbc.update(sql.getRuns().getUpdate(),
                run.getStatus().name(),
                stages,
                toTimestamp(run.getFinishedAt()),
                run.getModelVersionId(),
                run.getAbTestId(),
                run.getError(),
                metrics,
                run.getRunId());
        if (updated > 0) return;
        jdbc.update(sql.getRuns().getInsert(),
                run.getRunId(),
                run.getModelFamily(),
                run.getTriggerReason().name(),
                run.getStatus().name(),
                stages,
                toTimestamp(run.getStartedAt()),
                toTimestamp(run.getFinishedAt()),
                run.getModelVersionId(),
                run.getAbTestId(),
                run.getError(),
                metrics);
    }

    @Override
    public Optional<PipelineRun> findById(String runId) {
        if (runId == null) return Optional.empty();
        List<PipelineRun> list = jdbc.query(sql.getRuns().getFindByRunId(), rowMapper, runId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<PipelineRun> findRecent(String modelFamily, int limit) {
        if (modelFamily == null) {
            return jdbc.query(sql.getRuns().getFindRecent(), rowMapper, limit);
        }
        return jdbc.query(sql.getRuns().getFindRecentByFamily(), rowMapper, modelFamily, limit);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise pipeline run", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type, T empty) {
        if (json == null || json.isBlank()) return empty;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt pipeline run column: " + e.getOriginalMessage(), e);
        }
    }
}
