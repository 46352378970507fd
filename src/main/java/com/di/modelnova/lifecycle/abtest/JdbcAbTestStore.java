package com.di.modelnova.lifecycle.abtest;

import com.di.modelnova.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * JDBC A/B test store (table {@code ab_tests}). Arm counters are kept as JSON text.
 * <p>
 * {@link #update} is optimistic: every row carries a revision, and a write that lost the race against a
 * concurrent one re-reads the row and applies the change again.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "true")
public class JdbcAbTestStore implements AbTestStore {

    static final int MAX_UPDATE_ATTEMPTS = 100;

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<StoredTest> rowMapper;

    public JdbcAbTestStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> new StoredTest(AbTest.builder()
                .testId(rs.getString("test_id"))
                .label(rs.getString("label"))
                .controlVersionId(rs.getString("control_version_id"))
                .treatmentVersionId(rs.getString("treatment_version_id"))
                .trafficFraction(rs.getDouble("traffic_fraction"))
                .metric(rs.getString("metric"))
                .status(AbTestStatus.valueOf(rs.getString("status")))
                .control(readStats(rs.getString("control_json")))
                .treatment(readStats(rs.getString("treatment_json")))
                .winner(rs.getString("winner") != null ? Arm.valueOf(rs.getString("winner")) : null)
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build(),
                rs.getLong("revision"));
    }

    @Override
    public void save(AbTest test) {
        if (test == null || test.getTestId() == null) return;
        int updated = jdbc.update(sql.getAbTests().getOverwrite(),
                test.getLabel(),
                test.getTrafficFraction(),
                test.getMetric(),
                test.getStatus().name(),
                writeStats(test.getControl()),
                writeStats(test.getTreatment()),
                test.getWinner() != null ? test.getWinner().name() : null,
                toTimestamp(test.getCompletedAt()),
                test.getTestId());
        if (updated > 0) return;
        jdbc.update(sql.getAbTests().getInsert(),
                test.getTestId(),
                test.getLabel(),
                test.getControlVersionId(),
                test.getTreatmentVersionId(),
                test.getTrafficFraction(),
                test.getMetric(),
                test.getStatus().name(),
                writeStats(test.getControl()),
                writeStats(test.getTreatment()),
                test.getWinner() != null ? test.getWinner().name() : null,
                Timestamp.from(test.getCreatedAt() != null ? test.getCreatedAt() : Instant.now()),
                toTimestamp(test.getCompletedAt()));
    }

    @Override
    public Optional<AbTest> findById(String testId) {
        return findStored(testId).map(StoredTest::getTest);
    }

    @Override
    public Optional<AbTest> update(String testId, UnaryOperator<AbTest> change) {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Optional<StoredTest> stored = findStored(testId);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            AbTest next = change.apply(stored.get().getTest());
            int updated = jdbc.update(sql.getAbTests().getUpdate(),
                    next.getLabel(),
                    next.getTrafficFraction(),
                    next.getMetric(),
                    next.getStatus().name(),
                    writeStats(next.getControl()),
                    writeStats(next.getTreatment()),
                    next.getWinner() != null ? next.getWinner().name() : null,
                    toTimestamp(next.getCompletedAt()),
                    testId,
                    stored.get().getRevision());
            if (updated > 0) {
                return Optional.of(next);
            }
            log.debug("[ABTEST] Concurrent update of {} (attempt {}), retrying", testId, attempt);
        }
        throw new IllegalStateException("A/B test " + testId + " kept changing; gave up after "
                + MAX_UPDATE_ATTEMPTS + " attempts");
    }

    @Override
    public List<AbTest> findByStatus(AbTestStatus status) {
        return unwrap(jdbc.query(sql.getAbTests().getFindByStatus(), rowMapper, status.name()));
    }

    @Override
    public List<AbTest> findRecent(int limit) {
        return unwrap(jdbc.query(sql.getAbTests().getFindRecent(), rowMapper, limit));
    }

    private Optional<StoredTest> findStored(String testId) {
        if (testId == null) return Optional.empty();
        List<StoredTest> list = jdbc.query(sql.getAbTests().getFindById(), rowMapper, testId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    private static List<AbTest> unwrap(List<StoredTest> rows) {
        return rows.stream().map(StoredTest::getTest).collect(Collectors.toList());
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    private String writeStats(ArmStats stats) {
        try {
            return objectMapper.writeValueAsString(stats != null ? stats : ArmStats.EMPTY);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise arm stats", e);
        }
    }

    private ArmStats readStats(String json) {
        if (json == null || json.isBlank()) return ArmStats.EMPTY;
        try {
            return objectMapper.readValue(json, ArmStats.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt arm stats: " + e.getOriginalMessage(), e);
        }
    }

    @Value
    private static class StoredTest {
        AbTest test;
        long revision;
    }
}
