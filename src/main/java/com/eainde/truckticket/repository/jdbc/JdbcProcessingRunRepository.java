package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.model.ProcessingRun;
import com.eainde.truckticket.model.RunStatus;
import com.eainde.truckticket.repository.ProcessingRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Processing-run ledger on the {@code processing_runs} table. Updates only touch rows that
 * are still IN_PROGRESS, so a sealed run cannot be rewritten.
 */
public class JdbcProcessingRunRepository implements ProcessingRunRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcProcessingRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(ProcessingRun run) {
        jdbcTemplate.update("""
                INSERT INTO processing_runs
                    (request_guid, started_at, completed_at, files_count, pages_count, ok_count, error_count,
                     review_count, duplicates_found, status, processed_by, config_snapshot)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.requestGuid(), timestamp(run.startedAt()), timestamp(run.completedAt()), run.filesCount(),
                run.pagesCount(), run.okCount(), run.errorCount(), run.reviewCount(), run.duplicatesFound(),
                run.status().name(), run.processedBy(), serialize(run.configSnapshot()));
    }

    @Override
    public void update(ProcessingRun run) {
        int rows = jdbcTemplate.update("""
                UPDATE processing_runs
                SET completed_at = ?, pages_count = ?, ok_count = ?, error_count = ?, review_count = ?,
                    duplicates_found = ?, status = ?
                WHERE request_guid = ? AND status = 'IN_PROGRESS'
                """,
                timestamp(run.completedAt()), run.pagesCount(), run.okCount(), run.errorCount(),
                run.reviewCount(), run.duplicatesFound(), run.status().name(), run.requestGuid());
        if (rows == 0) {
            throw new IllegalStateException("Processing run " + run.requestGuid() + " is unknown or already sealed");
        }
    }

    @Override
    public Optional<ProcessingRun> find(String requestGuid) {
        return jdbcTemplate.query("""
                SELECT request_guid, started_at, completed_at, files_count, pages_count, ok_count, error_count,
                       review_count, duplicates_found, status, processed_by, config_snapshot
                FROM processing_runs
                WHERE request_guid = ?
                """, this::mapRow, requestGuid).stream().findFirst();
    }

    private ProcessingRun mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new ProcessingRun(
                rs.getString("request_guid"),
                instant(rs.getTimestamp("started_at")),
                instant(rs.getTimestamp("completed_at")),
                rs.getInt("files_count"),
                rs.getInt("pages_count"),
                rs.getInt("ok_count"),
                rs.getInt("error_count"),
                rs.getInt("review_count"),
                rs.getInt("duplicates_found"),
                RunStatus.valueOf(rs.getString("status")),
                rs.getString("processed_by"),
                deserialize(rs.getString("config_snapshot")));
    }

    private String serialize(Map<String, Object> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize config snapshot", e);
        }
    }

    private Map<String, Object> deserialize(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize config snapshot", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
