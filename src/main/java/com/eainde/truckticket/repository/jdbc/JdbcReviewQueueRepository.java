package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.model.PageId;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.Severity;
import com.eainde.truckticket.model.SuggestedFix;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.repository.ReviewQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Review queue on the {@code review_queue} table; problems, detected fields, suggested fix
 * and the provisional ticket are stored as JSON.
 */
public class JdbcReviewQueueRepository implements ReviewQueueRepository {

    private static final String SELECT = """
            SELECT id, file_id, page_number, reason, severity, problems, detected_fields, suggested_fix,
                   provisional_ticket, processing_run_id, resolved, resolved_by, resolved_at, created_at
            FROM review_queue
            """;

    private static final String SEVERITY_ORDER =
            "CASE severity WHEN 'CRITICAL' THEN 0 WHEN 'WARNING' THEN 1 ELSE 2 END";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate named;
    private final ObjectMapper objectMapper;

    public JdbcReviewQueueRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.named = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.objectMapper = objectMapper;
    }

    @Override
    public ReviewQueueEntry save(ReviewQueueEntry entry) {
        if (entry.id() != null) {
            throw new IllegalArgumentException("Entry already saved as #" + entry.id());
        }
        Instant createdAt = entry.createdAt() == null ? Instant.now() : entry.createdAt();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("fileId", entry.pageId().fileId())
                .addValue("page", entry.pageId().pageNumber())
                .addValue("reason", entry.reason().name())
                .addValue("severity", entry.severity().name())
                .addValue("problems", toJson(entry.problems()))
                .addValue("fields", toJson(entry.detectedFields()))
                .addValue("fix", entry.suggestedFix() == null ? null : toJson(entry.suggestedFix()))
                .addValue("ticket", entry.provisionalTicket() == null ? null : toJson(entry.provisionalTicket()))
                .addValue("runId", entry.processingRunId())
                .addValue("createdAt", Timestamp.from(createdAt));
        KeyHolder keys = new GeneratedKeyHolder();
        named.update("""
                INSERT INTO review_queue
                    (file_id, page_number, reason, severity, problems, detected_fields, suggested_fix,
                     provisional_ticket, processing_run_id, resolved, created_at)
                VALUES (:fileId, :page, :reason, :severity, :problems, :fields, :fix, :ticket, :runId, FALSE, :createdAt)
                """, params, keys, new String[]{"id"});
        Number id = keys.getKey();
        if (id == null) {
            throw new IllegalStateException("No id generated for review entry " + entry.pageId());
        }
        return entry.toBuilder().id(id.longValue()).createdAt(createdAt).build();
    }

    @Override
    public Optional<ReviewQueueEntry> findById(long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", this::mapRow, id).stream().findFirst();
    }

    @Override
    public List<ReviewQueueEntry> findUnresolved() {
        return jdbcTemplate.query(SELECT + " WHERE resolved = FALSE ORDER BY " + SEVERITY_ORDER + ", file_id, page_number",
                this::mapRow);
    }

    @Override
    public List<ReviewQueueEntry> findByRun(String requestGuid) {
        return jdbcTemplate.query(SELECT + " WHERE processing_run_id = ? ORDER BY file_id, page_number",
                this::mapRow, requestGuid);
    }

    @Override
    public ReviewQueueEntry resolve(long id, String resolvedBy, Instant resolvedAt) {
        int rows = jdbcTemplate.update("""
                UPDATE review_queue
                SET resolved = TRUE, resolved_by = ?, resolved_at = ?
                WHERE id = ? AND resolved = FALSE
                """, resolvedBy, Timestamp.from(resolvedAt), id);
        ReviewQueueEntry entry = findById(id)
                .orElseThrow(() -> new IllegalArgumentException("No review entry #" + id));
        if (rows == 0) {
            throw new IllegalStateException("Review entry #" + id + " already resolved by " + entry.resolvedBy());
        }
        return entry;
    }

    @Override
    public int deleteAll(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return named.update("DELETE FROM review_queue WHERE id IN (:ids)", new MapSqlParameterSource("ids", ids));
    }

    @Override
    public Map<ReviewReason, Long> countOpenByReason() {
        Map<ReviewReason, Long> counts = new EnumMap<>(ReviewReason.class);
        jdbcTemplate.query("SELECT reason, COUNT(*) AS n FROM review_queue WHERE resolved = FALSE GROUP BY reason",
                rs -> {
                    counts.put(ReviewReason.valueOf(rs.getString("reason")), rs.getLong("n"));
                });
        return counts;
    }

    private ReviewQueueEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp resolvedAt = rs.getTimestamp("resolved_at");
        Timestamp createdAt = rs.getTimestamp("created_at");
        String fix = rs.getString("suggested_fix");
        String ticket = rs.getString("provisional_ticket");
        return ReviewQueueEntry.builder()
                .id(rs.getLong("id"))
                .pageId(new PageId(rs.getString("file_id"), rs.getInt("page_number")))
                .reason(ReviewReason.valueOf(rs.getString("reason")))
                .severity(Severity.valueOf(rs.getString("severity")))
                .problems(fromJson(rs.getString("problems"), new TypeReference<List<ReviewProblem>>() {}))
                .detectedFields(fromJson(rs.getString("detected_fields"), new TypeReference<Map<String, String>>() {}))
                .suggestedFix(fix == null ? null : fromJson(fix, new TypeReference<SuggestedFix>() {}))
                .provisionalTicket(ticket == null ? null : fromJson(ticket, new TypeReference<TruckTicket>() {}))
                .processingRunId(rs.getString("processing_run_id"))
                .resolved(rs.getBoolean("resolved"))
                .resolvedBy(rs.getString("resolved_by"))
                .resolvedAt(resolvedAt == null ? null : resolvedAt.toInstant())
                .createdAt(createdAt == null ? null : createdAt.toInstant())
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize review entry column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize review entry column", e);
        }
    }
}
