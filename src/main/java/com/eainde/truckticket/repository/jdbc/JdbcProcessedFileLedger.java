package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.model.ProcessedFile;
import com.eainde.truckticket.repository.ProcessedFileLedger;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class JdbcProcessedFileLedger implements ProcessedFileLedger {

    private final JdbcTemplate jdbcTemplate;

    public JdbcProcessedFileLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ProcessedFile> find(String fileHash) {
        return jdbcTemplate.query("""
                SELECT file_hash, file_id, ticket_ids, request_guid, processed_at
                FROM processed_files
                WHERE file_hash = ?
                """, (rs, rowNum) -> new ProcessedFile(
                        rs.getString("file_hash"),
                        rs.getString("file_id"),
                        parseIds(rs.getString("ticket_ids")),
                        rs.getString("request_guid"),
                        rs.getTimestamp("processed_at").toInstant()),
                fileHash).stream().findFirst();
    }

    @Override
    public boolean recordIfAbsent(ProcessedFile file) {
        try {
            jdbcTemplate.update("""
                    INSERT INTO processed_files (file_hash, file_id, ticket_ids, request_guid, processed_at)
                    VALUES (?, ?, ?, ?, ?)
                    """,
                    file.fileHash(), file.fileId(),
                    file.ticketIds().stream().map(String::valueOf).collect(Collectors.joining(",")),
                    file.requestGuid(), Timestamp.from(file.processedAt()));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    private static List<Long> parseIds(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(",")).map(String::trim).map(Long::valueOf).toList();
    }
}
