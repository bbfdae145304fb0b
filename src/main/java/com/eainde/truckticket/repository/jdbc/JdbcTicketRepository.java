package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.exception.DuplicateTicketException;
import com.eainde.truckticket.model.QuantityUnit;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.repository.TicketRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Ticket store on the {@code truck_tickets} table. Uniqueness of
 * (ticket_number, vendor_id, ticket_date) is enforced by the database.
 */
@Slf4j
public class JdbcTicketRepository implements TicketRepository {

    private static final String COLUMNS = """
            id, ticket_number, ticket_date, quantity, quantity_unit, job_id, material_id, source_id,
            destination_id, vendor_id, ticket_type_id, manifest_number, truck_number, file_id, file_page,
            file_hash, duplicate_of, manifest_required, review_required, confidence, processing_run_id, created_at
            """;

    private static final RowMapper<TruckTicket> ROW_MAPPER = JdbcTicketRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate named;

    public JdbcTicketRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.named = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public TruckTicket commit(TruckTicket ticket) {
        TicketRepository.requireCommittable(ticket);
        Instant createdAt = ticket.createdAt() == null ? Instant.now() : ticket.createdAt();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ticketNumber", ticket.ticketNumber())
                .addValue("ticketDate", ticket.ticketDate())
                .addValue("quantity", ticket.quantity())
                .addValue("quantityUnit", ticket.quantityUnit() == null ? null : ticket.quantityUnit().name())
                .addValue("jobId", ticket.jobId())
                .addValue("materialId", ticket.materialId())
                .addValue("sourceId", ticket.sourceId())
                .addValue("destinationId", ticket.destinationId())
                .addValue("vendorId", ticket.vendorId())
                .addValue("ticketTypeId", ticket.ticketTypeId())
                .addValue("manifestNumber", ticket.manifestNumber())
                .addValue("truckNumber", ticket.truckNumber())
                .addValue("fileId", ticket.fileId())
                .addValue("filePage", ticket.filePage())
                .addValue("fileHash", ticket.fileHash())
                .addValue("duplicateOf", ticket.duplicateOf())
                .addValue("manifestRequired", ticket.manifestRequired())
                .addValue("reviewRequired", false)
                .addValue("confidence", ticket.confidence())
                .addValue("runId", ticket.processingRunId())
                .addValue("createdAt", Timestamp.from(createdAt));

        KeyHolder keys = new GeneratedKeyHolder();
        try {
            named.update("""
                    INSERT INTO truck_tickets
                        (ticket_number, ticket_date, quantity, quantity_unit, job_id, material_id, source_id,
                         destination_id, vendor_id, ticket_type_id, manifest_number, truck_number, file_id,
                         file_page, file_hash, duplicate_of, manifest_required, review_required, confidence,
                         processing_run_id, created_at)
                    VALUES
                        (:ticketNumber, :ticketDate, :quantity, :quantityUnit, :jobId, :materialId, :sourceId,
                         :destinationId, :vendorId, :ticketTypeId, :manifestNumber, :truckNumber, :fileId,
                         :filePage, :fileHash, :duplicateOf, :manifestRequired, :reviewRequired, :confidence,
                         :runId, :createdAt)
                    """, params, keys, new String[]{"id"});
        } catch (DuplicateKeyException e) {
            Long existing = jdbcTemplate.query(
                    "SELECT id FROM truck_tickets WHERE ticket_number = ? AND vendor_id = ? AND ticket_date = ?",
                    rs -> rs.next() ? rs.getLong(1) : null,
                    ticket.ticketNumber(), ticket.vendorId(), ticket.ticketDate());
            throw new DuplicateTicketException(ticket.ticketNumber(), ticket.vendorId(), existing, e);
        }

        Number id = keys.getKey();
        if (id == null) {
            throw new IllegalStateException("No id generated for ticket " + ticket.pageId());
        }
        return ticket.toBuilder().id(id.longValue()).reviewRequired(false).createdAt(createdAt).build();
    }

    @Override
    public Optional<TruckTicket> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM truck_tickets WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    @Override
    public Optional<TruckTicket> findEarliestInWindow(String ticketNumber, long vendorId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query("SELECT " + COLUMNS + """
                        FROM truck_tickets
                        WHERE ticket_number = ? AND vendor_id = ?
                          AND ticket_date BETWEEN ? AND ?
                          AND duplicate_of IS NULL
                        ORDER BY ticket_date, id
                        """, ROW_MAPPER, ticketNumber, vendorId, from, to)
                .stream().findFirst();
    }

    @Override
    public Optional<TruckTicket> findByManifest(String manifestNumber, long vendorId, LocalDate ticketDate) {
        return jdbcTemplate.query("SELECT " + COLUMNS + """
                        FROM truck_tickets
                        WHERE UPPER(manifest_number) = UPPER(?) AND vendor_id = ? AND ticket_date = ?
                        ORDER BY id
                        """, ROW_MAPPER, manifestNumber, vendorId, ticketDate)
                .stream().findFirst();
    }

    @Override
    public List<TruckTicket> findByFileHash(String fileHash) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM truck_tickets WHERE file_hash = ? ORDER BY file_page, id",
                ROW_MAPPER, fileHash);
    }

    @Override
    public int deleteAll(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        int removed = named.update("DELETE FROM truck_tickets WHERE id IN (:ids)", new MapSqlParameterSource("ids", ids));
        log.info("Rolled back {} tickets", removed);
        return removed;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM truck_tickets", Long.class);
        return count == null ? 0 : count;
    }

    private static TruckTicket mapRow(ResultSet rs, int rowNum) throws SQLException {
        String unit = rs.getString("quantity_unit");
        Timestamp created = rs.getTimestamp("created_at");
        return TruckTicket.builder()
                .id(rs.getLong("id"))
                .ticketNumber(rs.getString("ticket_number"))
                .ticketDate(rs.getObject("ticket_date", LocalDate.class))
                .quantity(rs.getBigDecimal("quantity"))
                .quantityUnit(unit == null ? null : QuantityUnit.valueOf(unit))
                .jobId(rs.getObject("job_id", Long.class))
                .materialId(rs.getObject("material_id", Long.class))
                .sourceId(rs.getObject("source_id", Long.class))
                .destinationId(rs.getObject("destination_id", Long.class))
                .vendorId(rs.getObject("vendor_id", Long.class))
                .ticketTypeId(rs.getObject("ticket_type_id", Long.class))
                .manifestNumber(rs.getString("manifest_number"))
                .truckNumber(rs.getString("truck_number"))
                .fileId(rs.getString("file_id"))
                .filePage(rs.getInt("file_page"))
                .fileHash(rs.getString("file_hash"))
                .duplicateOf(rs.getObject("duplicate_of", Long.class))
                .manifestRequired(rs.getBoolean("manifest_required"))
                .reviewRequired(rs.getBoolean("review_required"))
                .confidence(rs.getDouble("confidence"))
                .processingRunId(rs.getString("processing_run_id"))
                .createdAt(created == null ? null : created.toInstant())
                .build();
    }
}
