package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.exception.DuplicateTicketException;
import com.eainde.truckticket.model.QuantityUnit;
import com.eainde.truckticket.model.TruckTicket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcTicketRepositoryTest {

    private static final String HASH = "a".repeat(64);

    private EmbeddedDatabase db;
    private JdbcTicketRepository repository;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        repository = new JdbcTicketRepository(new JdbcTemplate(db));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    static TruckTicket ticket(String number, long vendorId, LocalDate date) {
        return TruckTicket.builder()
                .ticketNumber(number)
                .ticketDate(date)
                .quantity(new BigDecimal("18.50"))
                .quantityUnit(QuantityUnit.TONS)
                .jobId(1L)
                .materialId(11L)
                .vendorId(vendorId)
                .ticketTypeId(51L)
                .fileId("/scans/24-105.pdf")
                .filePage(1)
                .fileHash(HASH)
                .confidence(0.9)
                .processingRunId("run-1")
                .createdAt(Instant.parse("2024-11-15T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("commit assigns an id and the row reads back unchanged")
    void commitAndRead() {
        TruckTicket stored = repository.commit(ticket("12345678", 41L, LocalDate.of(2024, 10, 17)));

        assertThat(stored.id()).isNotNull();
        TruckTicket read = repository.findById(stored.id()).orElseThrow();
        assertThat(read).isEqualTo(stored);
        assertThat(read.quantity()).isEqualByComparingTo("18.5");
        assertThat(read.sourceId()).isNull();
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("the database rejects a second ticket with the same number, vendor and date")
    void uniqueness() {
        TruckTicket first = repository.commit(ticket("12345678", 41L, LocalDate.of(2024, 10, 17)));

        assertThatThrownBy(() -> repository.commit(ticket("12345678", 41L, LocalDate.of(2024, 10, 17))))
                .isInstanceOfSatisfying(DuplicateTicketException.class,
                        e -> assertThat(e.getExistingTicketId()).isEqualTo(first.id()));

        repository.commit(ticket("12345678", 42L, LocalDate.of(2024, 10, 17)));
        repository.commit(ticket("12345678", 41L, LocalDate.of(2024, 10, 18)));
        assertThat(repository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("refuses tickets still flagged for review")
    void refusesFlagged() {
        TruckTicket flagged = ticket("12345678", 41L, LocalDate.of(2024, 10, 17)).toBuilder().reviewRequired(true).build();

        assertThatThrownBy(() -> repository.commit(flagged)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("window lookup returns the earliest original inside the range")
    void earliestInWindow() {
        TruckTicket early = repository.commit(ticket("555001", 41L, LocalDate.of(2024, 9, 1)));
        TruckTicket later = repository.commit(ticket("555001", 41L, LocalDate.of(2024, 10, 1)));
        repository.commit(ticket("555001", 41L, LocalDate.of(2024, 10, 2)).toBuilder().duplicateOf(later.id()).build());

        assertThat(repository.findEarliestInWindow("555001", 41L, LocalDate.of(2024, 8, 1), LocalDate.of(2024, 12, 1)))
                .map(TruckTicket::id).contains(early.id());
        assertThat(repository.findEarliestInWindow("555001", 41L, LocalDate.of(2024, 9, 15), LocalDate.of(2024, 12, 1)))
                .map(TruckTicket::id).contains(later.id());
        assertThat(repository.findEarliestInWindow("555001", 42L, LocalDate.of(2024, 8, 1), LocalDate.of(2024, 12, 1)))
                .isEmpty();
    }

    @Test
    @DisplayName("manifest lookup is per vendor and day, ignoring case")
    void byManifest() {
        TruckTicket stored = repository.commit(ticket("555002", 40L, LocalDate.of(2024, 10, 1)).toBuilder()
                .manifestNumber("WM-123456").manifestRequired(true).build());

        assertThat(repository.findByManifest("wm-123456", 40L, LocalDate.of(2024, 10, 1)))
                .map(TruckTicket::id).contains(stored.id());
        assertThat(repository.findByManifest("WM-123456", 40L, LocalDate.of(2024, 10, 2))).isEmpty();
    }

    @Test
    @DisplayName("deleteAll removes only the given ids")
    void deleteAll() {
        TruckTicket a = repository.commit(ticket("1001", 41L, LocalDate.of(2024, 10, 1)));
        TruckTicket b = repository.commit(ticket("1002", 41L, LocalDate.of(2024, 10, 1)));

        assertThat(repository.deleteAll(List.of(a.id()))).isEqualTo(1);
        assertThat(repository.deleteAll(List.of())).isZero();
        assertThat(repository.findById(a.id())).isEmpty();
        assertThat(repository.findByFileHash(HASH)).extracting(TruckTicket::id).containsExactly(b.id());
    }
}
