package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.model.PageId;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.Severity;
import com.eainde.truckticket.model.SuggestedFix;
import com.eainde.truckticket.model.TruckTicket;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcReviewQueueRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-11-15T12:00:00Z");

    private EmbeddedDatabase db;
    private JdbcReviewQueueRepository repository;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = new JdbcReviewQueueRepository(new JdbcTemplate(db), mapper);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private static ReviewQueueEntry entry(String file, int page, ReviewReason reason, String run) {
        TruckTicket provisional = TruckTicket.builder()
                .ticketNumber("12345678")
                .ticketDate(LocalDate.of(2024, 10, 17))
                .vendorId(40L)
                .materialId(10L)
                .destinationId(30L)
                .fileId(file)
                .filePage(page)
                .manifestRequired(true)
                .reviewRequired(true)
                .confidence(0.88)
                .processingRunId(run)
                .build();
        return ReviewQueueEntry.builder()
                .pageId(new PageId(file, page))
                .reason(reason)
                .severity(reason.severity())
                .problems(List.of(
                        ReviewProblem.of(reason, "manifest_number", "Regulated load has no manifest number"),
                        ReviewProblem.of(ReviewReason.MISSING_SOURCE, "source", null)))
                .detectedFields(Map.of("vendor", "WASTE_MANAGEMENT_LEWISVILLE", "ticket_number", "12345678"))
                .suggestedFix(new SuggestedFix("Attach manifest", Map.of("days_apart", 15)))
                .provisionalTicket(provisional)
                .processingRunId(run)
                .createdAt(NOW)
                .build();
    }

    @Test
    @DisplayName("stores problems, fields, fix and provisional ticket as JSON and reads them back")
    void roundTrip() {
        ReviewQueueEntry saved = repository.save(entry("/scans/a.pdf", 2, ReviewReason.MISSING_MANIFEST, "run-1"));

        ReviewQueueEntry read = repository.findById(saved.id()).orElseThrow();

        assertThat(read.pageId()).isEqualTo(new PageId("/scans/a.pdf", 2));
        assertThat(read.reason()).isEqualTo(ReviewReason.MISSING_MANIFEST);
        assertThat(read.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(read.problems()).isEqualTo(saved.problems());
        assertThat(read.detectedFields()).isEqualTo(saved.detectedFields());
        assertThat(read.suggestedFix().action()).isEqualTo("Attach manifest");
        assertThat(read.suggestedFix().details()).containsEntry("days_apart", 15);
        assertThat(read.provisionalTicket()).isEqualTo(saved.provisionalTicket());
        assertThat(read.resolved()).isFalse();
        assertThat(read.createdAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("unresolved entries come most severe first, then by page")
    void unresolvedOrder() {
        repository.save(entry("/scans/b.pdf", 1, ReviewReason.DUPLICATE_TICKET, "run-1"));
        repository.save(entry("/scans/a.pdf", 3, ReviewReason.MISSING_MANIFEST, "run-1"));
        repository.save(entry("/scans/a.pdf", 1, ReviewReason.LOW_CONFIDENCE_OCR, "run-2"));

        assertThat(repository.findUnresolved())
                .extracting(e -> e.pageId().toString())
                .containsExactly("/scans/a.pdf#3", "/scans/a.pdf#1", "/scans/b.pdf#1");
        assertThat(repository.findByRun("run-1")).hasSize(2);
        assertThat(repository.countOpenByReason())
                .containsEntry(ReviewReason.DUPLICATE_TICKET, 1L)
                .containsEntry(ReviewReason.MISSING_MANIFEST, 1L)
                .containsEntry(ReviewReason.LOW_CONFIDENCE_OCR, 1L);
    }

    @Test
    @DisplayName("resolve closes an entry once")
    void resolve() {
        ReviewQueueEntry saved = repository.save(entry("/scans/a.pdf", 1, ReviewReason.MISSING_MANIFEST, "run-1"));

        ReviewQueueEntry resolved = repository.resolve(saved.id(), "jdoe", NOW.plusSeconds(60));

        assertThat(resolved.resolved()).isTrue();
        assertThat(resolved.resolvedBy()).isEqualTo("jdoe");
        assertThat(resolved.resolvedAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(repository.findUnresolved()).isEmpty();
        assertThat(repository.countOpenByReason()).isEmpty();
        assertThatThrownBy(() -> repository.resolve(saved.id(), "other", NOW))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jdoe");
        assertThatThrownBy(() -> repository.resolve(999L, "jdoe", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("deleteAll removes rolled back entries")
    void deleteAll() {
        ReviewQueueEntry a = repository.save(entry("/scans/a.pdf", 1, ReviewReason.MISSING_MANIFEST, "run-1"));
        ReviewQueueEntry b = repository.save(entry("/scans/a.pdf", 2, ReviewReason.MISSING_MANIFEST, "run-1"));

        assertThat(repository.deleteAll(List.of(a.id(), b.id()))).isEqualTo(2);
        assertThat(repository.findUnresolved()).isEmpty();
    }
}
