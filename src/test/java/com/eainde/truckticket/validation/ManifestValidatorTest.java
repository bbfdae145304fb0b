package com.eainde.truckticket.validation;

import com.eainde.truckticket.model.ManifestNumbers;
import com.eainde.truckticket.model.ReferenceCategory;
import com.eainde.truckticket.model.ReferenceEntity;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.Severity;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.repository.memory.InMemoryTicketRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestValidatorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 10, 17);

    private static final ReferenceEntity CONTAMINATED =
            new ReferenceEntity(10, ReferenceCategory.MATERIAL, "CLASS_2_CONTAMINATED", true);
    private static final ReferenceEntity CLEAN = ReferenceEntity.of(11, ReferenceCategory.MATERIAL, "NON_CONTAMINATED");
    private static final ReferenceEntity ROCK = ReferenceEntity.of(12, ReferenceCategory.MATERIAL, "ROCK");
    private static final ReferenceEntity LANDFILL =
            new ReferenceEntity(30, ReferenceCategory.DESTINATION, "WASTE_MANAGEMENT_LEWISVILLE", true);
    private static final ReferenceEntity YARD = ReferenceEntity.of(31, ReferenceCategory.DESTINATION, "LDI_YARD");

    private final InMemoryTicketRepository tickets = new InMemoryTicketRepository();
    private final ManifestValidator validator = new ManifestValidator(tickets);

    private static TruckTicket.TruckTicketBuilder ticket(String number) {
        return TruckTicket.builder()
                .ticketNumber(number)
                .ticketDate(DATE)
                .vendorId(40L)
                .fileId("scan.pdf")
                .filePage(1)
                .confidence(0.9);
    }

    @Nested
    @DisplayName("when a manifest is required")
    class Requirement {

        @Test
        @DisplayName("regulated materials always need one")
        void regulatedMaterial() {
            assertThat(ManifestValidator.requiresManifest(CONTAMINATED, YARD)).isTrue();
            assertThat(ManifestValidator.requiresManifest(CONTAMINATED, null)).isTrue();
        }

        @Test
        @DisplayName("a regulated destination needs one unless the material is clean")
        void regulatedDestination() {
            assertThat(ManifestValidator.requiresManifest(ROCK, LANDFILL)).isTrue();
            assertThat(ManifestValidator.requiresManifest(CLEAN, LANDFILL)).isFalse();
            assertThat(ManifestValidator.requiresManifest(ROCK, YARD)).isFalse();
        }

        @Test
        @DisplayName("an unresolved material is treated as regulated")
        void unresolvedMaterial() {
            assertThat(ManifestValidator.requiresManifest(null, YARD)).isTrue();
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("a required but absent manifest is CRITICAL")
        void missing() {
            List<ReviewProblem> problems = validator.validate(
                    ticket("1001").manifestRequired(true).reviewRequired(true).build());

            assertThat(problems).singleElement().satisfies(p -> {
                assertThat(p.reason()).isEqualTo(ReviewReason.MISSING_MANIFEST);
                assertThat(p.severity()).isEqualTo(Severity.CRITICAL);
                assertThat(p.detail()).contains("no manifest");
            });
        }

        @Test
        @DisplayName("a malformed manifest counts as missing")
        void malformed() {
            List<ReviewProblem> problems = validator.validate(
                    ticket("1001").manifestRequired(true).reviewRequired(true).manifestNumber("WM 12").build());

            assertThat(problems).extracting(ReviewProblem::reason).containsExactly(ReviewReason.MISSING_MANIFEST);
            assertThat(problems.get(0).detail()).contains("'WM 12'");
        }

        @Test
        @DisplayName("an optional manifest may be absent")
        void optional() {
            assertThat(validator.validate(ticket("1001").build())).isEmpty();
        }

        @Test
        @DisplayName("a manifest reused by another ticket of the vendor that day is a WARNING")
        void reused() {
            TruckTicket first = tickets.commit(ticket("1001").manifestNumber("WM-123456").build());

            List<ReviewProblem> problems = validator.validate(ticket("1002").manifestNumber("wm-123456").build());

            assertThat(problems).singleElement().satisfies(p -> {
                assertThat(p.reason()).isEqualTo(ReviewReason.DUPLICATE_MANIFEST);
                assertThat(p.severity()).isEqualTo(Severity.WARNING);
                assertThat(p.detail()).contains("1001").contains("#" + first.id());
            });
            assertThat(validator.validate(ticket("1001").manifestNumber("WM-123456").build())).isEmpty();
            assertThat(validator.validate(ticket("1003").manifestNumber("WM-123456").vendorId(41L).build())).isEmpty();
            assertThat(validator.validate(ticket("1004").manifestNumber("WM-123456").ticketDate(DATE.plusDays(1)).build())).isEmpty();
        }
    }

    @Test
    @DisplayName("an unflagged ticket cannot lack a required manifest")
    void ticketInvariant() {
        assertThatThrownBy(() -> ticket("1001").manifestRequired(true).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires a manifest");
    }

    @ParameterizedTest
    @ValueSource(strings = {"123456", "WM-123456", "WM-MAN-2024-001234", "abc123def", "A1B2C3D4E5F6G7H8I9J0"})
    void wellFormed(String manifest) {
        assertThat(ManifestNumbers.isWellFormed(manifest)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "12345", "WM--123456", "-123456", "WM 123456", "A1B2C3D4E5F6G7H8I9J0K", "WM_123456"})
    void malformed(String manifest) {
        assertThat(ManifestNumbers.isWellFormed(manifest)).isFalse();
    }
}
