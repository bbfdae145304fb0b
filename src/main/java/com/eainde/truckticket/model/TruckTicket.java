package com.eainde.truckticket.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One hauling transaction read from a scanned ticket page.
 *
 * <p>A ticket is built by the ticket processor, may be flagged during validation
 * ({@code duplicateOf}, {@code reviewRequired}) through {@link #toBuilder()}, and is
 * immutable once the repository assigns its {@code id}.</p>
 *
 * <p>The constructor enforces the manifest rule: a ticket whose material or destination
 * requires a manifest can only exist unflagged when it carries a well-formed manifest
 * number.</p>
 */
@Builder(toBuilder = true)
public record TruckTicket(
        Long id,
        String ticketNumber,
        LocalDate ticketDate,
        BigDecimal quantity,
        QuantityUnit quantityUnit,
        Long jobId,
        Long materialId,
        Long sourceId,
        Long destinationId,
        Long vendorId,
        Long ticketTypeId,
        String manifestNumber,
        String truckNumber,
        String fileId,
        int filePage,
        String fileHash,
        Long duplicateOf,
        boolean manifestRequired,
        boolean reviewRequired,
        double confidence,
        String processingRunId,
        Instant createdAt
) {

    public TruckTicket {
        Objects.requireNonNull(fileId, "fileId");
        if (fileHash != null && fileHash.length() != 64) {
            throw new IllegalArgumentException("fileHash must be a 64 character SHA-256 hex digest");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        if (manifestRequired && !reviewRequired && !ManifestNumbers.isWellFormed(manifestNumber)) {
            throw new IllegalStateException("Ticket " + ticketNumber + " on " + fileId + "#" + filePage
                    + " requires a manifest but has none and is not flagged for review");
        }
    }

    @JsonIgnore
    public PageId pageId() {
        return new PageId(fileId, filePage);
    }

    @JsonIgnore
    public boolean isCommitted() {
        return id != null;
    }

    /**
     * Short human readable form used in review entries for side-by-side comparison.
     */
    public String summary() {
        return String.format("#%s ticket=%s vendor=%s date=%s qty=%s %s manifest=%s file=%s page=%d",
                id == null ? "-" : id, ticketNumber, vendorId, ticketDate,
                quantity, quantityUnit == null ? "" : quantityUnit, manifestNumber, fileId, filePage);
    }
}
