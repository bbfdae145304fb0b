package com.eainde.truckticket.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ledger entry for a file whose processing finished, keyed by content hash.
 *
 * @param ticketIds ids of the tickets committed from the file
 */
public record ProcessedFile(String fileHash, String fileId, List<Long> ticketIds, String requestGuid, Instant processedAt) {

    public ProcessedFile {
        Objects.requireNonNull(fileHash, "fileHash");
        Objects.requireNonNull(fileId, "fileId");
        ticketIds = ticketIds == null ? List.of() : List.copyOf(ticketIds);
    }
}
