package com.eainde.truckticket.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Ledger record of one batch invocation. Counters only grow while the run is
 * {@link RunStatus#IN_PROGRESS}; once sealed the record no longer changes.
 */
public record ProcessingRun(
        String requestGuid,
        Instant startedAt,
        Instant completedAt,
        int filesCount,
        int pagesCount,
        int okCount,
        int errorCount,
        int reviewCount,
        int duplicatesFound,
        RunStatus status,
        String processedBy,
        Map<String, Object> configSnapshot
) {
    public ProcessingRun {
        Objects.requireNonNull(requestGuid, "requestGuid");
        Objects.requireNonNull(status, "status");
        configSnapshot = configSnapshot == null ? Map.of() : Map.copyOf(configSnapshot);
    }

    public static ProcessingRun inProgress(String requestGuid, int filesCount, String processedBy,
                                           Map<String, Object> configSnapshot, Instant startedAt) {
        return new ProcessingRun(requestGuid, startedAt, null, filesCount, 0, 0, 0, 0, 0,
                RunStatus.IN_PROGRESS, processedBy, configSnapshot);
    }

    /**
     * Adds the outcome of one finished file to the running totals.
     */
    public ProcessingRun plus(int pages, int ok, int errors, int reviews, int duplicates) {
        requireOpen();
        return new ProcessingRun(requestGuid, startedAt, null, filesCount,
                pagesCount + pages, okCount + ok, errorCount + errors, reviewCount + reviews,
                duplicatesFound + duplicates, status, processedBy, configSnapshot);
    }

    public ProcessingRun seal(RunStatus finalStatus, Instant completedAt) {
        requireOpen();
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Cannot seal a run as " + finalStatus);
        }
        return new ProcessingRun(requestGuid, startedAt, completedAt, filesCount, pagesCount,
                okCount, errorCount, reviewCount, duplicatesFound, finalStatus, processedBy, configSnapshot);
    }

    public boolean isSealed() {
        return status.isTerminal();
    }

    private void requireOpen() {
        if (isSealed()) {
            throw new IllegalStateException("Processing run " + requestGuid + " is already sealed as " + status);
        }
    }
}
