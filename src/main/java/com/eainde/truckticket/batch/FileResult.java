package com.eainde.truckticket.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-file result of a batch: counts on success, an error message on failure.
 */
public class FileResult {

    private final Path file;
    private final FileStatus status;
    private final int attempts;
    private final int pages;
    private final int committed;
    private final int queued;
    private final int duplicates;
    private final List<Long> ticketIds;
    private final String errorMessage;

    private FileResult(Path file, FileStatus status, int attempts, int pages, int committed, int queued,
                       int duplicates, List<Long> ticketIds, String errorMessage) {
        this.file = file;
        this.status = status;
        this.attempts = attempts;
        this.pages = pages;
        this.committed = committed;
        this.queued = queued;
        this.duplicates = duplicates;
        this.ticketIds = ticketIds == null ? List.of() : List.copyOf(ticketIds);
        this.errorMessage = errorMessage;
    }

    public static FileResult ok(Path file, int attempts, int pages, int committed, int queued, int duplicates,
                                List<Long> ticketIds) {
        return new FileResult(file, FileStatus.OK, attempts, pages, committed, queued, duplicates, ticketIds, null);
    }

    public static FileResult alreadyProcessed(Path file, List<Long> originalTicketIds) {
        return new FileResult(file, FileStatus.ALREADY_PROCESSED, 1, 0, 0, 0, 0, originalTicketIds, null);
    }

    public static FileResult error(Path file, int attempts, String errorMessage) {
        return new FileResult(file, FileStatus.ERROR, attempts, 0, 0, 0, 0, List.of(), errorMessage);
    }

    public static FileResult skipped(Path file) {
        return new FileResult(file, FileStatus.SKIPPED, 0, 0, 0, 0, 0, List.of(), null);
    }

    public static FileResult cancelled(Path file, int attempts) {
        return new FileResult(file, FileStatus.CANCELLED, attempts, 0, 0, 0, 0, List.of(), null);
    }

    public Path getFile() {
        return file;
    }

    public FileStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == FileStatus.OK || status == FileStatus.ALREADY_PROCESSED;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getPages() {
        return pages;
    }

    public int getCommitted() {
        return committed;
    }

    public int getQueued() {
        return queued;
    }

    public int getDuplicates() {
        return duplicates;
    }

    /** Tickets committed from this file; for ALREADY_PROCESSED, those of the first run. */
    public List<Long> getTicketIds() {
        return ticketIds;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess() || errorMessage == null
                ? String.format("%s %s (pages=%d, committed=%d, queued=%d)", status, file, pages, committed, queued)
                : String.format("%s %s after %d attempts: %s", status, file, attempts, errorMessage);
    }
}
