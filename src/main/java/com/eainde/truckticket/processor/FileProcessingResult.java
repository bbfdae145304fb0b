package com.eainde.truckticket.processor;

import java.util.List;

/**
 * What {@link TicketProcessor#processFile} did with one file.
 *
 * @param ticketIds tickets committed from the file; for an already processed file, the ids
 *                  committed when it was first processed
 */
public record FileProcessingResult(String fileId, String fileHash, Status status, List<PageOutcome> pages,
                                   List<Long> ticketIds) {

    public enum Status {
        COMPLETED,
        ALREADY_PROCESSED,
        CANCELLED
    }

    public FileProcessingResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
        ticketIds = ticketIds == null ? List.of() : List.copyOf(ticketIds);
    }

    static FileProcessingResult completed(String fileId, String fileHash, List<PageOutcome> pages) {
        return new FileProcessingResult(fileId, fileHash, Status.COMPLETED, pages, committedIds(pages));
    }

    static FileProcessingResult cancelled(String fileId, String fileHash, List<PageOutcome> pages) {
        return new FileProcessingResult(fileId, fileHash, Status.CANCELLED, pages, committedIds(pages));
    }

    static FileProcessingResult alreadyProcessed(String fileId, String fileHash, List<Long> originalTicketIds) {
        return new FileProcessingResult(fileId, fileHash, Status.ALREADY_PROCESSED, List.of(), originalTicketIds);
    }

    public int committedCount() {
        return (int) pages.stream().filter(PageOutcome::isCommitted).count();
    }

    public int queuedCount() {
        return (int) pages.stream().filter(PageOutcome::isQueued).count();
    }

    public int duplicateCount() {
        return (int) pages.stream().filter(PageOutcome::isDuplicate).count();
    }

    private static List<Long> committedIds(List<PageOutcome> pages) {
        return pages.stream().filter(PageOutcome::isCommitted).map(p -> p.ticket().id()).toList();
    }
}
