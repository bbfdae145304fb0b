package com.eainde.truckticket.batch;

/**
 * Outcome of one file in a batch.
 */
public enum FileStatus {
    /** All pages reached a terminal state (committed or queued for review). */
    OK,
    /** Retries exhausted or a non-transient failure; the file's writes were rolled back. */
    ERROR,
    /** Cancelled before the file was started. */
    SKIPPED,
    /** Same content hash as a file processed earlier; nothing written. */
    ALREADY_PROCESSED,
    /** Cancelled while in flight; the file's writes were rolled back. */
    CANCELLED
}
