package com.eainde.truckticket.model;

/**
 * Why a page was sent to the review queue. Each reason carries a fixed severity.
 */
public enum ReviewReason {

    /** No ticket number survived extraction and validation. */
    MISSING_TICKET_NUMBER(Severity.CRITICAL),

    /** Regulated material without a well-formed manifest number. */
    MISSING_MANIFEST(Severity.CRITICAL),

    /** Ticket date absent or unparseable. */
    INVALID_DATE(Severity.CRITICAL),

    /** No vendor could be identified with sufficient confidence. */
    AMBIGUOUS_VENDOR(Severity.CRITICAL),

    /** A required reference (job, material, vendor, ...) has no canonical entity. */
    UNRESOLVED_REFERENCE(Severity.CRITICAL),

    LOW_CONFIDENCE_OCR(Severity.WARNING),

    /** Same ticket number and vendor already committed inside the look-back window. */
    DUPLICATE_TICKET(Severity.WARNING),

    /** Manifest number already used by the same vendor on the same date. */
    DUPLICATE_MANIFEST(Severity.WARNING),

    OUT_OF_RANGE_DATE(Severity.WARNING),

    UNUSUAL_QUANTITY(Severity.WARNING),

    MISSING_SOURCE(Severity.INFO),

    /** Vendor taken from the file name because detection on the page failed. */
    ASSUMED_VENDOR(Severity.INFO),

    /** A file-name hint replaced a different value read from the page. */
    FILENAME_OVERRIDE(Severity.INFO);

    private final Severity severity;

    ReviewReason(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
