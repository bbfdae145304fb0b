package com.eainde.truckticket.exception;

/**
 * Thrown by a ticket repository when a commit violates the
 * (ticket number, vendor, date) uniqueness constraint.
 */
public class DuplicateTicketException extends TicketPipelineException {

    private final Long existingTicketId;

    public DuplicateTicketException(String ticketNumber, Long vendorId, Long existingTicketId, Throwable cause) {
        super(String.format("Ticket %s for vendor %s already committed as #%s", ticketNumber, vendorId, existingTicketId), cause);
        this.existingTicketId = existingTicketId;
    }

    /**
     * @return id of the ticket that won the race, or null if the store could not tell
     */
    public Long getExistingTicketId() {
        return existingTicketId;
    }
}
