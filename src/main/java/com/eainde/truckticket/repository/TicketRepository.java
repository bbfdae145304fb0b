package com.eainde.truckticket.repository;

import com.eainde.truckticket.exception.DuplicateTicketException;
import com.eainde.truckticket.model.TruckTicket;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * System of record for committed tickets.
 *
 * <p>Implementations must reject a second ticket with the same ticket number, vendor and
 * ticket date, even when two workers commit concurrently.</p>
 */
public interface TicketRepository {

    /**
     * Stores a final ticket and returns it with its assigned id.
     *
     * @throws DuplicateTicketException  if (ticket number, vendor, date) is already taken
     * @throws IllegalArgumentException  if the ticket already has an id or is flagged for review
     */
    TruckTicket commit(TruckTicket ticket);

    Optional<TruckTicket> findById(long id);

    /**
     * Earliest committed ticket with this number and vendor dated within [from, to].
     */
    Optional<TruckTicket> findEarliestInWindow(String ticketNumber, long vendorId, LocalDate from, LocalDate to);

    Optional<TruckTicket> findByManifest(String manifestNumber, long vendorId, LocalDate ticketDate);

    List<TruckTicket> findByFileHash(String fileHash);

    /**
     * Removes tickets committed by a failed file attempt.
     *
     * @return number of rows removed
     */
    int deleteAll(Collection<Long> ids);

    long count();

    static void requireCommittable(TruckTicket ticket) {
        if (ticket.id() != null) {
            throw new IllegalArgumentException("Ticket already committed as #" + ticket.id());
        }
        if (ticket.reviewRequired()) {
            throw new IllegalArgumentException("Tickets flagged for review are not committed: " + ticket.pageId());
        }
        if (ticket.ticketNumber() == null || ticket.ticketDate() == null) {
            throw new IllegalArgumentException("Ticket number and date are required to commit " + ticket.pageId());
        }
    }
}
