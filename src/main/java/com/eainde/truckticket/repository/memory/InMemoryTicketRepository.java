package com.eainde.truckticket.repository.memory;

import com.eainde.truckticket.exception.DuplicateTicketException;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.repository.TicketRepository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory ticket store. Commits are serialized so the uniqueness check and
 * the insert happen atomically.
 */
public class InMemoryTicketRepository implements TicketRepository {

    private final Map<Long, TruckTicket> tickets = new LinkedHashMap<>();
    private final Map<UniqueKey, Long> uniqueIndex = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized TruckTicket commit(TruckTicket ticket) {
        TicketRepository.requireCommittable(ticket);
        UniqueKey key = new UniqueKey(ticket.ticketNumber(), ticket.vendorId(), ticket.ticketDate());
        Long existing = uniqueIndex.get(key);
        if (existing != null) {
            throw new DuplicateTicketException(ticket.ticketNumber(), ticket.vendorId(), existing, null);
        }
        TruckTicket stored = ticket.toBuilder()
                .id(sequence.incrementAndGet())
                .createdAt(ticket.createdAt() == null ? Instant.now() : ticket.createdAt())
                .build();
        tickets.put(stored.id(), stored);
        uniqueIndex.put(key, stored.id());
        return stored;
    }

    @Override
    public synchronized Optional<TruckTicket> findById(long id) {
        return Optional.ofNullable(tickets.get(id));
    }

    @Override
    public synchronized Optional<TruckTicket> findEarliestInWindow(String ticketNumber, long vendorId,
                                                                   LocalDate from, LocalDate to) {
        return tickets.values().stream()
                .filter(t -> ticketNumber.equals(t.ticketNumber()))
                .filter(t -> Objects.equals(vendorId, t.vendorId()))
                .filter(t -> !t.ticketDate().isBefore(from) && !t.ticketDate().isAfter(to))
                .filter(t -> t.duplicateOf() == null)
                .min(Comparator.comparing(TruckTicket::ticketDate).thenComparing(TruckTicket::id));
    }

    @Override
    public synchronized Optional<TruckTicket> findByManifest(String manifestNumber, long vendorId, LocalDate ticketDate) {
        return tickets.values().stream()
                .filter(t -> manifestNumber.equalsIgnoreCase(t.manifestNumber()))
                .filter(t -> Objects.equals(vendorId, t.vendorId()))
                .filter(t -> ticketDate.equals(t.ticketDate()))
                .findFirst();
    }

    @Override
    public synchronized List<TruckTicket> findByFileHash(String fileHash) {
        return tickets.values().stream().filter(t -> fileHash.equals(t.fileHash())).toList();
    }

    @Override
    public synchronized int deleteAll(Collection<Long> ids) {
        int removed = 0;
        for (Long id : ids) {
            TruckTicket t = tickets.remove(id);
            if (t != null) {
                uniqueIndex.remove(new UniqueKey(t.ticketNumber(), t.vendorId(), t.ticketDate()));
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized long count() {
        return tickets.size();
    }

    private record UniqueKey(String ticketNumber, Long vendorId, LocalDate date) {}
}
