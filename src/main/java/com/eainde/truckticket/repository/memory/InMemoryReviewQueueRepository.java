package com.eainde.truckticket.repository.memory;

import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.repository.ReviewQueueRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryReviewQueueRepository implements ReviewQueueRepository {

    static final Comparator<ReviewQueueEntry> QUEUE_ORDER = Comparator
            .comparing(ReviewQueueEntry::severity, Comparator.reverseOrder())
            .thenComparing(ReviewQueueEntry::pageId);

    private final ConcurrentMap<Long, ReviewQueueEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ReviewQueueEntry save(ReviewQueueEntry entry) {
        if (entry.id() != null) {
            throw new IllegalArgumentException("Entry already saved as #" + entry.id());
        }
        ReviewQueueEntry stored = entry.toBuilder()
                .id(sequence.incrementAndGet())
                .createdAt(entry.createdAt() == null ? Instant.now() : entry.createdAt())
                .build();
        entries.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<ReviewQueueEntry> findById(long id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public List<ReviewQueueEntry> findUnresolved() {
        return entries.values().stream().filter(e -> !e.resolved()).sorted(QUEUE_ORDER).toList();
    }

    @Override
    public List<ReviewQueueEntry> findByRun(String requestGuid) {
        return entries.values().stream()
                .filter(e -> requestGuid.equals(e.processingRunId()))
                .sorted(Comparator.comparing(ReviewQueueEntry::pageId))
                .toList();
    }

    @Override
    public ReviewQueueEntry resolve(long id, String resolvedBy, Instant resolvedAt) {
        return entries.compute(id, (k, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("No review entry #" + id);
            }
            if (current.resolved()) {
                throw new IllegalStateException("Review entry #" + id + " already resolved by " + current.resolvedBy());
            }
            return current.toBuilder().resolved(true).resolvedBy(resolvedBy).resolvedAt(resolvedAt).build();
        });
    }

    @Override
    public int deleteAll(Collection<Long> ids) {
        int removed = 0;
        for (Long id : ids) {
            if (entries.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public Map<ReviewReason, Long> countOpenByReason() {
        Map<ReviewReason, Long> counts = new EnumMap<>(ReviewReason.class);
        entries.values().stream()
                .filter(e -> !e.resolved())
                .forEach(e -> counts.merge(e.reason(), 1L, Long::sum));
        return counts;
    }
}
