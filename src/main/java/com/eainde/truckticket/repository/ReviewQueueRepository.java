package com.eainde.truckticket.repository;

import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ReviewQueueRepository {

    /**
     * Stores a new entry and returns it with its assigned id.
     */
    ReviewQueueEntry save(ReviewQueueEntry entry);

    Optional<ReviewQueueEntry> findById(long id);

    /**
     * Open entries, most severe first, then by page.
     */
    List<ReviewQueueEntry> findUnresolved();

    List<ReviewQueueEntry> findByRun(String requestGuid);

    /**
     * Marks an entry resolved after manual correction.
     *
     * @throws IllegalArgumentException if the entry does not exist
     * @throws IllegalStateException    if it is already resolved
     */
    ReviewQueueEntry resolve(long id, String resolvedBy, Instant resolvedAt);

    int deleteAll(Collection<Long> ids);

    /** Count of open entries per primary reason. */
    Map<ReviewReason, Long> countOpenByReason();
}
