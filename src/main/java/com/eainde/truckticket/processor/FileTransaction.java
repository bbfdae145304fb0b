package com.eainde.truckticket.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * Records what one attempt at a file wrote, so a failed attempt can be undone without
 * touching other files.
 */
public final class FileTransaction {

    private final List<Long> committedTicketIds = new ArrayList<>();
    private final List<Long> reviewEntryIds = new ArrayList<>();

    void ticketCommitted(long id) {
        committedTicketIds.add(id);
    }

    void reviewQueued(long id) {
        reviewEntryIds.add(id);
    }

    public List<Long> committedTicketIds() {
        return List.copyOf(committedTicketIds);
    }

    public List<Long> reviewEntryIds() {
        return List.copyOf(reviewEntryIds);
    }

    public boolean isEmpty() {
        return committedTicketIds.isEmpty() && reviewEntryIds.isEmpty();
    }

    void clear() {
        committedTicketIds.clear();
        reviewEntryIds.clear();
    }
}
