package com.eainde.truckticket.processor;

import com.eainde.truckticket.model.PageId;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.TruckTicket;

import java.util.List;

/**
 * Terminal result of one page: either a committed ticket or a review entry.
 *
 * @param ticket   the committed ticket, or the provisional one attached to the review entry
 * @param problems all problems found, including the INFO ones of committed pages
 */
public record PageOutcome(PageId pageId, PageState state, TruckTicket ticket, ReviewQueueEntry reviewEntry,
                          List<ReviewProblem> problems) {

    public PageOutcome {
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    static PageOutcome committed(PageContext ctx, TruckTicket ticket, List<ReviewProblem> problems) {
        return new PageOutcome(ctx.pageId(), PageState.COMMITTING, ticket, null, problems);
    }

    static PageOutcome queued(PageContext ctx, ReviewQueueEntry entry) {
        return new PageOutcome(ctx.pageId(), PageState.QUEUED, entry.provisionalTicket(), entry, entry.problems());
    }

    public boolean isCommitted() {
        return state == PageState.COMMITTING;
    }

    public boolean isQueued() {
        return state == PageState.QUEUED;
    }

    public boolean isDuplicate() {
        return problems.stream().anyMatch(p -> p.reason() == ReviewReason.DUPLICATE_TICKET);
    }
}
