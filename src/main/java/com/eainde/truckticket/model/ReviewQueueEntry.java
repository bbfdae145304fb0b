package com.eainde.truckticket.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All problems of one page, aggregated into a single review item.
 *
 * <p>{@code severity} is the maximum severity of {@code problems} and {@code reason} the
 * reason of the first problem carrying that severity. {@code provisionalTicket} is the
 * ticket as far as it could be built; it is not committed while the entry is open.</p>
 */
@Builder(toBuilder = true)
public record ReviewQueueEntry(
        Long id,
        PageId pageId,
        ReviewReason reason,
        Severity severity,
        List<ReviewProblem> problems,
        Map<String, String> detectedFields,
        SuggestedFix suggestedFix,
        TruckTicket provisionalTicket,
        String processingRunId,
        boolean resolved,
        String resolvedBy,
        Instant resolvedAt,
        Instant createdAt
) {
    public ReviewQueueEntry {
        Objects.requireNonNull(pageId, "pageId");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(severity, "severity");
        problems = problems == null ? List.of() : List.copyOf(problems);
        detectedFields = detectedFields == null ? Map.of() : Map.copyOf(detectedFields);
        if (resolved && resolvedBy == null) {
            throw new IllegalArgumentException("resolved entries need resolvedBy");
        }
    }

    public boolean hasReason(ReviewReason r) {
        return problems.stream().anyMatch(p -> p.reason() == r);
    }
}
