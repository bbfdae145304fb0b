package com.eainde.truckticket.review;

import com.eainde.truckticket.model.PageId;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.Severity;
import com.eainde.truckticket.model.SuggestedFix;
import com.eainde.truckticket.model.TruckTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a page commits or goes to review, and builds the single review entry
 * that aggregates all of a page's problems.
 *
 * <p>Severity ordering is CRITICAL &gt; WARNING &gt; INFO. Pages with only INFO problems
 * commit; their problems are written to the {@code com.eainde.truckticket.audit} log.</p>
 */
public class ReviewQueueRouter {

    private static final Logger AUDIT = LoggerFactory.getLogger("com.eainde.truckticket.audit");

    private static final Comparator<ReviewProblem> MOST_SEVERE_FIRST =
            Comparator.comparing(ReviewProblem::severity, Comparator.reverseOrder());

    private static final Map<ReviewReason, String> ACTIONS = new EnumMap<>(ReviewReason.class);

    static {
        ACTIONS.put(ReviewReason.MISSING_TICKET_NUMBER, "Enter the ticket number from the scan");
        ACTIONS.put(ReviewReason.MISSING_MANIFEST, "Locate the manifest number or attach the manifest before release");
        ACTIONS.put(ReviewReason.INVALID_DATE, "Enter the ticket date from the scan");
        ACTIONS.put(ReviewReason.AMBIGUOUS_VENDOR, "Select the issuing vendor");
        ACTIONS.put(ReviewReason.UNRESOLVED_REFERENCE, "Map the value to an existing reference entry or add one");
        ACTIONS.put(ReviewReason.LOW_CONFIDENCE_OCR, "Check extracted values against the scan");
        ACTIONS.put(ReviewReason.DUPLICATE_TICKET, "Verify if re-scan or legitimate duplicate load");
        ACTIONS.put(ReviewReason.DUPLICATE_MANIFEST, "Confirm the manifest number against the manifest log");
        ACTIONS.put(ReviewReason.OUT_OF_RANGE_DATE, "Confirm the ticket date");
        ACTIONS.put(ReviewReason.UNUSUAL_QUANTITY, "Confirm the quantity and unit");
    }

    public RoutingDecision route(List<ReviewProblem> problems) {
        List<ReviewProblem> sorted = new ArrayList<>(problems);
        sorted.sort(MOST_SEVERE_FIRST);
        Severity severity = sorted.isEmpty() ? null : sorted.get(0).severity();
        boolean commit = severity == null || !severity.blocksCommit();
        return new RoutingDecision(severity, commit, List.copyOf(sorted));
    }

    /**
     * Builds the review entry of a page that may not commit.
     *
     * @param fix suggested fix to use; when null one is derived from the primary reason
     * @throws IllegalArgumentException if the decision allows committing
     */
    public ReviewQueueEntry toEntry(PageId pageId, RoutingDecision decision, Map<String, String> detectedFields,
                                    SuggestedFix fix, TruckTicket provisionalTicket, String requestGuid, Instant now) {
        if (decision.commit()) {
            throw new IllegalArgumentException("Page " + pageId + " has no blocking problems");
        }
        ReviewProblem primary = decision.problems().get(0);
        Map<String, String> fields = new LinkedHashMap<>();
        detectedFields.forEach((k, v) -> {
            if (v != null) {
                fields.put(k, v);
            }
        });
        return ReviewQueueEntry.builder()
                .pageId(pageId)
                .reason(primary.reason())
                .severity(decision.severity())
                .problems(decision.problems())
                .detectedFields(fields)
                .suggestedFix(fix != null ? fix : defaultFix(primary))
                .provisionalTicket(provisionalTicket)
                .processingRunId(requestGuid)
                .resolved(false)
                .createdAt(now)
                .build();
    }

    /**
     * Writes the INFO problems of a committed page to the audit log.
     */
    public void audit(PageId pageId, Long ticketId, RoutingDecision decision) {
        for (ReviewProblem p : decision.problems()) {
            AUDIT.info("page={} ticket=#{} reason={} field={} detail={}",
                    pageId, ticketId, p.reason(), p.field(), p.detail());
        }
    }

    private static SuggestedFix defaultFix(ReviewProblem primary) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (primary.field() != null) {
            details.put("field", primary.field());
        }
        if (primary.detail() != null) {
            details.put("detail", primary.detail());
        }
        return new SuggestedFix(ACTIONS.getOrDefault(primary.reason(), "Review the page"), details);
    }
}
