package com.eainde.truckticket.validation;

import com.eainde.truckticket.extract.FieldNames;
import com.eainde.truckticket.model.ProcessedFile;
import com.eainde.truckticket.model.ReviewProblem;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.SuggestedFix;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.repository.ProcessedFileLedger;
import com.eainde.truckticket.repository.TicketRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ticket-level and file-level duplicate checks.
 *
 * <p>Ticket level: a candidate duplicates the earliest committed ticket with the same
 * ticket number and vendor dated from {@code windowDays} before the candidate's date up to
 * and including that date. The window always looks back from the candidate, whatever
 * order tickets arrive in, so a ticket dated after the candidate is never its original.</p>
 *
 * <p>File level: a file whose SHA-256 is already in the processed-file ledger is not
 * processed again.</p>
 */
@Slf4j
public class DuplicateDetector {

    public static final int DEFAULT_WINDOW_DAYS = 120;

    private final TicketRepository tickets;
    private final ProcessedFileLedger processedFiles;
    private final int windowDays;

    public DuplicateDetector(TicketRepository tickets, ProcessedFileLedger processedFiles, int windowDays) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must be >= 0");
        }
        this.tickets = tickets;
        this.processedFiles = processedFiles;
        this.windowDays = windowDays;
    }

    public Optional<DuplicateMatch> findPrior(String ticketNumber, Long vendorId, LocalDate ticketDate) {
        if (ticketNumber == null || vendorId == null || ticketDate == null) {
            return Optional.empty();
        }
        return tickets.findEarliestInWindow(ticketNumber, vendorId, ticketDate.minusDays(windowDays), ticketDate)
                .map(original -> new DuplicateMatch(original,
                        ChronoUnit.DAYS.between(original.ticketDate(), ticketDate)));
    }

    public Optional<ProcessedFile> findProcessedFile(String fileHash) {
        return processedFiles.find(fileHash);
    }

    public ReviewProblem toProblem(TruckTicket candidate, DuplicateMatch match) {
        TruckTicket original = match.original();
        log.info("Duplicate ticket {} (vendor {}) on {}: original #{} from {} ({} days apart)",
                candidate.ticketNumber(), candidate.vendorId(), candidate.pageId(),
                original.id(), original.fileId(), match.daysApart());
        return ReviewProblem.of(ReviewReason.DUPLICATE_TICKET, FieldNames.TICKET_NUMBER,
                String.format("Ticket %s already committed as #%d on %s (%d days earlier)",
                        candidate.ticketNumber(), original.id(), original.ticketDate(), match.daysApart()));
    }

    /**
     * Operator hint carrying both tickets for side-by-side comparison.
     */
    public SuggestedFix suggestedFix(TruckTicket candidate, DuplicateMatch match) {
        TruckTicket original = match.original();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("original_ticket_id", original.id());
        details.put("original_date", String.valueOf(original.ticketDate()));
        details.put("original_file", original.fileId());
        details.put("days_apart", match.daysApart());
        details.put("original_summary", original.summary());
        details.put("candidate_summary", candidate.summary());
        return new SuggestedFix("Verify if re-scan or legitimate duplicate load", details);
    }

    public int windowDays() {
        return windowDays;
    }
}
