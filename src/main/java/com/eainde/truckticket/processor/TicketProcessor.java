package com.eainde.truckticket.processor;

import com.eainde.truckticket.exception.DuplicateTicketException;
import com.eainde.truckticket.exception.ReferenceNotFoundException;
import com.eainde.truckticket.extract.DateParser;
import com.eainde.truckticket.extract.ExtractedField;
import com.eainde.truckticket.extract.FieldExtractor;
import com.eainde.truckticket.extract.FieldNames;
import com.eainde.truckticket.extract.FilenameHints;
import com.eainde.truckticket.extract.Quantity;
import com.eainde.truckticket.extract.QuantityParser;
import com.eainde.truckticket.model.PageId;
import com.eainde.truckticket.model.ProcessedFile;
import com.eainde.truckticket.model.ReferenceCategory;
import com.eainde.truckticket.model.ReferenceEntity;
import com.eainde.truckticket.model.ReviewQueueEntry;
import com.eainde.truckticket.model.ReviewReason;
import com.eainde.truckticket.model.SuggestedFix;
import com.eainde.truckticket.model.TruckTicket;
import com.eainde.truckticket.normalize.SynonymCategory;
import com.eainde.truckticket.normalize.SynonymNormalizer;
import com.eainde.truckticket.ocr.FileMetadata;
import com.eainde.truckticket.ocr.OcrEngine;
import com.eainde.truckticket.ocr.OcrException;
import com.eainde.truckticket.ocr.OcrPage;
import com.eainde.truckticket.repository.ProcessedFileLedger;
import com.eainde.truckticket.repository.ReviewQueueRepository;
import com.eainde.truckticket.repository.TicketRepository;
import com.eainde.truckticket.review.ReviewQueueRouter;
import com.eainde.truckticket.review.RoutingDecision;
import com.eainde.truckticket.util.FileHashing;
import com.eainde.truckticket.validation.DuplicateDetector;
import com.eainde.truckticket.validation.DuplicateMatch;
import com.eainde.truckticket.validation.ManifestValidator;
import com.eainde.truckticket.vendor.VendorDetector;
import com.eainde.truckticket.vendor.VendorMatch;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns one scanned file into committed tickets and review entries.
 *
 * <h3>Per page</h3>
 * <pre>
 *   EXTRACTING  ─ upright geometry, vendor detection, template extraction,
 *                 parsing, synonym normalization, reference resolution
 *   VALIDATING  ─ manifest rule, duplicate window, routing by severity
 *   COMMITTING  ─ only INFO problems (or none): final ticket written
 *   QUEUED      ─ any WARNING / CRITICAL problem: one review entry per page
 * </pre>
 *
 * <p>A page that loses the uniqueness race while committing is moved to QUEUED as a
 * duplicate. Everything written is recorded on the {@link FileTransaction} so the caller
 * can undo a failed attempt with {@link #rollback(FileTransaction)}.</p>
 *
 * <p>Instances are shared by all workers. The only state is the set of content hashes in
 * flight: a file whose content is already being processed by another worker is reported as
 * already processed instead of being run twice.</p>
 */
@Slf4j
public class TicketProcessor {

    static final String MDC_FILE = "file";

    private final OcrEngine ocrEngine;
    private final VendorDetector vendorDetector;
    private final FieldExtractor fieldExtractor;
    private final SynonymNormalizer normalizer;
    private final ManifestValidator manifestValidator;
    private final DuplicateDetector duplicateDetector;
    private final ReviewQueueRouter router;
    private final TicketRepository tickets;
    private final ReviewQueueRepository reviewQueue;
    private final ProcessedFileLedger processedFiles;
    private final ProcessingPolicy policy;
    private final Clock clock;
    /** Content hash to file id, for files a worker is processing right now. */
    private final ConcurrentMap<String, String> inFlight = new ConcurrentHashMap<>();

    public TicketProcessor(OcrEngine ocrEngine,
                           VendorDetector vendorDetector,
                           FieldExtractor fieldExtractor,
                           SynonymNormalizer normalizer,
                           ManifestValidator manifestValidator,
                           DuplicateDetector duplicateDetector,
                           ReviewQueueRouter router,
                           TicketRepository tickets,
                           ReviewQueueRepository reviewQueue,
                           ProcessedFileLedger processedFiles,
                           ProcessingPolicy policy,
                           Clock clock) {
        this.ocrEngine = Objects.requireNonNull(ocrEngine, "ocrEngine");
        this.vendorDetector = vendorDetector;
        this.fieldExtractor = fieldExtractor;
        this.normalizer = normalizer;
        this.manifestValidator = manifestValidator;
        this.duplicateDetector = duplicateDetector;
        this.router = router;
        this.tickets = tickets;
        this.reviewQueue = reviewQueue;
        this.processedFiles = processedFiles;
        this.policy = policy;
        this.clock = clock;
    }

    // =========================================================================
    // File level
    // =========================================================================

    /**
     * Processes every page of {@code file}, in page order.
     *
     * @throws IOException  if the file cannot be read or hashed
     * @throws OcrException if recognition fails; pages already written stay on {@code tx}
     */
    public FileProcessingResult processFile(Path file, RunContext run, FileTransaction tx)
            throws IOException, OcrException {
        String fileId = file.toString();
        String previousFile = MDC.get(MDC_FILE);
        MDC.put(MDC_FILE, fileId);
        String claimedHash = null;
        try {
            String hash = FileHashing.sha256(file);
            String holder = inFlight.putIfAbsent(hash, fileId);
            if (holder != null) {
                log.info("File {} has the same content as {}, which is being processed, skipping", fileId, holder);
                return FileProcessingResult.alreadyProcessed(fileId, hash, List.of());
            }
            claimedHash = hash;
            Optional<ProcessedFile> prior = duplicateDetector.findProcessedFile(hash);
            if (prior.isPresent()) {
                log.info("File {} has the same content as {} (run {}), skipping",
                        fileId, prior.get().fileId(), prior.get().requestGuid());
                return FileProcessingResult.alreadyProcessed(fileId, hash, prior.get().ticketIds());
            }

            FilenameHints hints = FilenameHints.parse(file);
            List<OcrPage> pages = new ArrayList<>(ocrEngine.recognize(file));
            pages.sort(Comparator.comparingInt(OcrPage::pageNumber));
            log.info("Processing {} ({} pages, hints: {})", fileId, pages.size(), hints.isEmpty() ? "none" : hints);

            FileMetadata metadata = new FileMetadata(fileId, hash);
            List<PageOutcome> outcomes = new ArrayList<>(pages.size());
            for (OcrPage page : pages) {
                if (run.cancellation().isCancelled()) {
                    log.info("Cancellation requested, stopping {} after {} of {} pages",
                            fileId, outcomes.size(), pages.size());
                    return FileProcessingResult.cancelled(fileId, hash, outcomes);
                }
                outcomes.add(processPage(page, metadata, hints, run, tx));
            }

            FileProcessingResult result = FileProcessingResult.completed(fileId, hash, outcomes);
            processedFiles.recordIfAbsent(
                    new ProcessedFile(hash, fileId, result.ticketIds(), run.requestGuid(), clock.instant()));
            log.info("Finished {}: {} committed, {} queued for review",
                    fileId, result.committedCount(), result.queuedCount());
            return result;
        } finally {
            if (claimedHash != null) {
                inFlight.remove(claimedHash);
            }
            if (previousFile == null) {
                MDC.remove(MDC_FILE);
            } else {
                MDC.put(MDC_FILE, previousFile);
            }
        }
    }

    /**
     * Deletes everything a failed attempt wrote and clears the transaction.
     *
     * @return number of rows removed
     */
    public int rollback(FileTransaction tx) {
        if (tx.isEmpty()) {
            return 0;
        }
        int removed = tickets.deleteAll(tx.committedTicketIds()) + reviewQueue.deleteAll(tx.reviewEntryIds());
        log.info("Rolled back {} tickets and {} review entries", tx.committedTicketIds().size(),
                tx.reviewEntryIds().size());
        tx.clear();
        return removed;
    }

    // =========================================================================
    // Page level
    // =========================================================================

    public PageOutcome processPage(OcrPage page, FileMetadata file, FilenameHints hints, RunContext run,
                                   FileTransaction tx) {
        PageContext ctx = new PageContext(
                new PageId(file.fileId(), page.pageNumber()), page.orientationDegrees());
        OcrPage upright = page.upright();

        // Extracting
        String vendorName = identifyVendor(upright, hints, ctx);
        ctx.detected(FieldNames.VENDOR, vendorName);
        Map<String, ExtractedField> fields = fieldExtractor.extractAll(upright, vendorName);
        fields.values().forEach(f -> ctx.detected(f.field(), f.value()));
        TruckTicket candidate = buildCandidate(fields, vendorName, file, hints, run, ctx);

        // Validating
        ctx.advance(PageState.VALIDATING);
        ctx.problems(manifestValidator.validate(candidate));
        SuggestedFix fix = null;
        Optional<DuplicateMatch> duplicate = duplicateDetector.findPrior(
                candidate.ticketNumber(), candidate.vendorId(), candidate.ticketDate());
        if (duplicate.isPresent()) {
            candidate = candidate.toBuilder().duplicateOf(duplicate.get().original().id()).build();
            ctx.problem(duplicateDetector.toProblem(candidate, duplicate.get()));
            fix = duplicateDetector.suggestedFix(candidate, duplicate.get());
        }
        RoutingDecision decision = router.route(ctx.problems());

        // Committing
        if (decision.commit()) {
            ctx.advance(PageState.COMMITTING);
            try {
                TruckTicket committed = tickets.commit(candidate.toBuilder().reviewRequired(false).build());
                tx.ticketCommitted(committed.id());
                router.audit(ctx.pageId(), committed.id(), decision);
                log.debug("Committed ticket #{} ({}) from {}", committed.id(), committed.ticketNumber(), ctx.pageId());
                return PageOutcome.committed(ctx, committed, decision.problems());
            } catch (DuplicateTicketException e) {
                log.warn("Ticket {} on {} lost the commit race: {}", candidate.ticketNumber(), ctx.pageId(),
                        e.getMessage());
                candidate = candidate.toBuilder().duplicateOf(e.getExistingTicketId()).build();
                ctx.problem(ReviewReason.DUPLICATE_TICKET, FieldNames.TICKET_NUMBER, e.getMessage());
                decision = router.route(ctx.problems());
                fix = raceFix(candidate, e.getExistingTicketId());
            }
        }

        // Queued
        ctx.advance(PageState.QUEUED);
        ReviewQueueEntry entry = reviewQueue.save(router.toEntry(ctx.pageId(), decision, ctx.detectedFields(), fix,
                candidate, run.requestGuid(), clock.instant()));
        tx.reviewQueued(entry.id());
        log.info("Page {} queued for review: {} ({} problems)", ctx.pageId(), entry.reason(),
                entry.problems().size());
        return PageOutcome.queued(ctx, entry);
    }

    private SuggestedFix raceFix(TruckTicket candidate, Long existingId) {
        if (existingId == null) {
            return null;
        }
        return tickets.findById(existingId)
                .map(original -> duplicateDetector.suggestedFix(candidate, new DuplicateMatch(original,
                        ChronoUnit.DAYS.between(original.ticketDate(), candidate.ticketDate()))))
                .orElse(null);
    }

    // =========================================================================
    // Vendor
    // =========================================================================

    private String identifyVendor(OcrPage page, FilenameHints hints, PageContext ctx) {
        VendorMatch match = vendorDetector.detect(page);
        String detected = match.isIdentified() ? match.vendorName() : null;
        String hinted = hints.vendor() == null ? null : normalizer.normalize(hints.vendor(), SynonymCategory.VENDOR);

        if (hinted != null) {
            if (detected == null) {
                ctx.problem(ReviewReason.ASSUMED_VENDOR, FieldNames.VENDOR, String.format(
                        "No vendor detected on page (best confidence %.2f); using %s from file name",
                        match.confidence(), hinted));
            } else if (!hinted.equalsIgnoreCase(detected)) {
                ctx.problem(ReviewReason.FILENAME_OVERRIDE, FieldNames.VENDOR,
                        "File name vendor " + hinted + " overrides detected " + detected);
            }
            return hinted;
        }
        if (detected == null) {
            ctx.problem(ReviewReason.AMBIGUOUS_VENDOR, FieldNames.VENDOR, String.format(
                    "No vendor identified (best confidence %.2f)", match.confidence()));
        }
        return detected;
    }

    // =========================================================================
    // Candidate
    // =========================================================================

    private TruckTicket buildCandidate(Map<String, ExtractedField> fields, String vendorName, FileMetadata file,
                                       FilenameHints hints, RunContext run, PageContext ctx) {
        List<Double> confidences = new ArrayList<>(3);

        ExtractedField numberField = field(fields, FieldNames.TICKET_NUMBER);
        String ticketNumber = numberField.isPresent() ? numberField.value().trim().toUpperCase(Locale.ROOT) : null;
        if (ticketNumber == null) {
            ctx.problem(ReviewReason.MISSING_TICKET_NUMBER, FieldNames.TICKET_NUMBER, "No ticket number found on page");
        } else {
            confidences.add(numberField.confidence());
        }

        LocalDate ticketDate = readDate(field(fields, FieldNames.TICKET_DATE), hints, ctx, confidences);

        Quantity quantity = readQuantity(field(fields, FieldNames.QUANTITY), ctx, confidences);

        double confidence = confidences.isEmpty()
                ? 0.0
                : confidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (ticketNumber != null && confidence < policy.lowConfidenceThreshold()) {
            ctx.problem(ReviewReason.LOW_CONFIDENCE_OCR, null, String.format(
                    "Aggregated confidence %.2f below %.2f", confidence, policy.lowConfidenceThreshold()));
        }

        ReferenceResolution refs = new ReferenceResolution(run, ctx);
        String materialName = preferHint(FieldNames.MATERIAL,
                normalizer.normalize(hints.material(), SynonymCategory.MATERIAL),
                normalizer.normalize(value(fields, FieldNames.MATERIAL), SynonymCategory.MATERIAL), ctx);
        ReferenceEntity material = refs.required(ReferenceCategory.MATERIAL,
                materialName != null ? materialName : policy.defaultMaterial());
        ReferenceEntity source = readSource(hints, fields, run, ctx);
        String destinationName = normalizer.normalize(value(fields, FieldNames.DESTINATION), SynonymCategory.DESTINATION);
        ReferenceEntity destination = destinationName == null ? null
                : refs.required(ReferenceCategory.DESTINATION, destinationName);
        ReferenceEntity vendor = vendorName == null ? null : refs.required(ReferenceCategory.VENDOR, vendorName);
        String jobCode = hints.job() != null ? hints.job() : policy.defaultJob();
        ReferenceEntity job = jobCode == null ? null : refs.required(ReferenceCategory.JOB, jobCode);
        ReferenceEntity ticketType = refs.required(ReferenceCategory.TICKET_TYPE,
                hints.flow() != null ? hints.flow() : policy.defaultTicketType());
        ctx.detected(FieldNames.JOB, jobCode);

        return TruckTicket.builder()
                .ticketNumber(ticketNumber)
                .ticketDate(ticketDate)
                .quantity(quantity == null ? null : quantity.value())
                .quantityUnit(quantity == null ? null : quantity.unit())
                .jobId(idOf(job))
                .materialId(idOf(material))
                .sourceId(idOf(source))
                .destinationId(idOf(destination))
                .vendorId(idOf(vendor))
                .ticketTypeId(idOf(ticketType))
                .manifestNumber(cleanManifest(value(fields, FieldNames.MANIFEST_NUMBER)))
                .truckNumber(trimmed(value(fields, FieldNames.TRUCK_NUMBER)))
                .fileId(file.fileId())
                .filePage(ctx.pageId().pageNumber())
                .fileHash(file.fileHash())
                .manifestRequired(ManifestValidator.requiresManifest(material, destination))
                .reviewRequired(true)
                .confidence(Math.min(1.0, confidence))
                .processingRunId(run.requestGuid())
                .createdAt(clock.instant())
                .build();
    }

    private LocalDate readDate(ExtractedField dateField, FilenameHints hints, PageContext ctx,
                               List<Double> confidences) {
        LocalDate fromPage = DateParser.parse(dateField.value()).orElse(null);
        LocalDate date = preferHint(FieldNames.TICKET_DATE, hints.date(), fromPage, ctx);
        if (date == null) {
            ctx.problem(ReviewReason.INVALID_DATE, FieldNames.TICKET_DATE, dateField.isPresent()
                    ? "Unreadable date '" + dateField.value() + "'"
                    : "No ticket date found on page");
            return null;
        }
        confidences.add(hints.date() != null ? 1.0 : dateField.confidence());

        LocalDate latest = LocalDate.now(clock).plusDays(policy.maxFutureDays());
        if (date.isBefore(policy.earliestTicketDate()) || date.isAfter(latest)) {
            ctx.problem(ReviewReason.OUT_OF_RANGE_DATE, FieldNames.TICKET_DATE,
                    "Date " + date + " outside " + policy.earliestTicketDate() + ".." + latest);
        }
        return date;
    }

    private Quantity readQuantity(ExtractedField quantityField, PageContext ctx, List<Double> confidences) {
        Optional<Quantity> parsed = QuantityParser.parse(quantityField.value(), policy.defaultQuantityUnit());
        if (parsed.isEmpty()) {
            return null;
        }
        Quantity quantity = parsed.get();
        confidences.add(quantityField.confidence());
        BigDecimal limit = policy.unusualQuantityLimits().get(quantity.unit());
        if (quantity.value().signum() <= 0 || (limit != null && quantity.value().compareTo(limit) > 0)) {
            ctx.problem(ReviewReason.UNUSUAL_QUANTITY, FieldNames.QUANTITY, "Quantity " + quantity.value().toPlainString()
                    + " " + quantity.unit() + (limit == null ? "" : " (limit " + limit.toPlainString() + ")"));
        }
        return quantity;
    }

    private ReferenceEntity readSource(FilenameHints hints, Map<String, ExtractedField> fields, RunContext run,
                                       PageContext ctx) {
        String sourceName = preferHint(FieldNames.SOURCE,
                normalizer.normalize(hints.area(), SynonymCategory.SOURCE),
                normalizer.normalize(value(fields, FieldNames.SOURCE), SynonymCategory.SOURCE), ctx);
        if (sourceName == null) {
            ctx.problem(ReviewReason.MISSING_SOURCE, FieldNames.SOURCE, "No source on page or in file name");
            return null;
        }
        Optional<ReferenceEntity> source = run.references().find(ReferenceCategory.SOURCE, sourceName);
        if (source.isEmpty()) {
            ctx.problem(ReviewReason.MISSING_SOURCE, FieldNames.SOURCE, "Unknown source '" + sourceName + "'");
        }
        return source.orElse(null);
    }

    /**
     * File name value wins over the page value; a differing page value is reported.
     */
    private static <T> T preferHint(String field, T hinted, T onPage, PageContext ctx) {
        if (hinted == null) {
            return onPage;
        }
        if (onPage != null && !hinted.toString().equalsIgnoreCase(onPage.toString())) {
            ctx.problem(ReviewReason.FILENAME_OVERRIDE, field,
                    "File name value " + hinted + " overrides page value " + onPage);
        }
        return hinted;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static ExtractedField field(Map<String, ExtractedField> fields, String name) {
        ExtractedField f = fields.get(name);
        return f != null ? f : ExtractedField.missing(name);
    }

    private static String value(Map<String, ExtractedField> fields, String name) {
        ExtractedField f = fields.get(name);
        return f != null && f.isPresent() ? f.value().trim() : null;
    }

    private static String trimmed(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    static String cleanManifest(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    private static Long idOf(ReferenceEntity e) {
        return e == null ? null : e.id();
    }

    /**
     * Resolves required references, turning a miss into an {@code UNRESOLVED_REFERENCE} problem.
     */
    private static final class ReferenceResolution {

        private final RunContext run;
        private final PageContext ctx;

        ReferenceResolution(RunContext run, PageContext ctx) {
            this.run = run;
            this.ctx = ctx;
        }

        ReferenceEntity required(ReferenceCategory category, String name) {
            try {
                return run.references().resolve(category, name);
            } catch (ReferenceNotFoundException e) {
                ctx.problem(ReviewReason.UNRESOLVED_REFERENCE, category.name().toLowerCase(Locale.ROOT),
                        e.getMessage());
                return null;
            }
        }
    }
}
