package com.eainde.truckticket;

import com.eainde.truckticket.extract.FieldExtractor;
import com.eainde.truckticket.normalize.SynonymNormalizer;
import com.eainde.truckticket.processor.CancellationToken;
import com.eainde.truckticket.processor.ProcessingPolicy;
import com.eainde.truckticket.processor.RunContext;
import com.eainde.truckticket.processor.TicketProcessor;
import com.eainde.truckticket.reference.InMemoryReferenceDataSource;
import com.eainde.truckticket.reference.ReferenceDataCache;
import com.eainde.truckticket.repository.TicketRepository;
import com.eainde.truckticket.repository.memory.InMemoryProcessedFileLedger;
import com.eainde.truckticket.repository.memory.InMemoryProcessingRunRepository;
import com.eainde.truckticket.repository.memory.InMemoryReviewQueueRepository;
import com.eainde.truckticket.repository.memory.InMemoryTicketRepository;
import com.eainde.truckticket.review.ReviewQueueRouter;
import com.eainde.truckticket.template.VendorTemplateCatalog;
import com.eainde.truckticket.template.VendorTemplateLoader;
import com.eainde.truckticket.validation.DuplicateDetector;
import com.eainde.truckticket.validation.ManifestValidator;
import com.eainde.truckticket.vendor.LogoLibrary;
import com.eainde.truckticket.vendor.LogoMatcher;
import com.eainde.truckticket.vendor.VendorDetector;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * The whole pipeline on in-memory persistence, loaded from the shipped YAML resources.
 */
public final class PipelineFixture {

    /** "Today" for every test: 2024-11-15. */
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-11-15T12:00:00Z"), ZoneOffset.UTC);

    public final VendorTemplateCatalog catalog = new VendorTemplateLoader()
            .load(resource("/vendor-templates.yml"), "vendor-templates.yml");
    public final SynonymNormalizer normalizer = SynonymNormalizer.load(resource("/synonyms.yml"));
    public final InMemoryReferenceDataSource references = InMemoryReferenceDataSource.load(resource("/reference-data.yml"));
    public final TicketRepository tickets;
    public final InMemoryReviewQueueRepository reviews = new InMemoryReviewQueueRepository();
    public final InMemoryProcessedFileLedger processedFiles = new InMemoryProcessedFileLedger();
    public final InMemoryProcessingRunRepository runs = new InMemoryProcessingRunRepository();
    public final FakeOcrEngine ocr = new FakeOcrEngine();
    public final TicketProcessor processor;

    public PipelineFixture() {
        this(new InMemoryTicketRepository());
    }

    public PipelineFixture(TicketRepository tickets) {
        this.tickets = tickets;
        this.processor = new TicketProcessor(
                ocr,
                new VendorDetector(catalog, LogoLibrary.empty(), new LogoMatcher(), 0.80),
                new FieldExtractor(catalog),
                normalizer,
                new ManifestValidator(tickets),
                new DuplicateDetector(tickets, processedFiles, DuplicateDetector.DEFAULT_WINDOW_DAYS),
                new ReviewQueueRouter(),
                tickets,
                reviews,
                processedFiles,
                ProcessingPolicy.defaults(),
                CLOCK);
    }

    public RunContext newRun(String requestGuid) {
        return new RunContext(requestGuid, new ReferenceDataCache(references), new CancellationToken());
    }

    public static InputStream resource(String name) {
        InputStream in = PipelineFixture.class.getResourceAsStream(name);
        if (in == null) {
            throw new UncheckedIOException(new IOException("Missing test resource " + name));
        }
        return in;
    }
}
