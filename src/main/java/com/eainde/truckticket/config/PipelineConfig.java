package com.eainde.truckticket.config;

import com.eainde.truckticket.batch.BatchConfig;
import com.eainde.truckticket.batch.BatchProcessor;
import com.eainde.truckticket.extract.FieldExtractor;
import com.eainde.truckticket.normalize.SynonymNormalizer;
import com.eainde.truckticket.ocr.OcrEngine;
import com.eainde.truckticket.processor.ProcessingPolicy;
import com.eainde.truckticket.processor.TicketProcessor;
import com.eainde.truckticket.reference.InMemoryReferenceDataSource;
import com.eainde.truckticket.reference.ReferenceDataSource;
import com.eainde.truckticket.repository.ProcessedFileLedger;
import com.eainde.truckticket.repository.ProcessingRunRepository;
import com.eainde.truckticket.repository.ReviewQueueRepository;
import com.eainde.truckticket.repository.TicketRepository;
import com.eainde.truckticket.repository.jdbc.JdbcProcessedFileLedger;
import com.eainde.truckticket.repository.jdbc.JdbcProcessingRunRepository;
import com.eainde.truckticket.repository.jdbc.JdbcReferenceDataSource;
import com.eainde.truckticket.repository.jdbc.JdbcReviewQueueRepository;
import com.eainde.truckticket.repository.jdbc.JdbcTicketRepository;
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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the pipeline from {@link PipelineProperties}.
 *
 * <p>The application supplies the {@link OcrEngine} bean. Persistence is in-memory unless
 * {@code pipeline.persistence.mode=jdbc}, which needs a {@link JdbcTemplate} and the tables of
 * {@code schema.sql}.</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock pipelineClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper pipelineObjectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // =========================================================================
    // Templates, vendors and normalization
    // =========================================================================

    @Bean
    public VendorTemplateCatalog vendorTemplateCatalog(PipelineProperties props, ResourceLoader resourceLoader) {
        String location = props.getTemplates().getLocation();
        try (InputStream in = open(resourceLoader, location)) {
            return new VendorTemplateLoader(props.getVendor().getLogoThreshold()).load(in, location);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read vendor templates from " + location, e);
        }
    }

    @Bean
    public LogoLibrary logoLibrary(PipelineProperties props, VendorTemplateCatalog catalog) {
        String directory = props.getTemplates().getLogoDirectory();
        if (directory == null || directory.isBlank()) {
            log.info("No logo directory configured; vendor detection uses text only");
            return LogoLibrary.empty();
        }
        return LogoLibrary.load(catalog, Path.of(directory));
    }

    @Bean
    public VendorDetector vendorDetector(PipelineProperties props, VendorTemplateCatalog catalog, LogoLibrary logos) {
        return new VendorDetector(catalog, logos, new LogoMatcher(), props.getVendor().getMinConfidence());
    }

    @Bean
    public FieldExtractor fieldExtractor(VendorTemplateCatalog catalog) {
        return new FieldExtractor(catalog);
    }

    @Bean
    public SynonymNormalizer synonymNormalizer(PipelineProperties props, ResourceLoader resourceLoader) {
        String location = props.getSynonyms().getLocation();
        try (InputStream in = open(resourceLoader, location)) {
            return SynonymNormalizer.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read synonyms from " + location, e);
        }
    }

    // =========================================================================
    // Validation, routing, processing
    // =========================================================================

    @Bean
    public ManifestValidator manifestValidator(TicketRepository tickets) {
        return new ManifestValidator(tickets);
    }

    @Bean
    public DuplicateDetector duplicateDetector(PipelineProperties props, TicketRepository tickets,
                                               ProcessedFileLedger processedFiles) {
        return new DuplicateDetector(tickets, processedFiles, props.getValidation().getDuplicateWindowDays());
    }

    @Bean
    public ReviewQueueRouter reviewQueueRouter() {
        return new ReviewQueueRouter();
    }

    @Bean
    public ProcessingPolicy processingPolicy(PipelineProperties props) {
        PipelineProperties.Defaults defaults = props.getDefaults();
        PipelineProperties.Validation validation = props.getValidation();
        return ProcessingPolicy.builder()
                .defaultJob(defaults.getJob())
                .defaultTicketType(defaults.getTicketType())
                .defaultMaterial(defaults.getMaterial())
                .defaultQuantityUnit(defaults.getQuantityUnit())
                .lowConfidenceThreshold(validation.getLowConfidenceThreshold())
                .earliestTicketDate(validation.getEarliestTicketDate())
                .maxFutureDays(validation.getMaxFutureDays())
                .unusualQuantityLimits(validation.getUnusualQuantity())
                .build();
    }

    @Bean
    public TicketProcessor ticketProcessor(OcrEngine ocrEngine, VendorDetector vendorDetector,
                                           FieldExtractor fieldExtractor, SynonymNormalizer normalizer,
                                           ManifestValidator manifestValidator, DuplicateDetector duplicateDetector,
                                           ReviewQueueRouter router, TicketRepository tickets,
                                           ReviewQueueRepository reviewQueue, ProcessedFileLedger processedFiles,
                                           ProcessingPolicy policy, Clock clock) {
        return new TicketProcessor(ocrEngine, vendorDetector, fieldExtractor, normalizer, manifestValidator,
                duplicateDetector, router, tickets, reviewQueue, processedFiles, policy, clock);
    }

    @Bean
    public BatchConfig batchConfig(PipelineProperties props) {
        PipelineProperties.Batch batch = props.getBatch();
        return BatchConfig.builder()
                .workers(batch.getWorkers())
                .retryAttempts(batch.getRetryAttempts())
                .initialBackoff(batch.getInitialBackoff())
                .maxBackoff(batch.getMaxBackoff())
                .processedBy(batch.getProcessedBy())
                .preloadReferences(props.getPersistence().isPreloadReferenceData())
                .build();
    }

    @Bean
    public BatchProcessor batchProcessor(TicketProcessor ticketProcessor, ReferenceDataSource referenceSource,
                                         ProcessingRunRepository runs, BatchConfig batchConfig, Clock clock) {
        return new BatchProcessor(ticketProcessor, referenceSource, runs, batchConfig, clock);
    }

    private static InputStream open(ResourceLoader resourceLoader, String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Resource not found: " + location);
        }
        return resource.getInputStream();
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    @Configuration
    @ConditionalOnProperty(prefix = "pipeline.persistence", name = "mode", havingValue = "memory", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public TicketRepository ticketRepository() {
            return new InMemoryTicketRepository();
        }

        @Bean
        public ReviewQueueRepository reviewQueueRepository() {
            return new InMemoryReviewQueueRepository();
        }

        @Bean
        public ProcessingRunRepository processingRunRepository() {
            return new InMemoryProcessingRunRepository();
        }

        @Bean
        public ProcessedFileLedger processedFileLedger() {
            return new InMemoryProcessedFileLedger();
        }

        @Bean
        public ReferenceDataSource referenceDataSource(PipelineProperties props, ResourceLoader resourceLoader) {
            String location = props.getReferenceData().getLocation();
            try (InputStream in = open(resourceLoader, location)) {
                return InMemoryReferenceDataSource.load(in);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read reference data from " + location, e);
            }
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "pipeline.persistence", name = "mode", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public TicketRepository ticketRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcTicketRepository(jdbcTemplate);
        }

        @Bean
        public ReviewQueueRepository reviewQueueRepository(JdbcTemplate jdbcTemplate, ObjectMapper pipelineObjectMapper) {
            return new JdbcReviewQueueRepository(jdbcTemplate, pipelineObjectMapper);
        }

        @Bean
        public ProcessingRunRepository processingRunRepository(JdbcTemplate jdbcTemplate,
                                                               ObjectMapper pipelineObjectMapper) {
            return new JdbcProcessingRunRepository(jdbcTemplate, pipelineObjectMapper);
        }

        @Bean
        public ProcessedFileLedger processedFileLedger(JdbcTemplate jdbcTemplate) {
            return new JdbcProcessedFileLedger(jdbcTemplate);
        }

        @Bean
        public ReferenceDataSource referenceDataSource(JdbcTemplate jdbcTemplate) {
            return new JdbcReferenceDataSource(jdbcTemplate);
        }
    }
}
