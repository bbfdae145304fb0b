package com.eainde.truckticket.batch;

import com.eainde.truckticket.exception.TicketPipelineException;
import com.eainde.truckticket.exception.TransientProcessingException;
import com.eainde.truckticket.model.ProcessingRun;
import com.eainde.truckticket.model.RunStatus;
import com.eainde.truckticket.ocr.OcrException;
import com.eainde.truckticket.processor.CancellationToken;
import com.eainde.truckticket.processor.FileProcessingResult;
import com.eainde.truckticket.processor.FileTransaction;
import com.eainde.truckticket.processor.RunContext;
import com.eainde.truckticket.processor.TicketProcessor;
import com.eainde.truckticket.reference.ReferenceDataCache;
import com.eainde.truckticket.reference.ReferenceDataSource;
import com.eainde.truckticket.repository.ProcessingRunRepository;
import com.eainde.truckticket.thread.MdcAwareExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.TransientDataAccessException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;

/**
 * Runs the {@link TicketProcessor} over many files on a fixed worker pool.
 *
 * <h3>Failure isolation</h3>
 * <p>Each file is an independent task. A transient failure ({@link IOException},
 * {@link OcrException}, {@link TransientProcessingException}, Spring
 * {@link TransientDataAccessException}) is retried up to {@code retryAttempts} times with
 * exponential backoff; every failed attempt is rolled back before the next one, so a
 * retried file never leaves tickets from an earlier attempt behind. Any other runtime
 * failure marks the file ERROR at once. Rollback only ever touches the failing file; if the
 * rollback itself fails, the file is reported ERROR with the orphaned ids and is not retried,
 * while the other files carry on.</p>
 *
 * <h3>Ordering</h3>
 * <p>Pages of a file run sequentially on the owning worker. Files complete in any order;
 * {@link BatchResult#sortedByPath()} gives a deterministic view.</p>
 *
 * <h3>Cancellation</h3>
 * <p>In-flight files stop after their current page and are rolled back (CANCELLED); files
 * not yet started are SKIPPED.</p>
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    static final String MDC_REQUEST_GUID = "requestGuid";

    /** Blocks the worker between retries. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final TicketProcessor ticketProcessor;
    private final ReferenceDataSource referenceSource;
    private final ProcessingRunRepository runs;
    private final BatchConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    public BatchProcessor(TicketProcessor ticketProcessor, ReferenceDataSource referenceSource,
                          ProcessingRunRepository runs, BatchConfig config, Clock clock) {
        this(ticketProcessor, referenceSource, runs, config, clock, d -> Thread.sleep(d.toMillis()));
    }

    BatchProcessor(TicketProcessor ticketProcessor, ReferenceDataSource referenceSource,
                   ProcessingRunRepository runs, BatchConfig config, Clock clock, Sleeper sleeper) {
        this.ticketProcessor = ticketProcessor;
        this.referenceSource = referenceSource;
        this.runs = runs;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public BatchResult process(List<Path> files) {
        return process(files, new CancellationToken(), ProgressListener.NONE);
    }

    /**
     * Processes {@code files} and seals the processing run.
     *
     * @throws TicketPipelineException if the batch itself cannot complete; the run is sealed
     *                                 FAILED (or CANCELLED when interrupted)
     */
    public BatchResult process(List<Path> files, CancellationToken cancellation, ProgressListener listener) {
        String requestGuid = UUID.randomUUID().toString();
        String previousGuid = MDC.get(MDC_REQUEST_GUID);
        MDC.put(MDC_REQUEST_GUID, requestGuid);

        ProcessingRunLedger ledger = new ProcessingRunLedger(runs, clock);
        ledger.start(requestGuid, files.size(), config.processedBy(), config.snapshot());

        int threads = Math.max(1, Math.min(config.workers(), files.size()));
        MdcAwareExecutor executor = new MdcAwareExecutor(threads, "ticket-worker");
        try {
            // fresh cache per run
            ReferenceDataCache references = new ReferenceDataCache(referenceSource);
            if (config.preloadReferences()) {
                references.preload();
            }
            RunContext run = new RunContext(requestGuid, references, cancellation);

            CompletionService<FileResult> completion = new ExecutorCompletionService<>(executor);
            for (Path file : files) {
                completion.submit(() -> processWithRetry(file, run));
            }

            List<FileResult> results = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                FileResult result = completion.take().get();
                results.add(result);
                ProcessingRun progress = ledger.recordFile(result);
                log.info("[{}/{}] {}", i + 1, files.size(), result);
                notify(listener, new BatchProgress(i + 1, files.size(), progress.okCount(), progress.errorCount(),
                        progress.reviewCount(), result));
            }

            ProcessingRun sealed = ledger.seal(finalStatus(results, cancellation));
            return new BatchResult(sealed, results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            ledger.seal(RunStatus.CANCELLED);
            throw new TicketPipelineException("Interrupted while waiting for batch " + requestGuid, e);
        } catch (ExecutionException e) {
            ledger.fail(e.getCause());
            throw new TicketPipelineException("Failed to process batch " + requestGuid, e.getCause());
        } catch (RuntimeException e) {
            ledger.fail(e);
            throw e;
        } finally {
            executor.shutdownNow();
            if (previousGuid == null) {
                MDC.remove(MDC_REQUEST_GUID);
            } else {
                MDC.put(MDC_REQUEST_GUID, previousGuid);
            }
        }
    }

    // =========================================================================
    // Per file
    // =========================================================================

    FileResult processWithRetry(Path file, RunContext run) {
        if (run.cancellation().isCancelled()) {
            log.info("Skipping {}: batch cancelled", file);
            return FileResult.skipped(file);
        }
        FileTransaction tx = new FileTransaction();
        int maxAttempts = config.retryAttempts() + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                FileProcessingResult result = ticketProcessor.processFile(file, run, tx);
                switch (result.status()) {
                    case ALREADY_PROCESSED:
                        return FileResult.alreadyProcessed(file, result.ticketIds());
                    case CANCELLED:
                        String cancelRollback = rollback(file, tx);
                        if (cancelRollback != null) {
                            return FileResult.error(file, attempt, "Cancelled; " + cancelRollback);
                        }
                        return FileResult.cancelled(file, attempt);
                    default:
                        return FileResult.ok(file, attempt, result.pages().size(), result.committedCount(),
                                result.queuedCount(), result.duplicateCount(), result.ticketIds());
                }
            } catch (IOException | OcrException | TransientProcessingException | TransientDataAccessException e) {
                String rollbackFailure = rollback(file, tx);
                if (rollbackFailure != null) {
                    log.error("Not retrying {}: attempt {} could not be rolled back", file, attempt, e);
                    return FileResult.error(file, attempt, describe(e) + "; " + rollbackFailure);
                }
                if (attempt >= maxAttempts) {
                    log.error("Giving up on {} after {} attempts", file, attempt, e);
                    return FileResult.error(file, attempt, describe(e));
                }
                Duration delay = config.backoffFor(attempt);
                log.warn("Transient failure on {} (attempt {}/{}), retrying in {} ms: {}",
                        file, attempt, maxAttempts, delay.toMillis(), e.toString());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.info("Interrupted while backing off on {}", file);
                    return FileResult.cancelled(file, attempt);
                }
                if (run.cancellation().isCancelled()) {
                    return FileResult.cancelled(file, attempt);
                }
            } catch (RuntimeException e) {
                log.error("Failed to process {}", file, e);
                String rollbackFailure = rollback(file, tx);
                return FileResult.error(file, attempt,
                        rollbackFailure == null ? describe(e) : describe(e) + "; " + rollbackFailure);
            }
        }
    }

    /**
     * Undoes the current attempt of {@code file}.
     *
     * @return null when the attempt was rolled back, otherwise a description of the failure;
     *         the orphaned ids are logged for manual cleanup
     */
    private String rollback(Path file, FileTransaction tx) {
        try {
            ticketProcessor.rollback(tx);
            return null;
        } catch (RuntimeException e) {
            log.error("Failed to roll back {}; committed ids {} and review ids {} need manual cleanup",
                    file, tx.committedTicketIds(), tx.reviewEntryIds(), e);
            return "rollback failed (" + describe(e) + "), orphaned ticket ids " + tx.committedTicketIds()
                    + ", review ids " + tx.reviewEntryIds();
        }
    }

    private static RunStatus finalStatus(List<FileResult> results, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return RunStatus.CANCELLED;
        }
        long errors = results.stream().filter(r -> r.getStatus() == FileStatus.ERROR).count();
        if (errors == 0) {
            return RunStatus.COMPLETED;
        }
        return errors == results.size() ? RunStatus.FAILED : RunStatus.PARTIAL;
    }

    private static void notify(ProgressListener listener, BatchProgress progress) {
        try {
            listener.onFileCompleted(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {}", progress.lastFile().getFile(), e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }
}
