package com.eainde.truckticket.batch;

import com.eainde.truckticket.model.ProcessingRun;
import com.eainde.truckticket.model.RunStatus;
import com.eainde.truckticket.repository.ProcessingRunRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;

/**
 * Append-only bookkeeping of one {@link ProcessingRun}: opened at batch start, updated
 * after every file, sealed once. Calls are serialized; only the collecting thread writes.
 */
@Slf4j
public class ProcessingRunLedger {

    private final ProcessingRunRepository runs;
    private final Clock clock;
    private ProcessingRun current;

    ProcessingRunLedger(ProcessingRunRepository runs, Clock clock) {
        this.runs = runs;
        this.clock = clock;
    }

    synchronized ProcessingRun start(String requestGuid, int filesCount, String processedBy,
                                     Map<String, Object> configSnapshot) {
        current = ProcessingRun.inProgress(requestGuid, filesCount, processedBy, configSnapshot, clock.instant());
        runs.insert(current);
        log.info("Processing run {} started: {} files", requestGuid, filesCount);
        return current;
    }

    synchronized ProcessingRun recordFile(FileResult result) {
        int errors = result.getStatus() == FileStatus.ERROR ? 1 : 0;
        current = current.plus(result.getPages(), result.getCommitted(), errors, result.getQueued(),
                result.getDuplicates());
        runs.update(current);
        return current;
    }

    synchronized ProcessingRun seal(RunStatus status) {
        current = current.seal(status, clock.instant());
        runs.update(current);
        log.info("Processing run {} sealed {}: pages={} ok={} errors={} review={} duplicates={}",
                current.requestGuid(), status, current.pagesCount(), current.okCount(), current.errorCount(),
                current.reviewCount(), current.duplicatesFound());
        return current;
    }

    /**
     * Seals the run as FAILED after an unexpected error in the batch itself.
     */
    synchronized ProcessingRun fail(Throwable cause) {
        log.error("Processing run {} failed", current.requestGuid(), cause);
        return current.isSealed() ? current : seal(RunStatus.FAILED);
    }

    synchronized ProcessingRun current() {
        return current;
    }
}
