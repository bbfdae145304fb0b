package com.eainde.truckticket.batch;

import com.eainde.truckticket.model.ProcessingRun;

import java.util.Comparator;
import java.util.List;

/**
 * Aggregate of one batch run. File results are in completion order; use
 * {@link #sortedByPath()} for a deterministic order.
 */
public class BatchResult {

    private final ProcessingRun run;
    private final List<FileResult> fileResults;

    BatchResult(ProcessingRun run, List<FileResult> fileResults) {
        this.run = run;
        this.fileResults = List.copyOf(fileResults);
    }

    public ProcessingRun getRun() {
        return run;
    }

    public String getRequestGuid() {
        return run.requestGuid();
    }

    public List<FileResult> getFileResults() {
        return fileResults;
    }

    public List<FileResult> sortedByPath() {
        return fileResults.stream()
                .sorted(Comparator.comparing(r -> r.getFile().toString()))
                .toList();
    }

    public long count(FileStatus status) {
        return fileResults.stream().filter(r -> r.getStatus() == status).count();
    }

    public int getOkCount() {
        return run.okCount();
    }

    public int getErrorCount() {
        return run.errorCount();
    }

    public int getReviewCount() {
        return run.reviewCount();
    }
}
