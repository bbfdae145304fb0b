package com.eainde.truckticket.batch;

/**
 * Running totals reported after each file completes.
 *
 * @param lastFile the file that just finished
 */
public record BatchProgress(int completedFiles, int totalFiles, int okCount, int errorCount, int reviewCount,
                            FileResult lastFile) {
}
