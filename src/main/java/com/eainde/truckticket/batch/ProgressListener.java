package com.eainde.truckticket.batch;

/**
 * Callback invoked once per finished file, from the thread that collects results.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onFileCompleted(BatchProgress progress);
}
