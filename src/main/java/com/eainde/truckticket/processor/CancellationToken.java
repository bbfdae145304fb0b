package com.eainde.truckticket.processor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch-wide stop signal. Workers check it between pages and before starting a file.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
