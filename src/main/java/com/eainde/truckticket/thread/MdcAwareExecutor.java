package com.eainde.truckticket.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker threads that run each task with the MDC of the thread that
 * submitted it.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads, String namePrefix) {
        this.delegate = Executors.newFixedThreadPool(threads, namedThreads(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the submitting thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /**
     * Stops accepting tasks and waits for running ones.
     *
     * @return true if all tasks finished within the timeout
     */
    public boolean shutdown(long timeout, TimeUnit unit) throws InterruptedException {
        delegate.shutdown();
        return delegate.awaitTermination(timeout, unit);
    }

    public void shutdownNow() {
        delegate.shutdownNow();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
