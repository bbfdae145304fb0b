package com.eainde.truckticket.batch;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Worker pool and retry settings of a {@link BatchProcessor}.
 *
 * <pre>{@code
 * BatchConfig config = BatchConfig.builder()
 *         .workers(4)
 *         .retryAttempts(2)
 *         .initialBackoff(Duration.ofMillis(500))
 *         .build();
 * }</pre>
 */
public final class BatchConfig {

    private final int workers;
    private final int retryAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final String processedBy;
    private final boolean preloadReferences;

    private BatchConfig(Builder b) {
        this.workers = b.workers > 0 ? b.workers : Runtime.getRuntime().availableProcessors();
        this.retryAttempts = b.retryAttempts;
        this.initialBackoff = b.initialBackoff;
        this.maxBackoff = b.maxBackoff;
        this.processedBy = b.processedBy;
        this.preloadReferences = b.preloadReferences;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BatchConfig withDefaults() {
        return builder().build();
    }

    public int workers() {
        return workers;
    }

    /** Retries after the first attempt; a file is tried at most {@code retryAttempts + 1} times. */
    public int retryAttempts() {
        return retryAttempts;
    }

    public Duration initialBackoff() {
        return initialBackoff;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public String processedBy() {
        return processedBy;
    }

    public boolean preloadReferences() {
        return preloadReferences;
    }

    /**
     * Delay before retry number {@code retry} (1-based): initial * 2^(retry-1), capped.
     */
    public Duration backoffFor(int retry) {
        long millis = initialBackoff.toMillis() << Math.min(Math.max(retry - 1, 0), 20);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("workers", workers);
        snapshot.put("retry_attempts", retryAttempts);
        snapshot.put("initial_backoff_ms", initialBackoff.toMillis());
        snapshot.put("max_backoff_ms", maxBackoff.toMillis());
        snapshot.put("preload_references", preloadReferences);
        return snapshot;
    }

    public static class Builder {
        private int workers = 0;
        private int retryAttempts = 2;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(10);
        private String processedBy = "truck-ticket-pipeline";
        private boolean preloadReferences = false;

        /**
         * Worker threads. Default: 0, meaning one per available processor.
         */
        public Builder workers(int workers) {
            if (workers < 0) throw new IllegalArgumentException("workers must be >= 0");
            this.workers = workers;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            if (retryAttempts < 0) throw new IllegalArgumentException("retryAttempts must be >= 0");
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            if (initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff must be >= 0");
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            if (maxBackoff.isNegative()) throw new IllegalArgumentException("maxBackoff must be >= 0");
            this.maxBackoff = maxBackoff;
            return this;
        }

        /** Operator or host name recorded on the processing run. */
        public Builder processedBy(String processedBy) {
            this.processedBy = processedBy;
            return this;
        }

        /** Load all reference tables before the first file instead of on demand. */
        public Builder preloadReferences(boolean preloadReferences) {
            this.preloadReferences = preloadReferences;
            return this;
        }

        public BatchConfig build() {
            if (maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
            }
            return new BatchConfig(this);
        }
    }
}
