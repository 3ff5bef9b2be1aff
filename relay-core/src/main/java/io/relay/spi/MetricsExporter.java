package io.relay.spi;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. The
 * {@code relay-micrometer} module bridges into Micrometer.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of deliveries created by publishing an event.
     */
    void incrementDeliveryEnqueued();

    /**
     * Increments the count of deliveries claimed by the poller.
     */
    void incrementDeliveryClaimed();

    /**
     * Increments the count of attempts answered with a 2xx.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed attempts that were scheduled for retry.
     */
    void incrementDeliveryRetry();

    /**
     * Increments the count of deliveries moved to FAILED_EXHAUSTED.
     */
    void incrementDeliveryExhausted();

    /**
     * Increments the count of claims handed back without an attempt (endpoint disabled,
     * endpoint concurrency cap reached or dispatcher queue full).
     */
    default void incrementDeliverySkipped() {
    }

    /**
     * Records the number of claimed deliveries waiting for a worker.
     *
     * @param depth queue depth
     */
    void recordQueueDepth(int depth);

    /**
     * Records how late the oldest due delivery was when it was claimed.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Records the duration of one HTTP attempt.
     *
     * @param durationMs attempt time in milliseconds (always non-negative)
     */
    default void recordAttemptDurationMs(long durationMs) {
    }

    /** Increments the count of idempotent requests allowed to execute. */
    default void incrementIdempotencyProceed() {
    }

    /** Increments the count of idempotent requests answered from the cache. */
    default void incrementIdempotencyReplay() {
    }

    /** Increments the count of keys reused with a different request. */
    default void incrementIdempotencyConflict() {
    }

    /** Increments the count of requests rejected because the key was locked. */
    default void incrementIdempotencyLocked() {
    }

    /** Increments the count of inbound webhooks accepted for processing. */
    default void incrementIncomingAccepted() {
    }

    /** Increments the count of inbound webhooks acknowledged as duplicates. */
    default void incrementIncomingDuplicate() {
    }

    /** Increments the count of inbound webhooks rejected (signature, source or format). */
    default void incrementIncomingRejected() {
    }

    /** Increments the count of inbound events processed successfully. */
    default void incrementIncomingProcessed() {
    }

    /** Increments the count of inbound events whose processing failed. */
    default void incrementIncomingFailed() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDeliveryEnqueued() {
        }

        @Override
        public void incrementDeliveryClaimed() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryRetry() {
        }

        @Override
        public void incrementDeliveryExhausted() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
