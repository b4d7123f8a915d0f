package io.ledgerbridge.spi;

/**
 * Observability hook for exporting bridge counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of batches handed to adapters.
     *
     * @param messageCount number of messages in the batch
     */
    void incrementBatchSent(int messageCount);

    /**
     * Records subsidy debited for one batch.
     *
     * @param amount the debited amount
     */
    void recordSubsidyDebited(long amount);

    /**
     * Increments the count of flushes refused for insufficient subsidy.
     */
    void incrementUnfundedFlush();

    /**
     * Increments the count of inbound votes recorded.
     */
    void incrementVoteRecorded();

    /**
     * Increments the count of inbound votes ignored as repeats or arriving after delivery.
     */
    void incrementDuplicateVote();

    /**
     * Increments the count of batches delivered after quorum.
     */
    void incrementBatchDelivered();

    /**
     * Increments the count of inbound messages handled successfully.
     */
    void incrementMessageHandled();

    /**
     * Increments the count of inbound messages whose handler failed.
     */
    void incrementMessageFailed();

    /**
     * Increments the count of payloads injected through manual recovery.
     */
    default void incrementRecovery() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementBatchSent(int messageCount) {
        }

        @Override
        public void recordSubsidyDebited(long amount) {
        }

        @Override
        public void incrementUnfundedFlush() {
        }

        @Override
        public void incrementVoteRecorded() {
        }

        @Override
        public void incrementDuplicateVote() {
        }

        @Override
        public void incrementBatchDelivered() {
        }

        @Override
        public void incrementMessageHandled() {
        }

        @Override
        public void incrementMessageFailed() {
        }
    }
}
