package slotpost.spi;

import slotpost.model.EntrySource;

/**
 * Observability hook for exporting scheduler counters and gauges to a metrics backend.
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
     * Increments the count of entries added to the schedule.
     *
     * @param source how the entry was placed
     */
    void incrementScheduled(EntrySource source);

    /**
     * Increments the count of entries published successfully.
     */
    void incrementPosted();

    /**
     * Increments the count of failed attempts sent back to PENDING for another try.
     */
    void incrementRetryScheduled();

    /**
     * Increments the count of entries moved to FAILED.
     */
    void incrementFailed();

    /**
     * Increments the count of FAILED entries re-enqueued by the recovery sweeper.
     */
    void incrementRecovered();

    /**
     * Increments the count of runs that found the lock held by a live owner.
     */
    default void incrementLockContended() {
    }

    /**
     * Increments the count of locks reclaimed from a dead or expired holder.
     */
    default void incrementStaleLockReclaimed() {
    }

    /**
     * Adds the number of finished entries removed by one retention purge cycle.
     */
    default void incrementPurged(long count) {
    }

    /**
     * Records the trailing-window publish success rate.
     *
     * @param rate value in {@code [0, 1]}
     */
    void recordSuccessRate(double rate);

    /**
     * Records the number of PENDING entries.
     */
    void recordPendingDepth(int depth);

    /**
     * Records the time spent in the publisher call.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordPublishLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementScheduled(EntrySource source) {
        }

        @Override
        public void incrementPosted() {
        }

        @Override
        public void incrementRetryScheduled() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementRecovered() {
        }

        @Override
        public void recordSuccessRate(double rate) {
        }

        @Override
        public void recordPendingDepth(int depth) {
        }
    }
}
