package slotpost.purge;

import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.lock.LockManager;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.EntryPurger;
import slotpost.spi.MetricsExporter;
import slotpost.util.DaemonThreadFactory;
import slotpost.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes POSTED and SKIPPED entries, with their journal rows, once they have been
 * finished for longer than the retention.
 *
 * <p>A cycle holds the scheduler lock, so it never deletes while a run or an allocation
 * is mutating the schedule; a cycle that finds the lock held is skipped and counted as
 * contention. Deletes are committed per batch until a batch comes back short.
 *
 * <p>The effective cutoff is {@code now - max(retention, journalWindow)}. The journal
 * window is the health monitor's window: journal rows inside it still feed the success
 * rate and must not be purged.
 */
public final class RetentionPurge implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetentionPurge.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EntryPurger purger;
    private final LockManager lockManager;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration retention;
    private final int batchSize;
    private final long intervalSeconds;

    private ScheduledExecutorService loop;
    private volatile boolean closed;

    private RetentionPurge(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.purger = Objects.requireNonNull(builder.purger, "purger");
        this.lockManager = Objects.requireNonNull(builder.lockManager, "lockManager");
        Duration requested = builder.retention != null ? builder.retention : Duration.ofDays(7);
        if (requested.isNegative()) {
            throw new IllegalArgumentException("retention must be >= 0");
        }
        if (builder.journalWindow != null && builder.journalWindow.isNegative()) {
            throw new IllegalArgumentException("journalWindow must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        Duration window = builder.journalWindow != null ? builder.journalWindow : Duration.ZERO;
        this.retention = requested.compareTo(window) >= 0 ? requested : window;
        this.batchSize = builder.batchSize;
        this.intervalSeconds = builder.intervalSeconds;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retention actually applied, after widening to the journal window.
     */
    public Duration retention() {
        return retention;
    }

    /**
     * Runs one purge cycle under the scheduler lock.
     *
     * @return what was deleted, or a skipped report if the lock was held
     * @throws slotpost.ScheduleStoreException if a delete batch fails; earlier batches stay committed
     * @throws IllegalStateException           if this purge has been closed
     */
    public PurgeReport runOnce() {
        if (closed) {
            throw new IllegalStateException("RetentionPurge has been closed");
        }
        Instant cutoff = clock.instant().minus(retention);
        try (LockLease lease = lockManager.acquire()) {
            long deleted = 0;
            int batches = 0;
            int batch;
            do {
                batch = Transactions.inTransaction(connectionProvider,
                    conn -> purger.purge(conn, cutoff, batchSize));
                deleted += batch;
                batches++;
            } while (batch >= batchSize);
            metrics.incrementPurged(deleted);
            if (deleted > 0) {
                logger.log(Level.INFO, "Purged {0} finished entries older than {1}",
                    new Object[]{deleted, cutoff});
            }
            return new PurgeReport(cutoff, deleted, batches, false);
        } catch (LockHeldException e) {
            metrics.incrementLockContended();
            logger.log(Level.INFO, "Skipping purge: {0}", e.getMessage());
            return PurgeReport.skipped(cutoff);
        }
    }

    /**
     * Starts a background cycle every {@code intervalSeconds}. Repeated calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetentionPurge has been closed");
        }
        if (loop != null) {
            return;
        }
        loop = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("slotpost-purge-"));
        loop.scheduleWithFixedDelay(this::runScheduled, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    private void runScheduled() {
        if (closed) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            // an escaping exception cancels the schedule
            logger.log(Level.SEVERE, "Purge cycle failed", e);
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (loop != null) {
            loop.shutdownNow();
            try {
                loop.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loop = null;
        }
    }

    /**
     * Builder for {@link RetentionPurge}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EntryPurger purger;
        private LockManager lockManager;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration retention;
        private Duration journalWindow;
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder purger(EntryPurger purger) {
            this.purger = purger;
            return this;
        }

        /**
         * Scheduler lock shared with the executor and the allocator.
         *
         * <p><b>Required.</b>
         */
        public Builder lockManager(LockManager lockManager) {
            this.lockManager = lockManager;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Optional. Defaults to 7 days. Must be &ge; 0.
         */
        public Builder retention(Duration retention) {
            this.retention = retention;
            return this;
        }

        /**
         * Trailing window of journal rows still read by health evaluation.
         *
         * <p>Optional. The retention is never shorter than this window.
         */
        public Builder journalWindow(Duration journalWindow) {
            this.journalWindow = journalWindow;
            return this;
        }

        /**
         * Optional. Defaults to 500. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Optional. Defaults to 3600. Must be &gt; 0.
         */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public RetentionPurge build() {
            return new RetentionPurge(this);
        }
    }
}
