package slotpost.recovery;

import slotpost.allocate.FrontLoadCursor;
import slotpost.allocate.SlotAllocator;
import slotpost.execute.BoundedRetryPolicy;
import slotpost.execute.RetryPolicy;
import slotpost.model.ScheduleEntry;
import slotpost.model.Transition;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.MetricsExporter;
import slotpost.spi.ScheduleStore;
import slotpost.util.Transactions;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Re-enqueues FAILED entries whose last failure was retriable, up to a bounded number
 * per sweep and a bounded number of rounds per entry.
 *
 * <p>A recovered entry keeps its id and content key, gets its error and attempt count
 * cleared, and is placed on the front-load path, so a sweep never creates a second
 * entry for the same content. Each sweep runs in one transaction.
 *
 * <p>Invoked by the executor once per run, before slot selection, while the scheduler
 * lock is held. Create instances via {@link #builder()}.
 */
public final class RecoverySweeper {
    private static final Logger logger = Logger.getLogger(RecoverySweeper.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ScheduleStore store;
    private final SlotAllocator allocator;
    private final RetryPolicy retryPolicy;
    private final int batchSize;
    private final MetricsExporter metrics;
    private final Clock clock;

    private RecoverySweeper(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.allocator = Objects.requireNonNull(builder.allocator, "allocator");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new BoundedRetryPolicy();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one sweep. The caller must hold the scheduler lock.
     *
     * @return the recovered entries
     * @throws slotpost.ScheduleStoreException on database failure (nothing is committed)
     */
    public SweepReport sweep() {
        Instant now = clock.instant();
        List<ScheduleEntry> recovered = Transactions.inTransaction(connectionProvider, conn -> {
            List<ScheduleEntry> candidates = store.findRecoverable(conn,
                retryPolicy.retriableKinds(), retryPolicy.maxRecoveryRounds(), batchSize);
            List<ScheduleEntry> moved = new ArrayList<>(candidates.size());
            if (candidates.isEmpty()) {
                return moved;
            }
            FrontLoadCursor cursor = allocator.frontLoadCursor(conn, now);
            for (ScheduleEntry entry : candidates) {
                if (!retryPolicy.isRecoverable(entry)) {
                    continue;
                }
                moved.add(store.transition(conn, Transition.recover(entry.id(), cursor.next(), now)));
            }
            return moved;
        });

        for (ScheduleEntry entry : recovered) {
            metrics.incrementRecovered();
            logger.log(Level.INFO, "Recovered {0} ({1}) into slot {2}, round {3}",
                new Object[]{entry.id(), entry.contentKey(), entry.scheduledTime(), entry.recoveryRounds()});
        }
        return new SweepReport(recovered, now);
    }

    /**
     * Builder for {@link RecoverySweeper}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ScheduleStore store;
        private SlotAllocator allocator;
        private RetryPolicy retryPolicy;
        private int batchSize = 3;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder store(ScheduleStore store) {
            this.store = store;
            return this;
        }

        /**
         * Allocator whose front-load path receives recovered entries.
         *
         * <p><b>Required.</b>
         */
        public Builder allocator(SlotAllocator allocator) {
            this.allocator = allocator;
            return this;
        }

        /**
         * Optional. Defaults to {@link BoundedRetryPolicy} with 3 recovery rounds.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Maximum entries recovered per sweep.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
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

        public RecoverySweeper build() {
            return new RecoverySweeper(this);
        }
    }
}
