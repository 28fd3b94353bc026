package slotpost.execute;

import slotpost.IllegalTransitionException;
import slotpost.ScheduleConflictException;
import slotpost.ScheduleStoreException;
import slotpost.health.HealthMonitor;
import slotpost.health.HealthReport;
import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.lock.LockManager;
import slotpost.model.EntryState;
import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;
import slotpost.model.Transition;
import slotpost.recovery.RecoverySweeper;
import slotpost.recovery.SweepReport;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.MetricsExporter;
import slotpost.spi.PublishException;
import slotpost.spi.PublishTimeoutException;
import slotpost.spi.Publisher;
import slotpost.spi.ScheduleStore;
import slotpost.spi.TransientPublishException;
import slotpost.util.DaemonThreadFactory;
import slotpost.util.Transactions;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes due schedule entries under the scheduler lock.
 *
 * <p>One {@link #runOnce()} acquires the lock, settles entries left IN_PROGRESS by a
 * crashed run, runs the recovery sweep, picks the earliest due PENDING entry and
 * publishes it. The IN_PROGRESS transition is committed before the publisher is
 * called and the result is committed afterwards, so a crash between the two is found
 * on the next run. Such an entry is settled as a {@link ErrorKind#TIMEOUT} failure and
 * may be published twice.
 *
 * <p>The publisher runs on a dedicated daemon thread bounded by the publish timeout;
 * a call that exceeds it is cancelled and counted as a timeout. Store and lock
 * failures end the run with {@link ExecutionOutcome#STORE_ERROR} and never propagate.
 *
 * <p>The executor never schedules itself: an external trigger calls {@link #runOnce()}
 * once per slot. Create instances via {@link #builder()}.
 *
 * @see ScheduleExecutor.Builder
 */
public final class ScheduleExecutor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ScheduleExecutor.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ScheduleStore store;
    private final LockManager lockManager;
    private final Publisher publisher;
    private final RecoverySweeper sweeper;
    private final RetryPolicy retryPolicy;
    private final HealthMonitor healthMonitor;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration publishTimeout;
    private final Duration stuckThreshold;
    private final int catchUpLimit;

    private ExecutorService publishWorker;
    private volatile ExecutionPhase phase = ExecutionPhase.IDLE;
    private volatile boolean closed;

    private ScheduleExecutor(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.lockManager = Objects.requireNonNull(builder.lockManager, "lockManager");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");

        Duration publishTimeout = builder.publishTimeout != null ? builder.publishTimeout : Duration.ofMinutes(3);
        if (publishTimeout.isNegative() || publishTimeout.isZero()) {
            throw new IllegalArgumentException("publishTimeout must be positive");
        }
        Duration stuckThreshold = builder.stuckThreshold != null ? builder.stuckThreshold : publishTimeout.multipliedBy(2);
        if (stuckThreshold.compareTo(publishTimeout) <= 0) {
            throw new IllegalArgumentException("stuckThreshold must exceed publishTimeout");
        }
        if (builder.catchUpLimit <= 0) {
            throw new IllegalArgumentException("catchUpLimit must be > 0");
        }

        this.sweeper = builder.sweeper;
        this.healthMonitor = builder.healthMonitor;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new BoundedRetryPolicy();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.publishTimeout = publishTimeout;
        this.stuckThreshold = stuckThreshold;
        this.catchUpLimit = builder.catchUpLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Publishes at most one due entry.
     */
    public ExecutionReport runOnce() {
        return execute(1);
    }

    /**
     * Publishes up to {@code min(maxSlots, catchUpLimit)} due entries in slot order under
     * a single lock and sweep. Each entry is attempted at most once per call; an entry
     * returned to PENDING for retry waits for the next invocation. Stops early when nothing
     * else is due, on a store error, or after an authentication failure.
     *
     * @throws IllegalArgumentException if {@code maxSlots <= 0}
     */
    public ExecutionReport catchUp(int maxSlots) {
        if (maxSlots <= 0) {
            throw new IllegalArgumentException("maxSlots must be > 0");
        }
        return execute(Math.min(maxSlots, catchUpLimit));
    }

    /**
     * Acquires the lock and runs the recovery sweep without publishing.
     */
    public ExecutionReport recoverOnly() {
        return execute(0);
    }

    /**
     * Phase of the invocation in progress, {@link ExecutionPhase#IDLE} between runs.
     */
    public ExecutionPhase phase() {
        return phase;
    }

    private synchronized ExecutionReport execute(int maxSlots) {
        if (closed) {
            throw new IllegalStateException("ScheduleExecutor has been closed");
        }
        Instant startedAt = clock.instant();
        List<PublishAttempt> attempts = new ArrayList<>();
        int recovered = 0;
        int reconciled = 0;
        try (LockLease lease = lockManager.acquire()) {
            enter(ExecutionPhase.LOCK_ACQUIRED);
            reconciled = reconcileStuck();
            if (sweeper != null) {
                SweepReport sweep = sweeper.sweep();
                recovered = sweep.count();
            }
            enter(ExecutionPhase.RECOVERY_SWEPT);

            Set<String> attempted = new HashSet<>();
            for (int i = 0; i < maxSlots; i++) {
                Optional<ScheduleEntry> due = nextDue(clock.instant(), attempted);
                if (due.isEmpty()) {
                    break;
                }
                enter(ExecutionPhase.SLOT_SELECTED);
                PublishAttempt attempt = attempt(due.get());
                attempts.add(attempt);
                attempted.add(due.get().id());
                if (attempt.errorKind() == ErrorKind.AUTH) {
                    break;
                }
            }

            HealthReport health = evaluateHealth();
            ExecutionOutcome outcome = attempts.isEmpty()
                ? ExecutionOutcome.NO_ACTION
                : attempts.get(attempts.size() - 1).outcome();
            if (outcome == ExecutionOutcome.NO_ACTION && maxSlots > 0) {
                logger.log(Level.FINE, "No entry due at {0}", startedAt);
            }
            return new ExecutionReport(outcome, attempts, recovered, reconciled, health, startedAt, clock.instant());
        } catch (LockHeldException e) {
            metrics.incrementLockContended();
            logger.log(Level.WARNING, "Skipping run: {0}", e.getMessage());
            return new ExecutionReport(ExecutionOutcome.LOCK_HELD, List.of(), 0, 0, null, startedAt, clock.instant());
        } catch (ScheduleStoreException | IllegalTransitionException | ScheduleConflictException
                 | UncheckedIOException e) {
            logger.log(Level.SEVERE, "Run aborted by schedule store failure", e);
            return new ExecutionReport(ExecutionOutcome.STORE_ERROR, attempts, recovered, reconciled, null,
                startedAt, clock.instant());
        } finally {
            enter(ExecutionPhase.IDLE);
        }
    }

    /**
     * Earliest due PENDING entry not yet attempted in this run. A retried entry keeps its
     * slot and stays due, so it is left for the next invocation.
     */
    private Optional<ScheduleEntry> nextDue(Instant now, Set<String> attempted) {
        return Transactions.readOnly(connectionProvider, conn -> {
            if (attempted.isEmpty()) {
                return store.nextDue(conn, now);
            }
            return store.upcoming(conn, attempted.size() + 1).stream()
                .filter(e -> !e.scheduledTime().isAfter(now) && !attempted.contains(e.id()))
                .findFirst();
        });
    }

    private PublishAttempt attempt(ScheduleEntry due) {
        Instant startAt = clock.instant();
        ScheduleEntry started = Transactions.inTransaction(connectionProvider,
            conn -> store.transition(conn, Transition.start(due.id(), startAt)));
        enter(ExecutionPhase.PUBLISHING);
        logger.log(Level.FINE, "Publishing {0} ({1}) for slot {2}, attempt {3}",
            new Object[]{started.id(), started.contentKey(), started.scheduledTime(), started.attemptCount()});

        long t0 = System.nanoTime();
        String postId;
        try {
            postId = invokePublisher(started);
        } catch (PublishException e) {
            long latencyMs = elapsedMs(t0);
            metrics.recordPublishLatencyMs(latencyMs);
            return settleFailure(started, e.kind(), describe(e), latencyMs);
        }
        long latencyMs = elapsedMs(t0);
        metrics.recordPublishLatencyMs(latencyMs);

        Instant doneAt = clock.instant();
        ScheduleEntry posted = Transactions.inTransaction(connectionProvider,
            conn -> store.transition(conn, Transition.posted(started.id(), postId, doneAt)));
        enter(ExecutionPhase.COMPLETED);
        metrics.incrementPosted();
        logger.log(Level.INFO, "Posted {0} ({1}) for slot {2} as {3}",
            new Object[]{posted.id(), posted.contentKey(), posted.scheduledTime(), postId});
        return new PublishAttempt(posted, ExecutionOutcome.POSTED, null, null, latencyMs);
    }

    private String invokePublisher(ScheduleEntry entry) throws PublishException {
        Future<String> future = worker().submit(() -> publisher.publish(entry.payload(), entry.scheduledTime()));
        try {
            String postId = future.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (postId == null || postId.isBlank()) {
                throw new TransientPublishException("Publisher returned no post id");
            }
            return postId;
        } catch (TimeoutException e) {
            future.cancel(true);
            abandonWorker();
            throw new PublishTimeoutException(publishTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PublishException pe) {
                throw pe;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TransientPublishException("Publisher failed unexpectedly: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientPublishException("Interrupted while waiting for the publisher", e);
        }
    }

    private PublishAttempt settleFailure(ScheduleEntry entry, ErrorKind kind, String error, long latencyMs) {
        Instant at = clock.instant();
        RetryPolicy.Decision decision = retryPolicy.onFailure(entry.attemptCount(), kind);
        enter(ExecutionPhase.FAILED);
        if (decision == RetryPolicy.Decision.RETRY) {
            ScheduleEntry retried = Transactions.inTransaction(connectionProvider,
                conn -> store.transition(conn, Transition.retry(entry.id(), kind, error, at)));
            metrics.incrementRetryScheduled();
            logger.log(Level.WARNING, "Attempt {0} of {1} for {2} failed ({3}): {4}; will retry in slot {5}",
                new Object[]{entry.attemptCount(), retryPolicy.maxAttempts(), entry.id(), kind, error,
                    retried.scheduledTime()});
            return new PublishAttempt(retried, ExecutionOutcome.RETRY_SCHEDULED, kind, error, latencyMs);
        }
        ScheduleEntry failed = Transactions.inTransaction(connectionProvider,
            conn -> store.transition(conn, Transition.failed(entry.id(), kind, error, at)));
        metrics.incrementFailed();
        logger.log(Level.SEVERE, "Entry {0} ({1}) failed after {2} attempt(s) ({3}): {4}",
            new Object[]{failed.id(), failed.contentKey(), failed.attemptCount(), kind, error});
        return new PublishAttempt(failed, ExecutionOutcome.FAILED, kind, error, latencyMs);
    }

    private int reconcileStuck() {
        Instant cutoff = clock.instant().minus(stuckThreshold);
        List<ScheduleEntry> stuck = Transactions.readOnly(connectionProvider,
            conn -> store.findStuckInProgress(conn, cutoff));
        for (ScheduleEntry entry : stuck) {
            logger.log(Level.WARNING, "Entry {0} ({1}) has been IN_PROGRESS since {2}; "
                    + "settling as timed out, the post may already exist",
                new Object[]{entry.id(), entry.contentKey(), entry.updatedAt()});
            settleFailure(entry, ErrorKind.TIMEOUT, "Run ended before the publish result was recorded", 0L);
        }
        return stuck.size();
    }

    private HealthReport evaluateHealth() {
        try {
            int pending = Transactions.readOnly(connectionProvider,
                conn -> store.countByState(conn).getOrDefault(EntryState.PENDING, 0));
            metrics.recordPendingDepth(pending);
            return healthMonitor != null ? healthMonitor.evaluate() : null;
        } catch (ScheduleStoreException e) {
            logger.log(Level.WARNING, "Health evaluation failed", e);
            return null;
        }
    }

    private synchronized ExecutorService worker() {
        if (publishWorker == null) {
            publishWorker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("slotpost-publish-"));
        }
        return publishWorker;
    }

    private synchronized void abandonWorker() {
        if (publishWorker != null) {
            publishWorker.shutdownNow();
            publishWorker = null;
        }
    }

    private void enter(ExecutionPhase next) {
        phase = next;
        logger.log(Level.FINEST, "Executor phase {0}", next);
    }

    private static String describe(PublishException e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    /**
     * Stops the publisher thread. Subsequent runs fail with {@link IllegalStateException}.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (publishWorker != null) {
            publishWorker.shutdownNow();
            try {
                publishWorker.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            publishWorker = null;
        }
    }

    /**
     * Builder for {@link ScheduleExecutor}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ScheduleStore store;
        private LockManager lockManager;
        private Publisher publisher;
        private RecoverySweeper sweeper;
        private RetryPolicy retryPolicy;
        private HealthMonitor healthMonitor;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration publishTimeout;
        private Duration stuckThreshold;
        private int catchUpLimit = 3;

        private Builder() {
        }

        /**
         * Sets the connection provider for obtaining JDBC connections.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the schedule store.
         *
         * <p><b>Required.</b>
         *
         * @param store the persistence backend
         * @return this builder
         */
        public Builder store(ScheduleStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the lock manager guarding each run.
         *
         * <p><b>Required.</b>
         *
         * @param lockManager the lock manager
         * @return this builder
         */
        public Builder lockManager(LockManager lockManager) {
            this.lockManager = lockManager;
            return this;
        }

        /**
         * Sets the client of the content endpoint.
         *
         * <p><b>Required.</b>
         *
         * @param publisher the publisher
         * @return this builder
         */
        public Builder publisher(Publisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /**
         * Sets the recovery sweeper run before slot selection.
         *
         * <p>Optional. Without one, FAILED entries are never re-enqueued automatically.
         *
         * @param sweeper the recovery sweeper
         * @return this builder
         */
        public Builder sweeper(RecoverySweeper sweeper) {
            this.sweeper = sweeper;
            return this;
        }

        /**
         * Sets the retry policy deciding between retry and failure.
         *
         * <p>Optional. Defaults to {@link BoundedRetryPolicy} with 3 attempts.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the health monitor evaluated at the end of each run.
         *
         * <p>Optional.
         *
         * @param healthMonitor the health monitor
         * @return this builder
         */
        public Builder healthMonitor(HealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the time source.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the bound on a single publisher call.
         *
         * <p>Optional. Defaults to 3 minutes. Must be positive.
         *
         * @param publishTimeout the publish timeout
         * @return this builder
         */
        public Builder publishTimeout(Duration publishTimeout) {
            this.publishTimeout = publishTimeout;
            return this;
        }

        /**
         * Sets how long an entry may stay IN_PROGRESS before a later run settles it as
         * timed out.
         *
         * <p>Optional. Defaults to twice the publish timeout. Must exceed the publish timeout.
         *
         * @param stuckThreshold the stuck threshold
         * @return this builder
         */
        public Builder stuckThreshold(Duration stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
            return this;
        }

        /**
         * Sets the maximum entries published by one {@link ScheduleExecutor#catchUp} call.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
         *
         * @param catchUpLimit the catch-up limit
         * @return this builder
         */
        public Builder catchUpLimit(int catchUpLimit) {
            this.catchUpLimit = catchUpLimit;
            return this;
        }

        /**
         * Builds the executor.
         *
         * @return a new {@link ScheduleExecutor}
         * @throws NullPointerException     if {@code connectionProvider}, {@code store},
         *                                  {@code lockManager} or {@code publisher} is null
         * @throws IllegalArgumentException if a timeout or limit is out of range
         */
        public ScheduleExecutor build() {
            return new ScheduleExecutor(this);
        }
    }
}
