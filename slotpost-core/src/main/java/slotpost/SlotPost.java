package slotpost;

import slotpost.allocate.AllocationResult;
import slotpost.allocate.SlotAllocator;
import slotpost.allocate.SlotGrid;
import slotpost.execute.BoundedRetryPolicy;
import slotpost.execute.ExecutionReport;
import slotpost.execute.RetryPolicy;
import slotpost.execute.ScheduleExecutor;
import slotpost.failed.FailedEntryManager;
import slotpost.health.HealthMonitor;
import slotpost.health.HealthReport;
import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.lock.LockManager;
import slotpost.model.ContentItem;
import slotpost.model.EntryState;
import slotpost.model.ScheduleEntry;
import slotpost.model.ScheduleStatus;
import slotpost.model.StateTransition;
import slotpost.purge.PurgeReport;
import slotpost.purge.RetentionPurge;
import slotpost.recovery.RecoverySweeper;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.ContentDiscovery;
import slotpost.spi.EntryPurger;
import slotpost.spi.MetricsExporter;
import slotpost.spi.Publisher;
import slotpost.spi.ScheduleStore;
import slotpost.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the allocator, recovery sweeper, health monitor,
 * executor, failed-entry tooling and optional purge scheduler into one
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SlotPost slotPost = SlotPost.builder()
 *     .connectionProvider(dataSource::getConnection)
 *     .store(JdbcScheduleStores.detect(dataSource))
 *     .lockManager(new FileLockManager(Path.of("/var/run/slotpost.lock")))
 *     .publisher(cmsClient)
 *     .discovery(feed)
 *     .build()) {
 *   slotPost.discover();
 *   slotPost.runOnce();
 * }
 * }</pre>
 *
 * @see ScheduleExecutor
 * @see SlotAllocator
 */
public final class SlotPost implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SlotPost.class.getName());
  private static final int UPCOMING_IN_STATUS = 5;

  private final ConnectionProvider connectionProvider;
  private final ScheduleStore store;
  private final LockManager lockManager;
  private final ContentDiscovery discovery;
  private final SlotAllocator allocator;
  private final ScheduleExecutor executor;
  private final HealthMonitor healthMonitor;
  private final FailedEntryManager failedEntries;
  private final RetentionPurge retentionPurge;
  private final MetricsExporter metrics;
  private final Clock clock;

  private SlotPost(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.lockManager = Objects.requireNonNull(builder.lockManager, "lockManager");
    Objects.requireNonNull(builder.publisher, "publisher");
    this.discovery = builder.discovery;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    RetryPolicy retryPolicy = new BoundedRetryPolicy(builder.maxAttempts, builder.maxRecoveryRounds);
    this.allocator = SlotAllocator.builder()
        .store(store)
        .grid(new SlotGrid(builder.cadence))
        .frontLoadLead(builder.frontLoadLead)
        .maxProbeSlots(builder.maxProbeSlots)
        .build();
    RecoverySweeper sweeper = RecoverySweeper.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .allocator(allocator)
        .retryPolicy(retryPolicy)
        .batchSize(builder.recoveryBatchSize)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.healthMonitor = HealthMonitor.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .window(builder.healthWindow)
        .threshold(builder.healthThreshold)
        .minSamples(builder.healthMinSamples)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.executor = ScheduleExecutor.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .lockManager(lockManager)
        .publisher(builder.publisher)
        .sweeper(sweeper)
        .retryPolicy(retryPolicy)
        .healthMonitor(healthMonitor)
        .metrics(metrics)
        .clock(clock)
        .publishTimeout(builder.publishTimeout)
        .stuckThreshold(builder.stuckThreshold)
        .catchUpLimit(builder.catchUpLimit)
        .build();
    this.failedEntries = new FailedEntryManager(connectionProvider, store, allocator, lockManager, clock);
    this.retentionPurge = builder.purger == null ? null : RetentionPurge.builder()
        .connectionProvider(connectionProvider)
        .purger(builder.purger)
        .lockManager(lockManager)
        .metrics(metrics)
        .retention(builder.purgeRetention)
        .journalWindow(builder.healthWindow)
        .batchSize(builder.purgeBatchSize)
        .intervalSeconds(builder.purgeIntervalSeconds)
        .clock(clock)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Publishes at most one due entry.
   *
   * @see ScheduleExecutor#runOnce()
   */
  public ExecutionReport runOnce() {
    return executor.runOnce();
  }

  /**
   * Publishes several overdue entries in one run.
   *
   * @see ScheduleExecutor#catchUp(int)
   */
  public ExecutionReport catchUp(int maxSlots) {
    return executor.catchUp(maxSlots);
  }

  /**
   * Runs the recovery sweep without publishing.
   */
  public ExecutionReport recover() {
    return executor.recoverOnly();
  }

  /**
   * Pulls items from the configured {@link ContentDiscovery} and schedules them.
   *
   * @throws IllegalStateException if no discovery source is configured
   * @throws LockHeldException     if an executor run holds the lock
   */
  public AllocationResult discover() throws LockHeldException {
    if (discovery == null) {
      throw new IllegalStateException("No ContentDiscovery configured");
    }
    List<ContentItem> items = discovery.discover();
    logger.log(Level.FINE, "Discovered {0} item(s)", items.size());
    return schedule(items);
  }

  /**
   * Deduplicates and schedules a batch of items in one transaction under the lock.
   *
   * @throws LockHeldException if an executor run holds the lock
   */
  public AllocationResult schedule(List<ContentItem> items) throws LockHeldException {
    Objects.requireNonNull(items, "items");
    if (items.isEmpty()) {
      return AllocationResult.EMPTY;
    }
    try (LockLease lease = lockManager.acquire()) {
      Instant now = clock.instant();
      AllocationResult result = Transactions.inTransaction(connectionProvider,
          conn -> allocator.allocate(conn, items, now));
      for (ScheduleEntry entry : result.scheduled()) {
        metrics.incrementScheduled(entry.source());
        logger.log(Level.INFO, "Scheduled {0} ({1}) at {2}",
            new Object[]{entry.id(), entry.contentKey(), entry.scheduledTime()});
      }
      if (!result.rejectedDuplicates().isEmpty()) {
        logger.log(Level.INFO, "Ignored {0} already scheduled item(s)", result.rejectedDuplicates().size());
      }
      return result;
    }
  }

  /**
   * Summarizes the last committed schedule state.
   */
  public ScheduleStatus status() {
    Instant now = clock.instant();
    Instant startOfDay = now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
    return Transactions.readOnly(connectionProvider, conn -> {
      Map<EntryState, Integer> counts = store.countByState(conn);
      int overdue = store.countOverdue(conn, now);
      List<ScheduleEntry> upcoming = store.upcoming(conn, UPCOMING_IN_STATUS);
      Map<EntryState, Integer> today = store.countTransitionsSince(conn, startOfDay);
      Instant nextDue = upcoming.isEmpty() ? null : upcoming.get(0).scheduledTime();
      return new ScheduleStatus(counts, overdue, nextDue, upcoming,
          today.getOrDefault(EntryState.POSTED, 0),
          today.getOrDefault(EntryState.FAILED, 0),
          now);
    });
  }

  public HealthReport health() {
    return healthMonitor.evaluate();
  }

  public FailedEntryManager failedEntries() {
    return failedEntries;
  }

  public Optional<ScheduleEntry> entry(String entryId) {
    return Transactions.readOnly(connectionProvider, conn -> store.findById(conn, entryId));
  }

  /**
   * Journal of one entry, oldest first.
   */
  public List<StateTransition> history(String entryId) {
    Objects.requireNonNull(entryId, "entryId");
    return Transactions.readOnly(connectionProvider, conn -> store.history(conn, entryId));
  }

  /**
   * Runs one retention purge cycle now, under the scheduler lock.
   *
   * @return what was deleted; {@link PurgeReport#lockHeld()} if a run held the lock
   * @throws IllegalStateException if no purger is configured
   */
  public PurgeReport purge() {
    if (retentionPurge == null) {
      throw new IllegalStateException("No EntryPurger configured");
    }
    return retentionPurge.runOnce();
  }

  /**
   * Starts the background purge loop, if a purger is configured.
   */
  public void startPurging() {
    if (retentionPurge != null) {
      retentionPurge.start();
    }
  }

  public SlotAllocator allocator() {
    return allocator;
  }

  public ScheduleExecutor executor() {
    return executor;
  }

  /**
   * Shuts down the purge scheduler, then the executor's publisher thread, then the
   * metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (retentionPurge != null) {
      try {
        retentionPurge.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      executor.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link SlotPost}. Defaults: 15-minute cadence, 2-minute front-load lead,
   * 3 attempts, 3 recovery rounds, recovery batch of 3, 3-minute publish timeout,
   * catch-up limit 3, 24-hour health window at 0.90 with 10 minimum samples,
   * 7-day purge retention.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ScheduleStore store;
    private LockManager lockManager;
    private Publisher publisher;
    private ContentDiscovery discovery;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration cadence = SlotGrid.DEFAULT_CADENCE;
    private Duration frontLoadLead = Duration.ofMinutes(2);
    private int maxProbeSlots;
    private int maxAttempts = BoundedRetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private int maxRecoveryRounds = BoundedRetryPolicy.DEFAULT_MAX_RECOVERY_ROUNDS;
    private int recoveryBatchSize = 3;
    private Duration publishTimeout = Duration.ofMinutes(3);
    private Duration stuckThreshold;
    private int catchUpLimit = 3;
    private Duration healthWindow = Duration.ofHours(24);
    private double healthThreshold = 0.90;
    private int healthMinSamples = 10;
    private EntryPurger purger;
    private Duration purgeRetention = Duration.ofDays(7);
    private int purgeBatchSize = 500;
    private long purgeIntervalSeconds = 3600;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(ScheduleStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder lockManager(LockManager lockManager) {
      this.lockManager = lockManager;
      return this;
    }

    /** <b>Required.</b> */
    public Builder publisher(Publisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /** Optional; required by {@link SlotPost#discover()}. */
    public Builder discovery(ContentDiscovery discovery) {
      this.discovery = discovery;
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

    public Builder cadence(Duration cadence) {
      this.cadence = Objects.requireNonNull(cadence, "cadence");
      return this;
    }

    public Builder frontLoadLead(Duration frontLoadLead) {
      this.frontLoadLead = Objects.requireNonNull(frontLoadLead, "frontLoadLead");
      return this;
    }

    /** Optional. Defaults to four days of slots. */
    public Builder maxProbeSlots(int maxProbeSlots) {
      this.maxProbeSlots = maxProbeSlots;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder maxRecoveryRounds(int maxRecoveryRounds) {
      this.maxRecoveryRounds = maxRecoveryRounds;
      return this;
    }

    public Builder recoveryBatchSize(int recoveryBatchSize) {
      this.recoveryBatchSize = recoveryBatchSize;
      return this;
    }

    public Builder publishTimeout(Duration publishTimeout) {
      this.publishTimeout = Objects.requireNonNull(publishTimeout, "publishTimeout");
      return this;
    }

    /** Optional. Defaults to twice the publish timeout. */
    public Builder stuckThreshold(Duration stuckThreshold) {
      this.stuckThreshold = stuckThreshold;
      return this;
    }

    public Builder catchUpLimit(int catchUpLimit) {
      this.catchUpLimit = catchUpLimit;
      return this;
    }

    public Builder healthWindow(Duration healthWindow) {
      this.healthWindow = Objects.requireNonNull(healthWindow, "healthWindow");
      return this;
    }

    public Builder healthThreshold(double healthThreshold) {
      this.healthThreshold = healthThreshold;
      return this;
    }

    public Builder healthMinSamples(int healthMinSamples) {
      this.healthMinSamples = healthMinSamples;
      return this;
    }

    /** Optional. Enables {@link SlotPost#purge()} and {@link SlotPost#startPurging()}. */
    public Builder purger(EntryPurger purger) {
      this.purger = purger;
      return this;
    }

    public Builder purgeRetention(Duration purgeRetention) {
      this.purgeRetention = Objects.requireNonNull(purgeRetention, "purgeRetention");
      return this;
    }

    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return this;
    }

    /**
     * Builds the composite.
     *
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if a limit or duration is out of range
     */
    public SlotPost build() {
      return new SlotPost(this);
    }
  }
}
