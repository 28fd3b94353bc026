package slotpost.execute;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import slotpost.InMemoryScheduleStore;
import slotpost.MutableClock;
import slotpost.RecordingMetrics;
import slotpost.ScheduleStoreException;
import slotpost.ScriptedPublisher;
import slotpost.TestConnections;
import slotpost.allocate.SlotAllocator;
import slotpost.health.HealthMonitor;
import slotpost.lock.FileLockManager;
import slotpost.lock.LockLease;
import slotpost.model.ContentItem;
import slotpost.model.EntrySource;
import slotpost.model.EntryState;
import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;
import slotpost.model.StateTransition;
import slotpost.model.Transition;
import slotpost.recovery.RecoverySweeper;
import slotpost.spi.AuthPublishException;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.Publisher;
import slotpost.spi.TransientPublishException;
import slotpost.spi.ValidationPublishException;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleExecutorTest {

  @TempDir
  Path dir;

  private final Connection conn = TestConnections.dummyConnection();
  private final ConnectionProvider provider = TestConnections.dummyProvider();
  private InMemoryScheduleStore store;
  private MutableClock clock;
  private RecordingMetrics metrics;
  private ScriptedPublisher publisher;
  private FileLockManager lockManager;
  private ScheduleExecutor executor;

  @BeforeEach
  void setUp() {
    store = new InMemoryScheduleStore();
    clock = MutableClock.at("2024-03-01T10:00:00Z");
    metrics = new RecordingMetrics();
    publisher = new ScriptedPublisher();
    lockManager = new FileLockManager(dir.resolve("slotpost.lock"));
    executor = executor(publisher, Duration.ofMinutes(3));
  }

  @AfterEach
  void tearDown() {
    executor.close();
  }

  @Test
  void runWithNothingDueChangesNothing() {
    entry("later", "10:30");
    int before = store.mutations.get();

    ExecutionReport first = executor.runOnce();
    ExecutionReport second = executor.runOnce();

    assertEquals(ExecutionOutcome.NO_ACTION, first.outcome());
    assertEquals(ExecutionOutcome.NO_ACTION, second.outcome());
    assertEquals(before, store.mutations.get());
    assertEquals(0, publisher.calls());
    assertEquals(ExecutionPhase.IDLE, executor.phase());
  }

  @Test
  void publishesEntryOnceItsSlotArrives() {
    ScheduleEntry entry = entry("a", "10:15");

    assertEquals(ExecutionOutcome.NO_ACTION, executor.runOnce().outcome());
    clock.set(at("10:15"));
    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.POSTED, report.outcome());
    ScheduleEntry posted = store.findById(conn, entry.id()).orElseThrow();
    assertEquals(EntryState.POSTED, posted.state());
    assertEquals("post-1", posted.externalPostId());
    assertEquals(1, posted.attemptCount());
    assertEquals(List.of("payload-a"), publisher.payloads());
    assertEquals(1, metrics.posted.get());
    assertEquals(0, metrics.lastPendingDepth);

    List<EntryState> states = store.history(conn, entry.id()).stream().map(StateTransition::toState).toList();
    assertEquals(List.of(EntryState.PENDING, EntryState.IN_PROGRESS, EntryState.POSTED), states);
  }

  @Test
  void publishesOnlyEarliestDueEntryPerRun() {
    ScheduleEntry older = entry("a", "09:45");
    ScheduleEntry newer = entry("b", "10:00");

    ExecutionReport report = executor.runOnce();

    assertEquals(1, report.posted());
    assertEquals(older.id(), report.attempts().get(0).entry().id());
    assertEquals(EntryState.PENDING, store.findById(conn, newer.id()).orElseThrow().state());
    assertEquals(1, metrics.lastPendingDepth);
  }

  @Test
  void transientFailureRetriesInSameSlot() {
    ScheduleEntry entry = entry("a", "10:00");
    publisher.then(new TransientPublishException("503 from endpoint"));

    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.RETRY_SCHEDULED, report.outcome());
    ScheduleEntry retried = store.findById(conn, entry.id()).orElseThrow();
    assertEquals(EntryState.PENDING, retried.state());
    assertEquals(at("10:00"), retried.scheduledTime());
    assertEquals(1, retried.attemptCount());
    assertEquals(ErrorKind.TRANSIENT, retried.lastErrorKind());
    assertEquals("503 from endpoint", retried.lastError());
    assertEquals(1, metrics.retries.get());
  }

  @Test
  void thirdTransientFailureMarksEntryFailed() {
    ScheduleEntry entry = entry("a", "10:00");
    publisher.then(new TransientPublishException("one"), new TransientPublishException("two"),
        new TransientPublishException("three"));

    executor.runOnce();
    clock.set(at("10:15"));
    executor.runOnce();
    clock.set(at("10:30"));
    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.FAILED, report.outcome());
    ScheduleEntry failed = store.findById(conn, entry.id()).orElseThrow();
    assertEquals(EntryState.FAILED, failed.state());
    assertEquals(3, failed.attemptCount());
    assertEquals("three", failed.lastError());
    assertEquals(2, metrics.retries.get());
    assertEquals(1, metrics.failed.get());
  }

  @Test
  void authFailureFailsWithoutRetry() {
    ScheduleEntry entry = entry("a", "10:00");
    publisher.then(new AuthPublishException("401"));

    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.FAILED, report.outcome());
    assertEquals(ErrorKind.AUTH, report.attempts().get(0).errorKind());
    assertEquals(1, store.findById(conn, entry.id()).orElseThrow().attemptCount());
  }

  @Test
  void validationFailureFailsWithoutRetry() {
    entry("a", "10:00");
    publisher.then(new ValidationPublishException("payload too long"));

    assertEquals(ExecutionOutcome.FAILED, executor.runOnce().outcome());
    assertEquals(0, metrics.retries.get());
  }

  @Test
  void unexpectedPublisherExceptionIsTransient() {
    entry("a", "10:00");
    publisher.then(new IllegalStateException("socket closed"));

    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.RETRY_SCHEDULED, report.outcome());
    assertEquals(ErrorKind.TRANSIENT, report.attempts().get(0).errorKind());
  }

  @Test
  void blankPostIdIsTransient() {
    entry("a", "10:00");
    publisher.then("  ");

    assertEquals(ExecutionOutcome.RETRY_SCHEDULED, executor.runOnce().outcome());
  }

  @Test
  void slowPublisherTimesOut() {
    executor.close();
    Publisher slow = (payload, scheduledTime) -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException e) {
        throw new TransientPublishException("interrupted", e);
      }
      return "late";
    };
    executor = executor(slow, Duration.ofMillis(200));
    ScheduleEntry entry = entry("a", "10:00");

    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.RETRY_SCHEDULED, report.outcome());
    assertEquals(ErrorKind.TIMEOUT, store.findById(conn, entry.id()).orElseThrow().lastErrorKind());
  }

  @Test
  void entryLeftInProgressIsSettledAsTimeoutAndRetried() {
    ScheduleEntry entry = entry("a", "10:00");
    store.transition(conn, Transition.start(entry.id(), at("10:00")));
    clock.set(at("10:10"));

    ExecutionReport report = executor.runOnce();

    assertEquals(1, report.reconciled());
    assertEquals(ExecutionOutcome.POSTED, report.outcome());
    ScheduleEntry posted = store.findById(conn, entry.id()).orElseThrow();
    assertEquals(2, posted.attemptCount());
    assertEquals(EntryState.POSTED, posted.state());
  }

  @Test
  void recentInProgressEntryIsLeftAlone() {
    ScheduleEntry entry = entry("a", "10:00");
    store.transition(conn, Transition.start(entry.id(), at("10:00")));
    clock.set(at("10:02"));

    ExecutionReport report = executor.runOnce();

    assertEquals(0, report.reconciled());
    assertEquals(ExecutionOutcome.NO_ACTION, report.outcome());
    assertEquals(EntryState.IN_PROGRESS, store.findById(conn, entry.id()).orElseThrow().state());
  }

  @Test
  void contendedRunLeavesStoreUntouched() throws Exception {
    entry("a", "10:00");
    int before = store.mutations.get();
    FileLockManager other = new FileLockManager(dir.resolve("slotpost.lock"));

    try (LockLease held = other.acquire()) {
      ExecutionReport report = executor.runOnce();

      assertEquals(ExecutionOutcome.LOCK_HELD, report.outcome());
      assertTrue(report.healthReport().isEmpty());
    }
    assertEquals(before, store.mutations.get());
    assertEquals(0, publisher.calls());
    assertEquals(1, metrics.lockContended.get());
  }

  @Test
  void catchUpPublishesUpToLimit() {
    entry("a", "09:00");
    entry("b", "09:15");
    entry("c", "09:30");
    entry("d", "09:45");

    ExecutionReport report = executor.catchUp(10);

    assertEquals(3, report.posted());
    assertEquals(List.of("payload-a", "payload-b", "payload-c"), publisher.payloads());
    assertEquals(1, store.countByState(conn).get(EntryState.PENDING));
  }

  @Test
  void catchUpStopsAfterAuthFailure() {
    entry("a", "09:00");
    entry("b", "09:15");
    publisher.then(new AuthPublishException("token revoked"));

    ExecutionReport report = executor.catchUp(3);

    assertEquals(1, report.attempts().size());
    assertEquals(ExecutionOutcome.FAILED, report.outcome());
    assertEquals(1, publisher.calls());
  }

  @Test
  void catchUpAttemptsEachEntryOnceAndLeavesRetriesForNextRun() {
    ScheduleEntry a = entry("a", "09:00");
    ScheduleEntry b = entry("b", "09:15");
    publisher.then(new TransientPublishException("503"), new TransientPublishException("503"),
        new TransientPublishException("503"));

    ExecutionReport report = executor.catchUp(3);

    assertEquals(2, report.attempts().size());
    assertEquals(2, publisher.calls());
    assertEquals(List.of("payload-a", "payload-b"), publisher.payloads());
    ScheduleEntry retriedA = store.findById(conn, a.id()).orElseThrow();
    ScheduleEntry retriedB = store.findById(conn, b.id()).orElseThrow();
    assertEquals(EntryState.PENDING, retriedA.state());
    assertEquals(1, retriedA.attemptCount());
    assertEquals(at("09:00"), retriedA.scheduledTime());
    assertEquals(EntryState.PENDING, retriedB.state());
    assertEquals(1, retriedB.attemptCount());
    assertEquals(2, metrics.retries.get());
    assertEquals(0, metrics.failed.get());
  }

  @Test
  void catchUpMovesPastRetriedEntryToLaterDueEntries() {
    ScheduleEntry a = entry("a", "09:00");
    entry("b", "09:15");
    entry("c", "09:30");
    publisher.then(new TransientPublishException("503"));

    ExecutionReport first = executor.catchUp(3);

    assertEquals(3, first.attempts().size());
    assertEquals(ExecutionOutcome.RETRY_SCHEDULED, first.attempts().get(0).outcome());
    assertEquals(2, first.posted());
    assertEquals(EntryState.PENDING, store.findById(conn, a.id()).orElseThrow().state());

    ExecutionReport second = executor.catchUp(3);

    assertEquals(1, second.attempts().size());
    assertEquals(ExecutionOutcome.POSTED, second.outcome());
    ScheduleEntry posted = store.findById(conn, a.id()).orElseThrow();
    assertEquals(EntryState.POSTED, posted.state());
    assertEquals(2, posted.attemptCount());
  }

  @Test
  void catchUpRejectsNonPositiveCount() {
    assertThrows(IllegalArgumentException.class, () -> executor.catchUp(0));
  }

  @Test
  void failedEntryIsRecoveredBeforeSelectionAndPostedLater() {
    ScheduleEntry entry = entry("a", "09:00");
    store.transition(conn, Transition.start(entry.id(), at("09:00")));
    store.transition(conn, Transition.failed(entry.id(), ErrorKind.TRANSIENT, "503", at("09:00")));
    clock.set(Instant.parse("2024-03-01T09:58:00Z"));

    ExecutionReport sweep = executor.runOnce();

    assertEquals(1, sweep.recovered());
    assertEquals(ExecutionOutcome.NO_ACTION, sweep.outcome());
    ScheduleEntry requeued = store.findById(conn, entry.id()).orElseThrow();
    assertEquals(at("10:00"), requeued.scheduledTime());
    assertEquals(EntrySource.FRONTLOAD, requeued.source());

    clock.set(at("10:00"));
    assertEquals(ExecutionOutcome.POSTED, executor.runOnce().outcome());
    assertEquals(1, store.all().size());
  }

  @Test
  void recoverOnlyNeverPublishes() {
    entry("a", "09:00");

    ExecutionReport report = executor.recoverOnly();

    assertEquals(ExecutionOutcome.NO_ACTION, report.outcome());
    assertEquals(0, publisher.calls());
  }

  @Test
  void storeFailureEndsRunWithStoreError() {
    executor.close();
    InMemoryScheduleStore broken = new InMemoryScheduleStore() {
      @Override
      public synchronized Optional<ScheduleEntry> nextDue(Connection c, Instant now) {
        throw new ScheduleStoreException("database unavailable", null);
      }
    };
    executor = ScheduleExecutor.builder()
        .connectionProvider(provider)
        .store(broken)
        .lockManager(lockManager)
        .publisher(publisher)
        .clock(clock)
        .build();

    ExecutionReport report = executor.runOnce();

    assertEquals(ExecutionOutcome.STORE_ERROR, report.outcome());
    assertTrue(lockManager.currentHolder().isEmpty());
  }

  @Test
  void reportsHealthAfterRun() {
    entry("a", "10:00");

    ExecutionReport report = executor.runOnce();

    assertEquals(1.0, report.healthReport().orElseThrow().successRate());
    assertEquals(1.0, metrics.lastSuccessRate);
  }

  @Test
  void closedExecutorRejectsRuns() {
    executor.close();

    assertThrows(IllegalStateException.class, executor::runOnce);
  }

  @Test
  void stuckThresholdMustExceedPublishTimeout() {
    assertThrows(IllegalArgumentException.class, () -> ScheduleExecutor.builder()
        .connectionProvider(provider)
        .store(store)
        .lockManager(lockManager)
        .publisher(publisher)
        .publishTimeout(Duration.ofMinutes(3))
        .stuckThreshold(Duration.ofMinutes(2))
        .build());
  }

  private ScheduleExecutor executor(Publisher publisher, Duration publishTimeout) {
    SlotAllocator allocator = SlotAllocator.builder().store(store).build();
    RecoverySweeper sweeper = RecoverySweeper.builder()
        .connectionProvider(provider)
        .store(store)
        .allocator(allocator)
        .metrics(metrics)
        .clock(clock)
        .build();
    HealthMonitor health = HealthMonitor.builder()
        .connectionProvider(provider)
        .store(store)
        .metrics(metrics)
        .clock(clock)
        .build();
    return ScheduleExecutor.builder()
        .connectionProvider(provider)
        .store(store)
        .lockManager(lockManager)
        .publisher(publisher)
        .sweeper(sweeper)
        .healthMonitor(health)
        .metrics(metrics)
        .clock(clock)
        .publishTimeout(publishTimeout)
        .build();
  }

  private ScheduleEntry entry(String key, String hhmm) {
    ScheduleEntry entry = ScheduleEntry.pending(new ContentItem(key, "payload-" + key), at(hhmm),
        EntrySource.DISCOVERY, Instant.parse("2024-03-01T08:00:00Z"));
    store.put(conn, entry);
    return entry;
  }

  private static Instant at(String hhmm) {
    return Instant.parse("2024-03-01T" + hhmm + ":00Z");
  }
}
