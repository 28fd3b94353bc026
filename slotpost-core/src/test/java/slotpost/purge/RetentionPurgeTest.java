package slotpost.purge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import slotpost.MutableClock;
import slotpost.RecordingMetrics;
import slotpost.ScheduleStoreException;
import slotpost.TestConnections;
import slotpost.lock.FileLockManager;
import slotpost.lock.LockLease;
import slotpost.spi.EntryPurger;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPurgeTest {

  @TempDir
  Path dir;

  private final MutableClock clock = MutableClock.at("2024-03-10T00:00:00Z");
  private final RecordingMetrics metrics = new RecordingMetrics();
  private FileLockManager lockManager;

  @BeforeEach
  void setUp() {
    lockManager = new FileLockManager(dir.resolve("slotpost.lock"));
  }

  @Test
  void drainsFullBatchesUntilShortBatch() {
    List<Integer> results = new ArrayList<>(List.of(10, 10, 4));
    List<Instant> cutoffs = new ArrayList<>();
    EntryPurger purger = (conn, before, limit) -> {
      cutoffs.add(before);
      assertEquals(10, limit);
      return results.remove(0);
    };

    try (RetentionPurge purge = purge(purger, Duration.ofDays(7), Duration.ofHours(24))) {
      PurgeReport report = purge.runOnce();

      assertEquals(24, report.deleted());
      assertEquals(3, report.batches());
      assertFalse(report.lockHeld());
      assertEquals(Instant.parse("2024-03-03T00:00:00Z"), report.cutoff());
    }
    assertEquals(List.of(cutoffs.get(0), cutoffs.get(0), cutoffs.get(0)), cutoffs);
    assertEquals(24, metrics.purged.get());
  }

  @Test
  void retentionNeverCutsIntoHealthWindow() {
    List<Instant> cutoffs = new ArrayList<>();
    EntryPurger purger = (conn, before, limit) -> {
      cutoffs.add(before);
      return 0;
    };

    try (RetentionPurge purge = purge(purger, Duration.ofHours(1), Duration.ofHours(24))) {
      assertEquals(Duration.ofHours(24), purge.retention());
      purge.runOnce();
    }
    assertEquals(List.of(Instant.parse("2024-03-09T00:00:00Z")), cutoffs);
  }

  @Test
  void skipsCycleWhileSchedulerLockIsHeld() throws Exception {
    EntryPurger purger = (conn, before, limit) -> {
      throw new AssertionError("purged while a run held the lock");
    };

    try (RetentionPurge purge = purge(purger, Duration.ofDays(7), null);
         LockLease held = new FileLockManager(dir.resolve("slotpost.lock")).acquire()) {
      PurgeReport report = purge.runOnce();

      assertTrue(report.lockHeld());
      assertEquals(0, report.deleted());
    }
    assertEquals(1, metrics.lockContended.get());
    assertEquals(0, metrics.purged.get());
  }

  @Test
  void releasesLockAfterCycle() throws Exception {
    try (RetentionPurge purge = purge((conn, before, limit) -> 0, Duration.ofDays(7), null)) {
      purge.runOnce();
    }
    try (LockLease lease = lockManager.acquire()) {
      assertNotNull(lease.owner());
    }
  }

  @Test
  void storeFailurePropagatesAndReleasesLock() throws Exception {
    EntryPurger purger = (conn, before, limit) -> {
      throw new ScheduleStoreException("delete failed", new SQLException("table locked"));
    };

    try (RetentionPurge purge = purge(purger, Duration.ofDays(7), null)) {
      assertThrows(ScheduleStoreException.class, purge::runOnce);
    }
    try (LockLease lease = lockManager.acquire()) {
      assertNotNull(lease.owner());
    }
  }

  @Test
  void closedPurgeRejectsWork() {
    RetentionPurge purge = purge((conn, before, limit) -> 0, Duration.ofDays(7), null);
    purge.close();

    assertThrows(IllegalStateException.class, purge::runOnce);
    assertThrows(IllegalStateException.class, purge::start);
  }

  @Test
  void rejectsInvalidSettings() {
    EntryPurger purger = (conn, before, limit) -> 0;
    assertThrows(IllegalArgumentException.class, () -> RetentionPurge.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .purger(purger)
        .lockManager(lockManager)
        .batchSize(0)
        .build());
    assertThrows(IllegalArgumentException.class, () -> RetentionPurge.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .purger(purger)
        .lockManager(lockManager)
        .retention(Duration.ofDays(-1))
        .build());
    assertThrows(NullPointerException.class, () -> RetentionPurge.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .purger(purger)
        .build());
  }

  private RetentionPurge purge(EntryPurger purger, Duration retention, Duration journalWindow) {
    return RetentionPurge.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .purger(purger)
        .lockManager(lockManager)
        .metrics(metrics)
        .retention(retention)
        .journalWindow(journalWindow)
        .batchSize(10)
        .clock(clock)
        .build();
  }
}
