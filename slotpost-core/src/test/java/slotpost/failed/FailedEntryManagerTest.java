package slotpost.failed;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import slotpost.InMemoryScheduleStore;
import slotpost.MutableClock;
import slotpost.TestConnections;
import slotpost.allocate.SlotAllocator;
import slotpost.lock.FileLockManager;
import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.model.ContentItem;
import slotpost.model.EntrySource;
import slotpost.model.EntryState;
import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;
import slotpost.model.Transition;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FailedEntryManagerTest {

  @TempDir
  Path dir;

  private final Connection conn = TestConnections.dummyConnection();
  private InMemoryScheduleStore store;
  private FileLockManager lockManager;
  private FailedEntryManager manager;

  @BeforeEach
  void setUp() {
    store = new InMemoryScheduleStore();
    lockManager = new FileLockManager(dir.resolve("slotpost.lock"));
    manager = new FailedEntryManager(TestConnections.dummyProvider(), store,
        SlotAllocator.builder().store(store).build(), lockManager, MutableClock.at("2024-03-01T11:05:00Z"));
  }

  @Test
  void queriesAndCountsFailedEntries() {
    failed("a", ErrorKind.AUTH);
    failed("b", ErrorKind.VALIDATION);
    pending("c", "12:00");

    assertEquals(2, manager.count());
    assertEquals(1, manager.query(1).size());
    assertThrows(IllegalArgumentException.class, () -> manager.query(0));
  }

  @Test
  void replayRequeuesFatalFailureAtFrontOfQueue() throws Exception {
    ScheduleEntry entry = failed("a", ErrorKind.AUTH);

    Optional<ScheduleEntry> replayed = manager.replay(entry.id());

    assertTrue(replayed.isPresent());
    assertEquals(EntryState.PENDING, replayed.get().state());
    assertEquals(Instant.parse("2024-03-01T11:15:00Z"), replayed.get().scheduledTime());
    assertEquals(0, replayed.get().attemptCount());
    assertEquals(0, replayed.get().recoveryRounds());
    assertEquals(0, manager.count());
  }

  @Test
  void replayIgnoresEntriesThatAreNotFailed() throws Exception {
    ScheduleEntry entry = pending("a", "12:00");

    assertTrue(manager.replay(entry.id()).isEmpty());
    assertTrue(manager.replay("missing").isEmpty());
  }

  @Test
  void skipReleasesSlotAndContentKey() throws Exception {
    ScheduleEntry entry = pending("a", "12:00");

    assertTrue(manager.skip(entry.id()));

    assertEquals(EntryState.SKIPPED, store.findById(conn, entry.id()).orElseThrow().state());
    assertFalse(store.isSlotOccupied(conn, entry.scheduledTime()));
    assertTrue(store.findActiveByContentKey(conn, "a").isEmpty());
    assertFalse(manager.skip(entry.id()));
  }

  @Test
  void mutationsRequireTheLock() throws Exception {
    ScheduleEntry entry = failed("a", ErrorKind.AUTH);

    try (LockLease held = new FileLockManager(dir.resolve("slotpost.lock")).acquire()) {
      assertThrows(LockHeldException.class, () -> manager.replay(entry.id()));
      assertThrows(LockHeldException.class, () -> manager.skip(entry.id()));
    }
    assertEquals(EntryState.FAILED, store.findById(conn, entry.id()).orElseThrow().state());
  }

  private ScheduleEntry pending(String key, String hhmm) {
    ScheduleEntry entry = ScheduleEntry.pending(new ContentItem(key, "p"), Instant.parse("2024-03-01T" + hhmm + ":00Z"),
        EntrySource.DISCOVERY, Instant.parse("2024-03-01T08:00:00Z"));
    store.put(conn, entry);
    return entry;
  }

  private ScheduleEntry failed(String key, ErrorKind kind) {
    Instant slot = Instant.parse("2024-03-01T09:00:00Z");
    ScheduleEntry entry = ScheduleEntry.pending(new ContentItem(key, "p"), slot, EntrySource.DISCOVERY, slot);
    store.put(conn, entry);
    store.transition(conn, Transition.start(entry.id(), slot));
    return store.transition(conn, Transition.failed(entry.id(), kind, "rejected", slot));
  }
}
