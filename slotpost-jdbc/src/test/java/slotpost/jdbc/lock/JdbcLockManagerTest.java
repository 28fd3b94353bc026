package slotpost.jdbc.lock;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import slotpost.MutableClock;
import slotpost.RecordingMetrics;
import slotpost.jdbc.DataSourceConnectionProvider;
import slotpost.jdbc.ScheduleTables;
import slotpost.jdbc.Schemas;
import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.lock.LockOwner;
import slotpost.lock.LockReclaimPolicy;
import slotpost.lock.StaleLockReclaimed;
import slotpost.spi.ConnectionProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcLockManagerTest {
  private HikariDataSource dataSource;
  private ConnectionProvider connections;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:lock-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(8);
    dataSource = new HikariDataSource(config);
    Schemas.apply(dataSource, "/schema/h2.sql");
    connections = new DataSourceConnectionProvider(dataSource);
  }

  @AfterEach
  void teardown() {
    dataSource.close();
  }

  @Test
  void acquireAndRelease() throws Exception {
    JdbcLockManager manager = new JdbcLockManager(connections);

    try (LockLease lease = manager.acquire()) {
      LockOwner holder = manager.currentHolder().orElseThrow();
      assertEquals(lease.owner().token(), holder.token());
      assertEquals(ProcessHandle.current().pid(), holder.pid());
    }
    assertTrue(manager.currentHolder().isEmpty());

    try (LockLease again = manager.acquire()) {
      assertTrue(manager.currentHolder().isPresent());
    }
  }

  @Test
  void liveHolderBlocksSecondAcquire() throws Exception {
    JdbcLockManager manager = new JdbcLockManager(connections);

    try (LockLease lease = manager.acquire()) {
      LockHeldException e = assertThrows(LockHeldException.class, manager::acquire);
      assertEquals(lease.owner().token(), e.holder().orElseThrow().token());
    }
  }

  @Test
  void releaseIsIdempotent() throws Exception {
    JdbcLockManager manager = new JdbcLockManager(connections);
    LockLease lease = manager.acquire();
    lease.close();

    try (LockLease next = manager.acquire()) {
      lease.close();
      assertEquals(next.owner().token(), manager.currentHolder().orElseThrow().token());
    }
  }

  @Test
  void deadHolderIsReclaimed() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    List<StaleLockReclaimed> events = new ArrayList<>();
    JdbcLockManager first = new JdbcLockManager(connections);
    JdbcLockManager reclaiming = new JdbcLockManager(connections, ScheduleTables.DEFAULT,
        JdbcLockManager.DEFAULT_LOCK_NAME, new LockReclaimPolicy(owner -> false, null, events::add, metrics, null), 0);

    LockLease stale = first.acquire();
    try (LockLease lease = reclaiming.acquire()) {
      assertEquals(1, events.size());
      assertEquals(stale.owner().token(), events.get(0).previous().token());
      assertEquals(lease.owner().token(), events.get(0).reclaimedBy().token());
      assertEquals(1, metrics.staleReclaimed.get());

      stale.close();
      assertEquals(lease.owner().token(), reclaiming.currentHolder().orElseThrow().token());
    }
    assertTrue(first.currentHolder().isEmpty());
  }

  @Test
  void expiredLeaseIsReclaimed() throws Exception {
    MutableClock clock = MutableClock.at("2026-03-02T10:00:00Z");
    LockReclaimPolicy policy = new LockReclaimPolicy(null, Duration.ofMinutes(30), null, null, clock);
    JdbcLockManager manager = new JdbcLockManager(connections, ScheduleTables.DEFAULT, "nightly", policy, 0);

    LockLease old = manager.acquire();
    clock.advance(Duration.ofMinutes(10));
    assertThrows(LockHeldException.class, manager::acquire);

    clock.advance(Duration.ofMinutes(25));
    try (LockLease lease = manager.acquire()) {
      assertEquals(clock.instant(), lease.owner().acquiredAt());
    }
    old.close();
  }

  @Test
  void locksWithDifferentNamesAreIndependent() throws Exception {
    JdbcLockManager a = new JdbcLockManager(connections, ScheduleTables.DEFAULT, "a", LockReclaimPolicy.defaults(), 0);
    JdbcLockManager b = new JdbcLockManager(connections, ScheduleTables.DEFAULT, "b", LockReclaimPolicy.defaults(), 0);

    try (LockLease first = a.acquire(); LockLease second = b.acquire()) {
      assertTrue(a.currentHolder().isPresent());
      assertTrue(b.currentHolder().isPresent());
    }
  }

  @Test
  void concurrentAcquireHasExactlyOneWinner() throws Exception {
    int threads = 8;
    JdbcLockManager manager = new JdbcLockManager(connections);
    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(threads);
    AtomicInteger held = new AtomicInteger();
    List<LockLease> leases = new CopyOnWriteArrayList<>();
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          try {
            start.await();
            leases.add(manager.acquire());
          } catch (LockHeldException e) {
            held.incrementAndGet();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          } finally {
            done.countDown();
          }
        }));
      }
      start.countDown();
      assertTrue(done.await(30, TimeUnit.SECONDS));
      for (Future<?> f : futures) {
        f.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, leases.size());
    assertEquals(threads - 1, held.get());
    leases.get(0).close();
    assertTrue(manager.currentHolder().isEmpty());
  }

  @Test
  void rejectsInvalidLockName() {
    assertThrows(IllegalArgumentException.class, () -> new JdbcLockManager(connections, ScheduleTables.DEFAULT,
        " ", LockReclaimPolicy.defaults(), 0));
  }
}
