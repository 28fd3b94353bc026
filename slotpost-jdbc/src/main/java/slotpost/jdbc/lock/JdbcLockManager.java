package slotpost.jdbc.lock;

import slotpost.ScheduleStoreException;
import slotpost.jdbc.JdbcTemplate;
import slotpost.jdbc.ScheduleTables;
import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.lock.LockManager;
import slotpost.lock.LockOwner;
import slotpost.lock.LockReclaimPolicy;
import slotpost.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduler lock held in a row of the lock table.
 *
 * <p>The row is created on first use. Acquisition is a compare-and-set on
 * {@code owner_token}: from {@code NULL} for a free lock, or from the stale holder's
 * token when the {@link LockReclaimPolicy} declares that holder dead or expired. Every
 * statement runs in auto-commit mode, so no transaction stays open while the lease is
 * held. Processes on different hosts can share this lock; give the policy a
 * {@code staleAfter} bound in that case, since remote processes cannot be probed.
 */
public final class JdbcLockManager implements LockManager {
  private static final Logger logger = Logger.getLogger(JdbcLockManager.class.getName());

  public static final String DEFAULT_LOCK_NAME = "scheduler";
  private static final int MAX_ATTEMPTS = 3;

  private static final JdbcTemplate.RowMapper<Optional<LockOwner>> OWNER_ROW_MAPPER = rs -> {
    String token = rs.getString("owner_token");
    if (token == null) {
      return Optional.empty();
    }
    return Optional.of(new LockOwner(token, rs.getLong("owner_pid"), rs.getString("owner_host"),
        Instant.ofEpochMilli(rs.getLong("acquired_at"))));
  };

  private final ConnectionProvider connectionProvider;
  private final ScheduleTables tables;
  private final String lockName;
  private final LockReclaimPolicy policy;
  private final int queryTimeoutSeconds;

  public JdbcLockManager(ConnectionProvider connectionProvider) {
    this(connectionProvider, ScheduleTables.DEFAULT, DEFAULT_LOCK_NAME, LockReclaimPolicy.defaults(), 0);
  }

  public JdbcLockManager(ConnectionProvider connectionProvider, ScheduleTables tables, String lockName,
      LockReclaimPolicy policy, int queryTimeoutSeconds) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.lockName = Objects.requireNonNull(lockName, "lockName");
    this.policy = Objects.requireNonNull(policy, "policy");
    if (lockName.isBlank() || lockName.length() > 64) {
      throw new IllegalArgumentException("lockName must be 1-64 characters");
    }
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public LockLease acquire() throws LockHeldException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      LockOwner holder = null;
      for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
        LockOwner me = LockOwner.current(policy.clock().instant());
        Optional<Optional<LockOwner>> row = readRow(conn);
        if (row.isEmpty()) {
          if (insertRow(conn, me)) {
            return lease(me);
          }
          continue;
        }
        if (row.get().isEmpty()) {
          if (swap(conn, null, me)) {
            return lease(me);
          }
          continue;
        }

        holder = row.get().get();
        Optional<String> reason = policy.staleReason(holder);
        if (reason.isEmpty()) {
          throw new LockHeldException(holder);
        }
        if (swap(conn, holder.token(), me)) {
          policy.reclaimed(holder, me, reason.get());
          return lease(me);
        }
      }
      throw new LockHeldException(holder);
    } catch (SQLException e) {
      throw new ScheduleStoreException("Failed to acquire scheduler lock", e);
    }
  }

  @Override
  public Optional<LockOwner> currentHolder() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return readRow(conn).flatMap(owner -> owner);
    } catch (SQLException e) {
      throw new ScheduleStoreException("Failed to read scheduler lock", e);
    }
  }

  /** Empty when the row does not exist; an empty owner when the lock is free. */
  private Optional<Optional<LockOwner>> readRow(Connection conn) {
    String sql = "SELECT owner_token, owner_pid, owner_host, acquired_at FROM " + tables.locks()
        + " WHERE lock_name=?";
    List<Optional<LockOwner>> rows = JdbcTemplate.query(conn, queryTimeoutSeconds, sql, OWNER_ROW_MAPPER,
        lockName);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private boolean insertRow(Connection conn, LockOwner me) {
    String sql = "INSERT INTO " + tables.locks()
        + " (lock_name, owner_token, owner_pid, owner_host, acquired_at) VALUES (?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, queryTimeoutSeconds, sql,
          lockName, me.token(), me.pid(), me.host(), me.acquiredAt().toEpochMilli());
      return true;
    } catch (ScheduleStoreException e) {
      if (JdbcTemplate.isConstraintViolation(e)) {
        logger.log(Level.FINE, "Lock row {0} was created concurrently", lockName);
        return false;
      }
      throw e;
    }
  }

  private boolean swap(Connection conn, String expectedToken, LockOwner next) {
    String sql = "UPDATE " + tables.locks() + " SET owner_token=?, owner_pid=?, owner_host=?, acquired_at=?"
        + " WHERE lock_name=? AND " + (expectedToken == null ? "owner_token IS NULL" : "owner_token=?");
    Object[] params = expectedToken == null
        ? new Object[]{next.token(), next.pid(), next.host(), next.acquiredAt().toEpochMilli(), lockName}
        : new Object[]{next.token(), next.pid(), next.host(), next.acquiredAt().toEpochMilli(), lockName,
            expectedToken};
    return JdbcTemplate.update(conn, queryTimeoutSeconds, sql, params) == 1;
  }

  private LockLease lease(LockOwner owner) {
    logger.log(Level.FINE, "Acquired scheduler lock {0}", lockName);
    return new RowLease(owner);
  }

  private final class RowLease implements LockLease {
    private final LockOwner owner;
    private final AtomicBoolean released = new AtomicBoolean();

    private RowLease(LockOwner owner) {
      this.owner = owner;
    }

    @Override
    public LockOwner owner() {
      return owner;
    }

    @Override
    public void close() {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      String sql = "UPDATE " + tables.locks()
          + " SET owner_token=NULL, owner_pid=NULL, owner_host=NULL, acquired_at=NULL"
          + " WHERE lock_name=? AND owner_token=?";
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        if (JdbcTemplate.update(conn, queryTimeoutSeconds, sql, lockName, owner.token()) == 0) {
          logger.log(Level.WARNING, "Scheduler lock {0} was taken over before release", lockName);
        } else {
          logger.log(Level.FINE, "Released scheduler lock {0}", lockName);
        }
      } catch (SQLException | ScheduleStoreException e) {
        logger.log(Level.SEVERE, "Failed to release scheduler lock " + lockName, e);
      }
    }
  }
}
