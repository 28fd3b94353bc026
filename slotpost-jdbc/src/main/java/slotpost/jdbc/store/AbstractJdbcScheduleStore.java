package slotpost.jdbc.store;

import slotpost.DuplicateContentException;
import slotpost.IllegalTransitionException;
import slotpost.ScheduleConflictException;
import slotpost.ScheduleStoreException;
import slotpost.SlotCollisionException;
import slotpost.allocate.SlotGrid;
import slotpost.jdbc.JdbcTemplate;
import slotpost.jdbc.ScheduleTables;
import slotpost.model.EntrySource;
import slotpost.model.EntryState;
import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;
import slotpost.model.StateTransition;
import slotpost.model.Transition;
import slotpost.spi.ScheduleStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC schedule store with standard SQL implementations.
 *
 * <p>Scheduled times are stored as epoch milliseconds so slot arithmetic and uniqueness
 * are exact. Two nullable unique columns back the schedule invariants:
 * {@code active_slot} holds the scheduled time while the entry is PENDING or IN_PROGRESS
 * and {@code active_key} holds the content key unless the entry is SKIPPED. Transitions
 * are compare-and-set updates on {@code state} followed by a journal insert, both on the
 * caller's connection.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/slotpost.jdbc.store.AbstractJdbcScheduleStore}.
 *
 * @see JdbcScheduleStores
 */
public abstract class AbstractJdbcScheduleStore implements ScheduleStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String ENTRY_COLUMNS = "id, content_key, payload, scheduled_at, state, "
      + "attempt_count, recovery_rounds, last_error_kind, last_error, entry_source, external_post_id, "
      + "created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<ScheduleEntry> ENTRY_ROW_MAPPER = rs -> new ScheduleEntry(
      rs.getString("id"),
      rs.getString("content_key"),
      rs.getString("payload"),
      Instant.ofEpochMilli(rs.getLong("scheduled_at")),
      EntryState.fromCode(rs.getInt("state")),
      rs.getInt("attempt_count"),
      rs.getInt("recovery_rounds"),
      errorKind(rs.getString("last_error_kind")),
      rs.getString("last_error"),
      EntrySource.valueOf(rs.getString("entry_source")),
      rs.getString("external_post_id"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getTimestamp("updated_at").toInstant());

  private static final JdbcTemplate.RowMapper<StateTransition> TRANSITION_ROW_MAPPER = rs -> {
    int from = rs.getInt("from_state");
    EntryState fromState = rs.wasNull() ? null : EntryState.fromCode(from);
    return new StateTransition(
        rs.getLong("seq"),
        rs.getString("entry_id"),
        rs.getString("content_key"),
        fromState,
        EntryState.fromCode(rs.getInt("to_state")),
        rs.getInt("attempt"),
        Instant.ofEpochMilli(rs.getLong("scheduled_at")),
        errorKind(rs.getString("error_kind")),
        rs.getString("error_message"),
        rs.getString("external_post_id"),
        rs.getTimestamp("occurred_at").toInstant());
  };

  private final ScheduleTables tables;
  private final SlotGrid grid;
  private final int queryTimeoutSeconds;

  protected AbstractJdbcScheduleStore() {
    this(ScheduleTables.DEFAULT, SlotGrid.defaultGrid(), 0);
  }

  protected AbstractJdbcScheduleStore(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.grid = Objects.requireNonNull(grid, "grid");
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store using the given tables, slot grid and query timeout.
   */
  public abstract AbstractJdbcScheduleStore withSettings(ScheduleTables tables, SlotGrid grid,
      int queryTimeoutSeconds);

  public ScheduleTables tables() {
    return tables;
  }

  public SlotGrid grid() {
    return grid;
  }

  protected int queryTimeout() {
    return queryTimeoutSeconds;
  }

  @Override
  public void put(Connection conn, ScheduleEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (entry.state() == EntryState.PENDING) {
      grid.requireAligned(entry.scheduledTime());
    }
    if (entry.state() != EntryState.SKIPPED && findActiveByContentKey(conn, entry.contentKey()).isPresent()) {
      throw new DuplicateContentException(entry.contentKey());
    }
    if (entry.state().isActive() && isSlotOccupied(conn, entry.scheduledTime())) {
      throw new SlotCollisionException(entry.scheduledTime());
    }
    String sql = "INSERT INTO " + tables.entries() + " (" + ENTRY_COLUMNS + ", active_slot, active_key)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, queryTimeoutSeconds, sql,
          entry.id(), entry.contentKey(), entry.payload(), entry.scheduledTime().toEpochMilli(),
          entry.state().code(), entry.attemptCount(), entry.recoveryRounds(),
          kindName(entry.lastErrorKind()), truncateError(entry.lastError()), entry.source().name(),
          entry.externalPostId(), Timestamp.from(entry.createdAt()), Timestamp.from(entry.updatedAt()),
          activeSlot(entry), activeKey(entry));
    } catch (ScheduleStoreException e) {
      if (JdbcTemplate.isConstraintViolation(e)) {
        throw new ScheduleConflictException("Entry " + entry.contentKey() + " at " + entry.scheduledTime()
            + " conflicts with a concurrent insert", e);
      }
      throw e;
    }
    journal(conn, null, entry);
  }

  @Override
  public Optional<ScheduleEntry> findById(Connection conn, String id) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries() + " WHERE id=?";
    return first(JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, id));
  }

  @Override
  public Optional<ScheduleEntry> findActiveByContentKey(Connection conn, String contentKey) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries() + " WHERE active_key=?";
    return first(JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, contentKey));
  }

  @Override
  public boolean isSlotOccupied(Connection conn, Instant slot) {
    String sql = "SELECT COUNT(*) FROM " + tables.entries() + " WHERE active_slot=?";
    return JdbcTemplate.queryForLong(conn, queryTimeoutSeconds, sql, slot.toEpochMilli()) > 0;
  }

  @Override
  public Optional<Instant> latestActiveSlot(Connection conn) {
    String sql = "SELECT MAX(active_slot) AS tail FROM " + tables.entries();
    List<Optional<Instant>> rows = JdbcTemplate.query(conn, queryTimeoutSeconds, sql, rs -> {
      long tail = rs.getLong("tail");
      return rs.wasNull() ? Optional.<Instant>empty() : Optional.of(Instant.ofEpochMilli(tail));
    });
    return rows.isEmpty() ? Optional.empty() : rows.get(0);
  }

  @Override
  public Optional<ScheduleEntry> nextDue(Connection conn, Instant now) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries()
        + " WHERE state=" + EntryState.PENDING.code() + " AND scheduled_at<=?"
        + " ORDER BY scheduled_at, created_at, id LIMIT 1";
    return first(JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, now.toEpochMilli()));
  }

  @Override
  public ScheduleEntry transition(Connection conn, Transition transition) {
    Objects.requireNonNull(transition, "transition");
    ScheduleEntry current = lockEntry(conn, transition.entryId())
        .orElseThrow(() -> new IllegalTransitionException(transition.entryId(), transition.from(),
            transition.to(), "not found"));
    ScheduleEntry next = current.apply(transition);
    if (next.state().isActive() && !next.scheduledTime().equals(current.scheduledTime())) {
      grid.requireAligned(next.scheduledTime());
      if (isSlotOccupied(conn, next.scheduledTime())) {
        throw new SlotCollisionException(next.scheduledTime());
      }
    }

    String sql = "UPDATE " + tables.entries() + " SET scheduled_at=?, state=?, attempt_count=?,"
        + " recovery_rounds=?, last_error_kind=?, last_error=?, entry_source=?, external_post_id=?,"
        + " active_slot=?, active_key=?, updated_at=?"
        + " WHERE id=? AND state=?";
    int updated;
    try {
      updated = JdbcTemplate.update(conn, queryTimeoutSeconds, sql,
          next.scheduledTime().toEpochMilli(), next.state().code(), next.attemptCount(),
          next.recoveryRounds(), kindName(next.lastErrorKind()), truncateError(next.lastError()),
          next.source().name(), next.externalPostId(), activeSlot(next), activeKey(next),
          Timestamp.from(next.updatedAt()), next.id(), transition.from().code());
    } catch (ScheduleStoreException e) {
      if (JdbcTemplate.isConstraintViolation(e)) {
        throw new ScheduleConflictException("Transition of " + next.id() + " to " + next.state()
            + " conflicts with the schedule", e);
      }
      throw e;
    }
    if (updated == 0) {
      throw new IllegalTransitionException(next.id(), transition.from(), transition.to(), "concurrently modified");
    }
    journal(conn, current.state(), next);
    return next;
  }

  @Override
  public Map<EntryState, Integer> countByState(Connection conn) {
    String sql = "SELECT state, COUNT(*) AS n FROM " + tables.entries() + " GROUP BY state";
    return countMap(conn, sql, "state");
  }

  @Override
  public Map<EntryState, Integer> countTransitionsSince(Connection conn, Instant since) {
    String sql = "SELECT to_state, COUNT(*) AS n FROM " + tables.transitions()
        + " WHERE occurred_at>=? GROUP BY to_state";
    return countMap(conn, sql, "to_state", Timestamp.from(since));
  }

  @Override
  public List<ScheduleEntry> findRecoverable(Connection conn, Set<ErrorKind> kinds, int maxRounds, int limit) {
    if (kinds.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<Object> params = new ArrayList<>();
    for (ErrorKind kind : kinds) {
      params.add(kind.name());
    }
    params.add(maxRounds);
    params.add(limit);
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries()
        + " WHERE state=" + EntryState.FAILED.code()
        + " AND last_error_kind IN (" + String.join(",", Collections.nCopies(kinds.size(), "?")) + ")"
        + " AND recovery_rounds<?"
        + " ORDER BY updated_at, id LIMIT ?";
    return JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, params.toArray());
  }

  @Override
  public List<ScheduleEntry> queryFailed(Connection conn, int limit) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries()
        + " WHERE state=" + EntryState.FAILED.code() + " ORDER BY updated_at, id LIMIT ?";
    return JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, limit);
  }

  @Override
  public int countFailed(Connection conn) {
    String sql = "SELECT COUNT(*) FROM " + tables.entries() + " WHERE state=" + EntryState.FAILED.code();
    return (int) JdbcTemplate.queryForLong(conn, queryTimeoutSeconds, sql);
  }

  @Override
  public List<ScheduleEntry> findStuckInProgress(Connection conn, Instant updatedBefore) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries()
        + " WHERE state=" + EntryState.IN_PROGRESS.code() + " AND updated_at<?"
        + " ORDER BY updated_at, id";
    return JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, Timestamp.from(updatedBefore));
  }

  @Override
  public List<ScheduleEntry> upcoming(Connection conn, int limit) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries()
        + " WHERE state=" + EntryState.PENDING.code()
        + " ORDER BY scheduled_at, created_at, id LIMIT ?";
    return JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, limit);
  }

  @Override
  public int countOverdue(Connection conn, Instant now) {
    String sql = "SELECT COUNT(*) FROM " + tables.entries()
        + " WHERE state=" + EntryState.PENDING.code() + " AND scheduled_at<?";
    return (int) JdbcTemplate.queryForLong(conn, queryTimeoutSeconds, sql, now.toEpochMilli());
  }

  @Override
  public List<StateTransition> history(Connection conn, String entryId) {
    String sql = "SELECT seq, entry_id, content_key, from_state, to_state, attempt, scheduled_at,"
        + " error_kind, error_message, external_post_id, occurred_at"
        + " FROM " + tables.transitions() + " WHERE entry_id=? ORDER BY seq";
    return JdbcTemplate.query(conn, queryTimeoutSeconds, sql, TRANSITION_ROW_MAPPER, entryId);
  }

  /**
   * Reads an entry and locks its row until the caller's transaction ends.
   */
  protected Optional<ScheduleEntry> lockEntry(Connection conn, String id) {
    String sql = "SELECT " + ENTRY_COLUMNS + " FROM " + tables.entries() + " WHERE id=? FOR UPDATE";
    return first(JdbcTemplate.query(conn, queryTimeoutSeconds, sql, ENTRY_ROW_MAPPER, id));
  }

  private void journal(Connection conn, EntryState from, ScheduleEntry entry) {
    String sql = "INSERT INTO " + tables.transitions() + " (entry_id, content_key, from_state, to_state,"
        + " attempt, scheduled_at, error_kind, error_message, external_post_id, occurred_at)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, queryTimeoutSeconds, sql,
        entry.id(), entry.contentKey(), from == null ? null : from.code(), entry.state().code(),
        entry.attemptCount(), entry.scheduledTime().toEpochMilli(), kindName(entry.lastErrorKind()),
        truncateError(entry.lastError()), entry.externalPostId(), Timestamp.from(entry.updatedAt()));
  }

  private Map<EntryState, Integer> countMap(Connection conn, String sql, String stateColumn, Object... params) {
    Map<EntryState, Integer> counts = new EnumMap<>(EntryState.class);
    for (EntryState state : EntryState.values()) {
      counts.put(state, 0);
    }
    JdbcTemplate.query(conn, queryTimeoutSeconds, sql, rs -> {
      counts.put(EntryState.fromCode(rs.getInt(stateColumn)), rs.getInt("n"));
      return null;
    }, params);
    return counts;
  }

  private static Long activeSlot(ScheduleEntry entry) {
    return entry.state().isActive() ? entry.scheduledTime().toEpochMilli() : null;
  }

  private static String activeKey(ScheduleEntry entry) {
    return entry.state() == EntryState.SKIPPED ? null : entry.contentKey();
  }

  private static String kindName(ErrorKind kind) {
    return kind == null ? null : kind.name();
  }

  private static ErrorKind errorKind(String name) {
    return name == null ? null : ErrorKind.valueOf(name);
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
