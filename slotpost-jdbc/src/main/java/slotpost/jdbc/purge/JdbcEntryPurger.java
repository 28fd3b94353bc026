package slotpost.jdbc.purge;

import slotpost.jdbc.JdbcTemplate;
import slotpost.jdbc.ScheduleTables;
import slotpost.model.EntryState;
import slotpost.spi.EntryPurger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Deletes POSTED and SKIPPED entries last updated before the cutoff, together with their
 * journal rows. FAILED entries are kept until an operator replays or removes them.
 *
 * <p>Each batch selects the ids first and then deletes by id, which works on H2,
 * PostgreSQL and MySQL alike (MySQL rejects {@code LIMIT} inside an {@code IN} subquery).
 */
public class JdbcEntryPurger implements EntryPurger {
  protected static final String FINISHED_STATE_IN =
      "(" + EntryState.POSTED.code() + "," + EntryState.SKIPPED.code() + ")";

  private final ScheduleTables tables;
  private final int queryTimeoutSeconds;

  public JdbcEntryPurger() {
    this(ScheduleTables.DEFAULT, 0);
  }

  public JdbcEntryPurger(ScheduleTables tables, int queryTimeoutSeconds) {
    this.tables = Objects.requireNonNull(tables, "tables");
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  protected ScheduleTables tables() {
    return tables;
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String select = "SELECT id FROM " + tables.entries()
        + " WHERE state IN " + FINISHED_STATE_IN + " AND updated_at<?"
        + " ORDER BY updated_at, id LIMIT ?";
    List<String> ids = JdbcTemplate.query(conn, queryTimeoutSeconds, select, rs -> rs.getString("id"),
        Timestamp.from(before), limit);
    if (ids.isEmpty()) {
      return 0;
    }
    String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
    Object[] params = ids.toArray();
    JdbcTemplate.update(conn, queryTimeoutSeconds,
        "DELETE FROM " + tables.transitions() + " WHERE entry_id IN (" + placeholders + ")", params);
    return JdbcTemplate.update(conn, queryTimeoutSeconds,
        "DELETE FROM " + tables.entries() + " WHERE id IN (" + placeholders + ")"
            + " AND state IN " + FINISHED_STATE_IN, params);
  }
}
