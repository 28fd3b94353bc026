package slotpost.jdbc;

import slotpost.ScheduleStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in the schedule store, purger and lock manager.
 *
 * <p>Every statement carries the caller's query timeout in seconds; {@code 0} means no limit.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, int timeoutSeconds, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new ScheduleStoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, int timeoutSeconds, String sql, RowMapper<T> mapper,
      Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new ScheduleStoreException("Failed to execute query", e);
    }
  }

  /** Execute a SELECT returning a single number, such as {@code COUNT(*)}. */
  public static long queryForLong(Connection conn, int timeoutSeconds, String sql, Object... params) {
    List<Long> rows = query(conn, timeoutSeconds, sql, rs -> rs.getLong(1), params);
    return rows.isEmpty() ? 0L : rows.get(0);
  }

  /**
   * Whether {@code e} (or its cause) reports a unique or foreign key violation.
   */
  public static boolean isConstraintViolation(Throwable e) {
    Throwable t = e;
    while (t != null) {
      if (t instanceof SQLIntegrityConstraintViolationException) {
        return true;
      }
      if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("23")) {
        return true;
      }
      t = t.getCause();
    }
    return false;
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
