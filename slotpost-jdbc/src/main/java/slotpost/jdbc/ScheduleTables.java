package slotpost.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC components.
 *
 * @param entries     schedule table
 * @param transitions journal table
 * @param locks       scheduler lock table
 */
public record ScheduleTables(String entries, String transitions, String locks) {
  public static final ScheduleTables DEFAULT =
      new ScheduleTables("slotpost_entry", "slotpost_transition", "slotpost_lock");

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public ScheduleTables {
    validate(entries);
    validate(transitions);
    validate(locks);
  }

  /**
   * Checks that {@code tableName} is a plain SQL identifier, since it is concatenated into statements.
   *
   * @throws IllegalArgumentException if it is not
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
