package slotpost.jdbc.store;

import slotpost.allocate.SlotGrid;
import slotpost.jdbc.ScheduleTables;

import java.util.List;

/**
 * MySQL schedule store. Also handles MariaDB URLs.
 *
 * <p>Uses the standard SQL from {@link AbstractJdbcScheduleStore}; the unique indexes on
 * {@code active_slot} and {@code active_key} ignore NULLs as in the other databases.
 */
public final class MySqlScheduleStore extends AbstractJdbcScheduleStore {

  public MySqlScheduleStore() {
    super();
  }

  public MySqlScheduleStore(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    super(tables, grid, queryTimeoutSeconds);
  }

  @Override
  public AbstractJdbcScheduleStore withSettings(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    return new MySqlScheduleStore(tables, grid, queryTimeoutSeconds);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }
}
