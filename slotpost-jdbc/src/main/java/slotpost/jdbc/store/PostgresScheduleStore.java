package slotpost.jdbc.store;

import slotpost.allocate.SlotGrid;
import slotpost.jdbc.ScheduleTables;

import java.util.List;

/**
 * PostgreSQL schedule store.
 */
public final class PostgresScheduleStore extends AbstractJdbcScheduleStore {

  public PostgresScheduleStore() {
    super();
  }

  public PostgresScheduleStore(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    super(tables, grid, queryTimeoutSeconds);
  }

  @Override
  public AbstractJdbcScheduleStore withSettings(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    return new PostgresScheduleStore(tables, grid, queryTimeoutSeconds);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
