package slotpost.jdbc.store;

import slotpost.allocate.SlotGrid;
import slotpost.jdbc.ScheduleTables;

import java.util.List;

/**
 * H2 schedule store. Primarily for tests and the CLI's embedded database.
 *
 * <p>Uses the standard SQL from {@link AbstractJdbcScheduleStore}.
 */
public final class H2ScheduleStore extends AbstractJdbcScheduleStore {

  public H2ScheduleStore() {
    super();
  }

  public H2ScheduleStore(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    super(tables, grid, queryTimeoutSeconds);
  }

  @Override
  public AbstractJdbcScheduleStore withSettings(ScheduleTables tables, SlotGrid grid, int queryTimeoutSeconds) {
    return new H2ScheduleStore(tables, grid, queryTimeoutSeconds);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
