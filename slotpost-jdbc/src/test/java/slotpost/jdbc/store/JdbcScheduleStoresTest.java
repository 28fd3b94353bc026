package slotpost.jdbc.store;

import org.junit.jupiter.api.Test;
import slotpost.allocate.SlotGrid;
import slotpost.jdbc.ScheduleTables;
import slotpost.jdbc.Schemas;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcScheduleStoresTest {

  @Test
  void registersBundledStores() {
    assertEquals(3, JdbcScheduleStores.all().size());
    assertInstanceOf(H2ScheduleStore.class, JdbcScheduleStores.get("h2"));
    assertInstanceOf(PostgresScheduleStore.class, JdbcScheduleStores.get("PostgreSQL"));
    assertInstanceOf(MySqlScheduleStore.class, JdbcScheduleStores.get("mysql"));
  }

  @Test
  void unknownNameFails() {
    assertThrows(IllegalArgumentException.class, () -> JdbcScheduleStores.get("oracle"));
  }

  @Test
  void detectsFromUrl() {
    assertInstanceOf(H2ScheduleStore.class, JdbcScheduleStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(PostgresScheduleStore.class, JdbcScheduleStores.detect("jdbc:postgresql://db:5432/app"));
    assertInstanceOf(MySqlScheduleStore.class, JdbcScheduleStores.detect("jdbc:mysql://db/app"));
    assertInstanceOf(MySqlScheduleStore.class, JdbcScheduleStores.detect("JDBC:MARIADB://db/app"));
  }

  @Test
  void detectRejectsUnsupportedUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcScheduleStores.detect("jdbc:sqlserver://db"));
    assertThrows(IllegalArgumentException.class, () -> JdbcScheduleStores.detect(""));
  }

  @Test
  void detectsFromDataSource() throws Exception {
    assertInstanceOf(H2ScheduleStore.class, JdbcScheduleStores.detect(Schemas.h2()));
  }

  @Test
  void withSettingsKeepsDialect() {
    SlotGrid hourly = new SlotGrid(Duration.ofHours(1));
    ScheduleTables tables = new ScheduleTables("queue", "queue_log", "queue_lock");

    AbstractJdbcScheduleStore store = JdbcScheduleStores.get("postgresql").withSettings(tables, hourly, 5);

    assertInstanceOf(PostgresScheduleStore.class, store);
    assertEquals(tables, store.tables());
    assertEquals(hourly, store.grid());
    assertThrows(IllegalArgumentException.class, () -> store.withSettings(tables, hourly, -1));
  }
}
