package slotpost.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScheduleTablesTest {

  @Test
  void defaultNames() {
    assertEquals("slotpost_entry", ScheduleTables.DEFAULT.entries());
    assertEquals("slotpost_transition", ScheduleTables.DEFAULT.transitions());
    assertEquals("slotpost_lock", ScheduleTables.DEFAULT.locks());
  }

  @Test
  void acceptsCustomIdentifiers() {
    ScheduleTables tables = new ScheduleTables("blog_queue", "blog_queue_log", "blog_lock2");
    assertEquals("blog_queue", tables.entries());
  }

  @Test
  void rejectsUnsafeNames() {
    assertThrows(IllegalArgumentException.class, () -> new ScheduleTables("entries; DROP TABLE x", "t", "l"));
    assertThrows(IllegalArgumentException.class, () -> new ScheduleTables("e", "1transitions", "l"));
    assertThrows(IllegalArgumentException.class, () -> new ScheduleTables("e", "t", ""));
    assertThrows(NullPointerException.class, () -> new ScheduleTables(null, "t", "l"));
  }
}
