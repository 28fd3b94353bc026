package slotpost.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC schedule stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/slotpost.jdbc.store.AbstractJdbcScheduleStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcScheduleStore store = JdbcScheduleStores.detect(dataSource);
 * AbstractJdbcScheduleStore pg = JdbcScheduleStores.get("postgresql");
 * }</pre>
 */
public final class JdbcScheduleStores {

  private static final List<AbstractJdbcScheduleStore> STORES;
  private static final Map<String, AbstractJdbcScheduleStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcScheduleStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcScheduleStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcScheduleStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcScheduleStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcScheduleStore get(String name) {
    AbstractJdbcScheduleStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown schedule store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcScheduleStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect schedule store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcScheduleStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcScheduleStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No schedule store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + STORES.stream().flatMap(s -> s.jdbcUrlPrefixes().stream()).toList());
  }
}
