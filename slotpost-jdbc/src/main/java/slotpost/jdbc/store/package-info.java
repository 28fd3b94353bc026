/**
 * JDBC {@link slotpost.spi.ScheduleStore} implementations for H2, PostgreSQL and MySQL,
 * discovered through {@link slotpost.jdbc.store.JdbcScheduleStores}.
 */
package slotpost.jdbc.store;
