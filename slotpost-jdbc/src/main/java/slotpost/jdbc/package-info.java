/**
 * JDBC persistence for SlotPost: the {@link slotpost.jdbc.store schedule stores},
 * the {@link slotpost.jdbc.purge retention purger} and the
 * {@link slotpost.jdbc.lock row-based scheduler lock}. DDL for H2, PostgreSQL and MySQL
 * ships under {@code /schema}.
 */
package slotpost.jdbc;
