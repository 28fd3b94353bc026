package slotpost.util;

import slotpost.ScheduleStoreException;
import slotpost.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs store work on a fresh connection, either inside one JDBC transaction or in
 * auto-commit mode for reads.
 *
 * <pre>{@code
 * ScheduleEntry started = Transactions.inTransaction(connectionProvider,
 *     conn -> store.transition(conn, Transition.start(id, now)));
 * }</pre>
 *
 * <p>{@link SQLException}s are rethrown as {@link ScheduleStoreException}; runtime
 * exceptions from the work propagate unchanged after rollback.
 */
public final class Transactions {

    /**
     * Unit of work executed against an open connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private Transactions() {
    }

    /**
     * Runs {@code work} with auto-commit disabled, commits on success and rolls back
     * on any failure.
     */
    public static <T> T inTransaction(ConnectionProvider connectionProvider, SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new ScheduleStoreException("Schedule transaction failed", e);
        }
    }

    /**
     * Runs {@code work} in auto-commit mode. Intended for queries.
     */
    public static <T> T readOnly(ConnectionProvider connectionProvider, SqlWork<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return work.run(conn);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Schedule query failed", e);
        }
    }

    private static void rollback(Connection conn, Exception failure) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
