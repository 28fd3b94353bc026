package slotpost.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes terminal schedule entries (POSTED and SKIPPED) and their journal rows
 * once they are older than a cutoff. FAILED entries are never purged.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code slotpost-jdbc} module.
 */
public interface EntryPurger {

    /**
     * Deletes terminal entries last updated before the given cutoff.
     *
     * @param conn   the JDBC connection (caller controls transaction)
     * @param before delete entries where {@code updated_at < before}
     * @param limit  maximum number of entries to delete in this batch
     * @return the number of entries actually deleted
     */
    int purge(Connection conn, Instant before, int limit);
}
