package slotpost.failed;

import slotpost.allocate.SlotAllocator;
import slotpost.lock.LockHeldException;
import slotpost.lock.LockLease;
import slotpost.lock.LockManager;
import slotpost.model.EntryState;
import slotpost.model.ScheduleEntry;
import slotpost.model.Transition;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.ScheduleStore;
import slotpost.util.Transactions;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for inspecting and resolving FAILED entries, and for skipping
 * superseded PENDING ones.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 * Mutating calls take the scheduler lock so they never race an executor run.
 *
 * @see ScheduleStore#queryFailed
 * @see ScheduleStore#countFailed
 */
public final class FailedEntryManager {
    private static final Logger logger = Logger.getLogger(FailedEntryManager.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ScheduleStore store;
    private final SlotAllocator allocator;
    private final LockManager lockManager;
    private final Clock clock;

    public FailedEntryManager(ConnectionProvider connectionProvider, ScheduleStore store,
        SlotAllocator allocator, LockManager lockManager, Clock clock) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Lists FAILED entries, oldest first.
     *
     * @param limit maximum number of entries to return
     */
    public List<ScheduleEntry> query(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return Transactions.readOnly(connectionProvider, conn -> store.queryFailed(conn, limit));
    }

    public int count() {
        return Transactions.readOnly(connectionProvider, store::countFailed);
    }

    /**
     * Re-enqueues a FAILED entry on the front-load path regardless of its error kind,
     * resetting its attempt count and recovery rounds.
     *
     * @param entryId the entry to replay
     * @return the re-enqueued entry, or empty if it does not exist or is not FAILED
     * @throws LockHeldException if an executor run holds the lock
     */
    public Optional<ScheduleEntry> replay(String entryId) throws LockHeldException {
        Objects.requireNonNull(entryId, "entryId");
        try (LockLease lease = lockManager.acquire()) {
            Instant now = clock.instant();
            Optional<ScheduleEntry> replayed = Transactions.inTransaction(connectionProvider, conn -> {
                Optional<ScheduleEntry> entry = store.findById(conn, entryId);
                if (entry.isEmpty() || entry.get().state() != EntryState.FAILED) {
                    return Optional.<ScheduleEntry>empty();
                }
                Instant slot = allocator.frontLoadCursor(conn, now).next();
                return Optional.of(store.transition(conn, Transition.replay(entryId, slot, now)));
            });
            replayed.ifPresent(e -> logger.log(Level.INFO, "Replayed {0} ({1}) into slot {2}",
                new Object[]{e.id(), e.contentKey(), e.scheduledTime()}));
            return replayed;
        }
    }

    /**
     * Marks a PENDING entry as SKIPPED, releasing its slot and content key.
     *
     * @param entryId the entry to skip
     * @return {@code true} if the entry was skipped, {@code false} if not found or not PENDING
     * @throws LockHeldException if an executor run holds the lock
     */
    public boolean skip(String entryId) throws LockHeldException {
        Objects.requireNonNull(entryId, "entryId");
        try (LockLease lease = lockManager.acquire()) {
            Instant now = clock.instant();
            boolean skipped = Transactions.inTransaction(connectionProvider, conn -> {
                Optional<ScheduleEntry> entry = store.findById(conn, entryId);
                if (entry.isEmpty() || entry.get().state() != EntryState.PENDING) {
                    return false;
                }
                store.transition(conn, Transition.skipped(entryId, now));
                return true;
            });
            if (skipped) {
                logger.log(Level.INFO, "Skipped {0}", entryId);
            }
            return skipped;
        }
    }
}
