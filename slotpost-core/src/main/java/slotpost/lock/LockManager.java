package slotpost.lock;

import java.util.Optional;

/**
 * Process-level mutual exclusion for scheduler runs.
 *
 * <pre>{@code
 * try (LockLease lease = lockManager.acquire()) {
 *     // sweep, select, publish
 * } catch (LockHeldException e) {
 *     // another run is active
 * }
 * }</pre>
 *
 * <p>Implementations reclaim locks whose holder is no longer alive (per a
 * {@link LivenessProbe}) or whose lease exceeded a configured age, and report the
 * reclaim to a {@link LockEventListener}.
 *
 * @see FileLockManager
 */
public interface LockManager {

    /**
     * Acquires the lock, reclaiming it first if the current holder is stale.
     *
     * @return the lease; close it to release
     * @throws LockHeldException if a live holder owns the lock
     */
    LockLease acquire() throws LockHeldException;

    /**
     * The current holder, if any.
     */
    Optional<LockOwner> currentHolder();
}
