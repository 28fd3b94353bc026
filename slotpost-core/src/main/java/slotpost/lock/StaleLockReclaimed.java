package slotpost.lock;

import java.time.Instant;

/**
 * A lock taken over from a holder that was no longer alive or whose lease expired.
 *
 * @param previous    holder whose lease was reclaimed, or {@code null} if its record was unreadable
 * @param reclaimedBy new holder
 * @param reason      why the previous holder was considered stale
 * @param at          reclaim time
 */
public record StaleLockReclaimed(LockOwner previous, LockOwner reclaimedBy, String reason, Instant at) {}
