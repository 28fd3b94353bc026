/**
 * Scheduler mutual exclusion: lock managers, leases, liveness probing and stale-lock reclaim.
 *
 * @see slotpost.lock.LockManager
 * @see slotpost.lock.FileLockManager
 */
package slotpost.lock;
