package slotpost.execute;

/**
 * Result of an executor invocation or of one publish attempt within it.
 */
public enum ExecutionOutcome {
    /** Another live run holds the lock; nothing was touched. */
    LOCK_HELD,
    /** No entry was due. */
    NO_ACTION,
    /** The entry was published and committed as POSTED. */
    POSTED,
    /** The attempt failed with a retriable error; the entry is PENDING in the same slot. */
    RETRY_SCHEDULED,
    /** The entry moved to FAILED. */
    FAILED,
    /** The schedule store or lock could not be read or written. */
    STORE_ERROR
}
