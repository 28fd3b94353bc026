package slotpost.execute;

/**
 * Phases of one executor invocation:
 * {@code IDLE → LOCK_ACQUIRED → RECOVERY_SWEPT → SLOT_SELECTED → PUBLISHING → {COMPLETED | FAILED} → IDLE}.
 */
public enum ExecutionPhase {
    IDLE,
    LOCK_ACQUIRED,
    RECOVERY_SWEPT,
    SLOT_SELECTED,
    PUBLISHING,
    COMPLETED,
    FAILED
}
