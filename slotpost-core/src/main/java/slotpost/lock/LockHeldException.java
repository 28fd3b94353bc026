package slotpost.lock;

import java.util.Optional;

/**
 * Another live process holds the scheduler lock. Expected under contention: the
 * caller's run is a no-op.
 */
public final class LockHeldException extends Exception {
    private final transient LockOwner holder;

    public LockHeldException(LockOwner holder) {
        super(holder == null ? "Scheduler lock held by an unidentified owner"
            : "Scheduler lock held by " + holder);
        this.holder = holder;
    }

    /**
     * The holder, when it could be read.
     */
    public Optional<LockOwner> holder() {
        return Optional.ofNullable(holder);
    }
}
