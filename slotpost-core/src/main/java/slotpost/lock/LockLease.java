package slotpost.lock;

/**
 * A held scheduler lock. Release with try-with-resources; closing more than once is a no-op.
 */
public interface LockLease extends AutoCloseable {

    LockOwner owner();

    /**
     * Releases the lock if this lease still owns it.
     */
    @Override
    void close();
}
