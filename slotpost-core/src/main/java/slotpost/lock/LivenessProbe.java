package slotpost.lock;

/**
 * Decides whether a lock holder is still running.
 *
 * @see ProcessLivenessProbe
 */
@FunctionalInterface
public interface LivenessProbe {

    boolean isAlive(LockOwner owner);
}
