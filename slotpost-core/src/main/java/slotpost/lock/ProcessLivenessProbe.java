package slotpost.lock;

/**
 * Checks holders on this host through {@link ProcessHandle}. Holders on other hosts
 * cannot be inspected and are reported alive; pair with a maximum lease age when the
 * lock is shared between hosts.
 */
public final class ProcessLivenessProbe implements LivenessProbe {
    public static final ProcessLivenessProbe INSTANCE = new ProcessLivenessProbe();

    @Override
    public boolean isAlive(LockOwner owner) {
        if (!owner.isLocal()) {
            return true;
        }
        return ProcessHandle.of(owner.pid())
            .map(ProcessHandle::isAlive)
            .orElse(false);
    }
}
