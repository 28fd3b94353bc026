package slotpost.lock;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives lock lifecycle events.
 */
@FunctionalInterface
public interface LockEventListener {

    /**
     * Logs each reclaim at {@code WARNING}.
     */
    LockEventListener LOGGING = new LockEventListener() {
        private final Logger logger = Logger.getLogger(LockEventListener.class.getName());

        @Override
        public void staleLockReclaimed(StaleLockReclaimed event) {
            logger.log(Level.WARNING, "Reclaimed stale scheduler lock from {0} ({1})",
                new Object[]{event.previous(), event.reason()});
        }
    };

    void staleLockReclaimed(StaleLockReclaimed event);
}
