package slotpost.execute;

import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;

import java.util.Set;

/**
 * Bounded retry rules shared by the executor and the recovery sweeper.
 *
 * @see BoundedRetryPolicy
 */
public interface RetryPolicy {

    /**
     * What to do with an entry after a failed attempt.
     */
    enum Decision {
        /** Back to PENDING in the same slot. */
        RETRY,
        /** Move to FAILED. */
        FAIL
    }

    /**
     * Decides the fate of an entry whose {@code attempts}-th attempt failed with {@code kind}.
     *
     * @param attempts attempts made so far, including the failed one (1-based)
     */
    Decision onFailure(int attempts, ErrorKind kind);

    /**
     * Whether the recovery sweeper may re-enqueue this FAILED entry.
     */
    boolean isRecoverable(ScheduleEntry entry);

    /**
     * Error kinds eligible for retry and recovery.
     */
    Set<ErrorKind> retriableKinds();

    int maxAttempts();

    int maxRecoveryRounds();
}
