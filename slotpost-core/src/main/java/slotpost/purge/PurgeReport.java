package slotpost.purge;

import java.time.Instant;

/**
 * Result of one retention purge cycle.
 *
 * @param cutoff   entries finished before this instant were eligible
 * @param deleted  entries removed, journal rows included with each
 * @param batches  committed delete batches
 * @param lockHeld whether the cycle was skipped because a run held the scheduler lock
 */
public record PurgeReport(Instant cutoff, long deleted, int batches, boolean lockHeld) {

    static PurgeReport skipped(Instant cutoff) {
        return new PurgeReport(cutoff, 0, 0, true);
    }
}
