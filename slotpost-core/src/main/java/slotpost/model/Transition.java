package slotpost.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A requested state change, applied by {@link slotpost.spi.ScheduleStore#transition}
 * as a compare-and-set on {@code from}.
 *
 * <p>Fields that do not apply to an edge are {@code null}. Use the static factories
 * rather than the canonical constructor.
 *
 * @param entryId          entry to change
 * @param from             expected current state
 * @param to               target state
 * @param at               transition time, recorded as {@code updatedAt} and in the journal
 * @param scheduledTime    new scheduled time, or {@code null} to keep the current one
 * @param errorKind        failure classification for {@code FAILED} and retry edges
 * @param error            failure message
 * @param externalPostId   publisher id for {@code POSTED}
 * @param resetAttempts    set attempt count to zero
 * @param countRecovery    increment recovery rounds and mark the entry as front-loaded
 * @param resetRecovery    set recovery rounds to zero (manual replay)
 */
public record Transition(
    String entryId,
    EntryState from,
    EntryState to,
    Instant at,
    Instant scheduledTime,
    ErrorKind errorKind,
    String error,
    String externalPostId,
    boolean resetAttempts,
    boolean countRecovery,
    boolean resetRecovery
) {

    public Transition {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(at, "at");
    }

    /** {@code PENDING → IN_PROGRESS}; the store increments the attempt count. */
    public static Transition start(String entryId, Instant at) {
        return new Transition(entryId, EntryState.PENDING, EntryState.IN_PROGRESS, at,
            null, null, null, null, false, false, false);
    }

    /** {@code IN_PROGRESS → POSTED}. */
    public static Transition posted(String entryId, String externalPostId, Instant at) {
        return new Transition(entryId, EntryState.IN_PROGRESS, EntryState.POSTED, at,
            null, null, null, externalPostId, false, false, false);
    }

    /** {@code IN_PROGRESS → PENDING} keeping the scheduled time. */
    public static Transition retry(String entryId, ErrorKind kind, String error, Instant at) {
        return new Transition(entryId, EntryState.IN_PROGRESS, EntryState.PENDING, at,
            null, kind, error, null, false, false, false);
    }

    /** {@code IN_PROGRESS → FAILED}. */
    public static Transition failed(String entryId, ErrorKind kind, String error, Instant at) {
        return new Transition(entryId, EntryState.IN_PROGRESS, EntryState.FAILED, at,
            null, kind, error, null, false, false, false);
    }

    /** {@code PENDING → SKIPPED}. */
    public static Transition skipped(String entryId, Instant at) {
        return new Transition(entryId, EntryState.PENDING, EntryState.SKIPPED, at,
            null, null, null, null, false, false, false);
    }

    /** {@code FAILED → PENDING} by the recovery sweeper: clears the error, counts a round. */
    public static Transition recover(String entryId, Instant slot, Instant at) {
        return new Transition(entryId, EntryState.FAILED, EntryState.PENDING, at,
            Objects.requireNonNull(slot, "slot"), null, null, null, true, true, false);
    }

    /** {@code FAILED → PENDING} by an operator: clears the error and both counters. */
    public static Transition replay(String entryId, Instant slot, Instant at) {
        return new Transition(entryId, EntryState.FAILED, EntryState.PENDING, at,
            Objects.requireNonNull(slot, "slot"), null, null, null, true, false, true);
    }
}
