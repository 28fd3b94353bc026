package slotpost.model;

import com.github.f4b6a3.ulid.UlidCreator;
import slotpost.IllegalTransitionException;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only record of one persisted schedule row.
 *
 * @see slotpost.spi.ScheduleStore
 */
public record ScheduleEntry(
    String id,
    String contentKey,
    String payload,
    Instant scheduledTime,
    EntryState state,
    int attemptCount,
    int recoveryRounds,
    ErrorKind lastErrorKind,
    String lastError,
    EntrySource source,
    String externalPostId,
    Instant createdAt,
    Instant updatedAt
) {

    public ScheduleEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(contentKey, "contentKey");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(scheduledTime, "scheduledTime");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Creates a new PENDING entry with a fresh ULID.
     */
    public static ScheduleEntry pending(ContentItem item, Instant scheduledTime, EntrySource source, Instant now) {
        return new ScheduleEntry(
            UlidCreator.getMonotonicUlid().toString(),
            item.contentKey(),
            item.payload(),
            scheduledTime,
            EntryState.PENDING,
            0,
            0,
            null,
            null,
            source,
            null,
            now,
            now);
    }

    /**
     * Returns this entry as it looks after {@code transition}.
     *
     * <p>Entering IN_PROGRESS counts an attempt. A new scheduled time places the entry
     * on the front-load path. Error details are replaced when the transition carries
     * one, cleared on POSTED and when leaving FAILED, and kept otherwise.
     *
     * @throws IllegalTransitionException if the edge is not allowed or this entry is
     *                                    not in the transition's source state
     */
    public ScheduleEntry apply(Transition transition) {
        if (!id.equals(transition.entryId())) {
            throw new IllegalArgumentException("Transition for " + transition.entryId() + " applied to " + id);
        }
        if (!transition.from().canTransitionTo(transition.to())) {
            throw new IllegalTransitionException(id, transition.from(), transition.to(), "not an allowed edge");
        }
        if (state != transition.from()) {
            throw new IllegalTransitionException(id, transition.from(), transition.to(), "entry is " + state);
        }

        int attempts = transition.to() == EntryState.IN_PROGRESS ? attemptCount + 1
            : transition.resetAttempts() ? 0 : attemptCount;
        int rounds = transition.countRecovery() ? recoveryRounds + 1
            : transition.resetRecovery() ? 0 : recoveryRounds;

        ErrorKind kind = lastErrorKind;
        String error = lastError;
        if (transition.errorKind() != null) {
            kind = transition.errorKind();
            error = transition.error();
        } else if (transition.to() == EntryState.POSTED || transition.from() == EntryState.FAILED) {
            kind = null;
            error = null;
        }

        Instant slot = scheduledTime;
        EntrySource placed = source;
        if (transition.scheduledTime() != null) {
            slot = transition.scheduledTime();
            placed = EntrySource.FRONTLOAD;
        }

        return new ScheduleEntry(id, contentKey, payload, slot, transition.to(), attempts, rounds,
            kind, error, placed,
            transition.externalPostId() != null ? transition.externalPostId() : externalPostId,
            createdAt, transition.at());
    }
}
