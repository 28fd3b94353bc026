package slotpost.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a schedule entry. Stored as integer codes in the database.
 *
 * <p>Typical transitions: {@code PENDING → IN_PROGRESS → POSTED},
 * {@code PENDING → IN_PROGRESS → PENDING} (retry under the attempt ceiling),
 * {@code IN_PROGRESS → FAILED → PENDING} (recovery re-enqueue), or
 * {@code PENDING → SKIPPED} (superseded item).
 */
public enum EntryState {
    /**
     * Waiting for its slot.
     */
    PENDING(0),
    /**
     * Publish attempt in flight.
     */
    IN_PROGRESS(1),
    /**
     * Published; terminal.
     */
    POSTED(2),
    /**
     * Failed; eligible for recovery if the failure was retriable.
     */
    FAILED(3),
    /**
     * Superseded; terminal.
     */
    SKIPPED(4);

    private final int code;

    EntryState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a state from its database code.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static EntryState fromCode(int code) {
        for (EntryState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown entry state code: " + code);
    }

    public boolean isTerminal() {
        return this == POSTED || this == SKIPPED;
    }

    /**
     * Whether the entry occupies its slot (at most one per scheduled time).
     */
    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }

    /**
     * Returns whether {@code this → target} is an edge of the state machine.
     */
    public boolean canTransitionTo(EntryState target) {
        return allowedTargets().contains(target);
    }

    private Set<EntryState> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, SKIPPED);
            case IN_PROGRESS -> EnumSet.of(POSTED, FAILED, PENDING);
            case FAILED -> EnumSet.of(PENDING);
            case POSTED, SKIPPED -> EnumSet.noneOf(EntryState.class);
        };
    }
}
