package slotpost;

import slotpost.model.EntryState;

/**
 * Thrown by the store when a requested state change is not an edge of the state
 * machine, or the entry is no longer in the expected source state.
 */
public final class IllegalTransitionException extends RuntimeException {
    private final String entryId;
    private final EntryState from;
    private final EntryState to;

    public IllegalTransitionException(String entryId, EntryState from, EntryState to, String reason) {
        super("Illegal transition " + from + " -> " + to + " for entry " + entryId + ": " + reason);
        this.entryId = entryId;
        this.from = from;
        this.to = to;
    }

    public String entryId() {
        return entryId;
    }

    public EntryState from() {
        return from;
    }

    public EntryState to() {
        return to;
    }
}
