package slotpost;

import java.time.Instant;

/**
 * The slot is already held by a PENDING or IN_PROGRESS entry, or no free slot
 * was found within the probe bound.
 */
public final class SlotCollisionException extends ScheduleConflictException {
    private final Instant slot;

    public SlotCollisionException(Instant slot) {
        this(slot, "Slot already occupied: " + slot);
    }

    public SlotCollisionException(Instant slot, String message) {
        super(message);
        this.slot = slot;
    }

    public Instant slot() {
        return slot;
    }
}
