package slotpost.allocate;

import slotpost.SlotCollisionException;
import slotpost.spi.ScheduleStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out ascending free slots starting at a fixed boundary, skipping slots held
 * by PENDING or IN_PROGRESS entries.
 *
 * <p>Bound to one connection and intended for a single transaction. Obtain via
 * {@link SlotAllocator#frontLoadCursor}.
 */
public final class FrontLoadCursor {
    private final ScheduleStore store;
    private final Connection conn;
    private final SlotGrid grid;
    private final int maxProbeSlots;
    private final Set<Instant> handedOut = new HashSet<>();
    private Instant candidate;

    FrontLoadCursor(ScheduleStore store, Connection conn, SlotGrid grid, Instant start, int maxProbeSlots) {
        this.store = store;
        this.conn = conn;
        this.grid = grid;
        this.maxProbeSlots = maxProbeSlots;
        this.candidate = grid.requireAligned(start);
    }

    /**
     * Returns the next free slot and advances past it.
     *
     * @throws SlotCollisionException if no free slot exists within the probe bound
     */
    public Instant next() {
        Instant slot = SlotAllocator.probe(store, conn, grid, candidate, maxProbeSlots, handedOut);
        handedOut.add(slot);
        candidate = grid.next(slot);
        return slot;
    }

    /**
     * The boundary the next probe starts from.
     */
    public Instant position() {
        return candidate;
    }
}
