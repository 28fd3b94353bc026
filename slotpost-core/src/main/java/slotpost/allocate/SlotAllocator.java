package slotpost.allocate;

import slotpost.SlotCollisionException;
import slotpost.model.ContentItem;
import slotpost.model.EntrySource;
import slotpost.model.ScheduleEntry;
import slotpost.spi.ScheduleStore;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns grid-aligned slots to newly discovered items and inserts them as PENDING entries.
 *
 * <p>Placement depends on how many items of the batch survive deduplication:
 * <ul>
 *   <li><b>Steady state</b> ({@code k <= 1}): one cadence after the queue tail, or one
 *       cadence after {@code ceil(now)} when the queue is empty or its tail has passed.</li>
 *   <li><b>Front-loading</b> ({@code k > 1}): starting at {@code ceil(now + lead)} and
 *       stepping by the cadence, regardless of the queued tail.</li>
 * </ul>
 * Both paths probe forward past occupied slots, and discovery order maps to ascending slots.
 *
 * <p>The allocator works on a caller-supplied connection; callers run it inside one
 * transaction while holding the scheduler lock. Create instances via {@link #builder()}.
 */
public final class SlotAllocator {
    private static final Logger logger = Logger.getLogger(SlotAllocator.class.getName());

    private final ScheduleStore store;
    private final SlotGrid grid;
    private final Duration frontLoadLead;
    private final int maxProbeSlots;

    private SlotAllocator(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.grid = builder.grid != null ? builder.grid : SlotGrid.defaultGrid();
        Duration lead = builder.frontLoadLead != null ? builder.frontLoadLead : Duration.ofMinutes(2);
        if (lead.isNegative()) {
            throw new IllegalArgumentException("frontLoadLead must be >= 0");
        }
        this.frontLoadLead = lead;
        int probe = builder.maxProbeSlots > 0 ? builder.maxProbeSlots : grid.slotsPerDay() * 4;
        this.maxProbeSlots = probe;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SlotGrid grid() {
        return grid;
    }

    /**
     * Deduplicates {@code items}, assigns slots and inserts the accepted entries.
     *
     * @param conn  connection the caller commits
     * @param items batch in discovery order
     * @param now   allocation time
     * @return accepted entries and rejected duplicates
     * @throws SlotCollisionException if no free slot exists within the probe bound
     */
    public AllocationResult allocate(Connection conn, List<ContentItem> items, Instant now) {
        Objects.requireNonNull(items, "items");
        List<ContentItem> accepted = new ArrayList<>();
        List<ContentItem> rejected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ContentItem item : items) {
            if (!seen.add(item.contentKey())
                || store.findActiveByContentKey(conn, item.contentKey()).isPresent()) {
                logger.log(Level.FINE, "Rejecting duplicate content key {0}", item.contentKey());
                rejected.add(item);
            } else {
                accepted.add(item);
            }
        }
        if (accepted.isEmpty()) {
            return new AllocationResult(List.of(), rejected);
        }

        List<ScheduleEntry> scheduled = new ArrayList<>(accepted.size());
        if (accepted.size() == 1) {
            Instant slot = steadySlot(conn, now);
            scheduled.add(insert(conn, accepted.get(0), slot, EntrySource.DISCOVERY, now));
        } else {
            FrontLoadCursor cursor = frontLoadCursor(conn, now);
            for (ContentItem item : accepted) {
                scheduled.add(insert(conn, item, cursor.next(), EntrySource.FRONTLOAD, now));
            }
        }
        return new AllocationResult(scheduled, rejected);
    }

    /**
     * Steady-state slot for a single item: the tail plus one cadence if that lies after
     * {@code now}, otherwise {@code ceil(now)} plus one cadence; probed forward if taken.
     */
    public Instant steadySlot(Connection conn, Instant now) {
        Instant start = grid.next(grid.ceil(now));
        Optional<Instant> tail = store.latestActiveSlot(conn);
        if (tail.isPresent()) {
            Instant afterTail = grid.next(grid.ceil(tail.get()));
            if (afterTail.isAfter(now)) {
                start = afterTail;
            }
        }
        return probe(store, conn, grid, start, maxProbeSlots, Set.of());
    }

    /**
     * Cursor over the front-load path: {@code ceil(now + lead)}, then every cadence.
     * Shared with the recovery sweeper and manual replay.
     */
    public FrontLoadCursor frontLoadCursor(Connection conn, Instant now) {
        return new FrontLoadCursor(store, conn, grid, grid.ceil(now.plus(frontLoadLead)), maxProbeSlots);
    }

    private ScheduleEntry insert(Connection conn, ContentItem item, Instant slot, EntrySource source, Instant now) {
        ScheduleEntry entry = ScheduleEntry.pending(item, slot, source, now);
        store.put(conn, entry);
        logger.log(Level.FINE, "Placed {0} at {1} ({2})", new Object[]{item.contentKey(), slot, source});
        return entry;
    }

    static Instant probe(ScheduleStore store, Connection conn, SlotGrid grid, Instant start,
        int maxProbeSlots, Set<Instant> reserved) {
        Instant slot = start;
        for (int i = 0; i < maxProbeSlots; i++) {
            if (!reserved.contains(slot) && !store.isSlotOccupied(conn, slot)) {
                return slot;
            }
            slot = grid.next(slot);
        }
        throw new SlotCollisionException(start,
            "No free slot within " + maxProbeSlots + " slots from " + start);
    }

    /**
     * Builder for {@link SlotAllocator}.
     */
    public static final class Builder {
        private ScheduleStore store;
        private SlotGrid grid;
        private Duration frontLoadLead;
        private int maxProbeSlots;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder store(ScheduleStore store) {
            this.store = store;
            return this;
        }

        /**
         * Optional. Defaults to the 15-minute grid.
         */
        public Builder grid(SlotGrid grid) {
            this.grid = grid;
            return this;
        }

        /**
         * Minimum distance from {@code now} to the first front-loaded slot.
         *
         * <p>Optional. Defaults to 2 minutes. Must be &ge; 0.
         */
        public Builder frontLoadLead(Duration frontLoadLead) {
            this.frontLoadLead = frontLoadLead;
            return this;
        }

        /**
         * Maximum slots inspected per placement before giving up.
         *
         * <p>Optional. Defaults to four days of slots.
         */
        public Builder maxProbeSlots(int maxProbeSlots) {
            this.maxProbeSlots = maxProbeSlots;
            return this;
        }

        public SlotAllocator build() {
            return new SlotAllocator(this);
        }
    }
}
