package slotpost.allocate;

import slotpost.model.ContentItem;
import slotpost.model.ScheduleEntry;

import java.util.List;

/**
 * Outcome of placing one discovery batch.
 *
 * @param scheduled          new PENDING entries in discovery order (ascending slots)
 * @param rejectedDuplicates items whose content key was already scheduled or repeated in the batch
 */
public record AllocationResult(List<ScheduleEntry> scheduled, List<ContentItem> rejectedDuplicates) {

    public static final AllocationResult EMPTY = new AllocationResult(List.of(), List.of());

    public AllocationResult {
        scheduled = List.copyOf(scheduled);
        rejectedDuplicates = List.copyOf(rejectedDuplicates);
    }

    /**
     * Whether the batch was placed on the front-load path.
     */
    public boolean frontLoaded() {
        return scheduled.size() > 1;
    }
}
