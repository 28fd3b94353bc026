package slotpost.recovery;

import slotpost.model.ScheduleEntry;

import java.time.Instant;
import java.util.List;

/**
 * Result of one recovery sweep.
 *
 * @param recovered entries moved back to PENDING, with their new slots
 * @param sweptAt   sweep time
 */
public record SweepReport(List<ScheduleEntry> recovered, Instant sweptAt) {

    public SweepReport {
        recovered = List.copyOf(recovered);
    }

    public static SweepReport none(Instant at) {
        return new SweepReport(List.of(), at);
    }

    public int count() {
        return recovered.size();
    }
}
