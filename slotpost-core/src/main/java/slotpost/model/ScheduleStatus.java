package slotpost.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time summary of the schedule, read from the last committed state.
 *
 * @param countsByState current number of entries per state (every state present)
 * @param overdue       PENDING entries whose slot has already passed
 * @param nextDue       earliest PENDING scheduled time, or {@code null} when the queue is empty
 * @param upcoming      next PENDING entries in slot order
 * @param postedToday   POSTED transitions since the start of the current UTC day
 * @param failedToday   FAILED transitions since the start of the current UTC day
 * @param generatedAt   clock reading when the summary was taken
 */
public record ScheduleStatus(
    Map<EntryState, Integer> countsByState,
    int overdue,
    Instant nextDue,
    List<ScheduleEntry> upcoming,
    int postedToday,
    int failedToday,
    Instant generatedAt
) {

    public ScheduleStatus {
        countsByState = Map.copyOf(countsByState);
        upcoming = List.copyOf(upcoming);
    }

    public int count(EntryState state) {
        return countsByState.getOrDefault(state, 0);
    }

    public int pending() {
        return count(EntryState.PENDING);
    }
}
