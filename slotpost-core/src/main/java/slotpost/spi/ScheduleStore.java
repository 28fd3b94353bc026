package slotpost.spi;

import slotpost.model.EntryState;
import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;
import slotpost.model.StateTransition;
import slotpost.model.Transition;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence operations for schedule entries and their transition journal.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Every mutation appends a journal row on the same
 * connection; committing both together is the caller's job.
 * Implementations live in the {@code slotpost-jdbc} module.
 */
public interface ScheduleStore {

    /**
     * Inserts a new PENDING entry and its creation journal row.
     *
     * @throws slotpost.DuplicateContentException if a non-SKIPPED entry has the same content key
     * @throws slotpost.SlotCollisionException    if an active entry already holds the slot
     * @throws IllegalArgumentException           if the scheduled time is off the grid
     */
    void put(Connection conn, ScheduleEntry entry);

    Optional<ScheduleEntry> findById(Connection conn, String id);

    /**
     * Finds the non-SKIPPED entry holding the content key, if any.
     */
    Optional<ScheduleEntry> findActiveByContentKey(Connection conn, String contentKey);

    /**
     * Whether a PENDING or IN_PROGRESS entry holds the slot.
     */
    boolean isSlotOccupied(Connection conn, Instant slot);

    /**
     * Latest scheduled time among PENDING and IN_PROGRESS entries (the queue tail).
     */
    Optional<Instant> latestActiveSlot(Connection conn);

    /**
     * The PENDING entry with the smallest scheduled time {@code <= now},
     * ties broken by creation time and then id.
     */
    Optional<ScheduleEntry> nextDue(Connection conn, Instant now);

    /**
     * Applies a state change as a compare-and-set on the expected source state and
     * appends a journal row.
     *
     * @return the updated entry
     * @throws slotpost.IllegalTransitionException if the edge is not allowed, or the
     *                                             entry is missing or not in {@code from}
     */
    ScheduleEntry transition(Connection conn, Transition transition);

    /**
     * Current number of entries per state. Every state is present in the result.
     */
    Map<EntryState, Integer> countByState(Connection conn);

    /**
     * Number of journal rows per target state recorded at or after {@code since}.
     * Every state is present in the result.
     */
    Map<EntryState, Integer> countTransitionsSince(Connection conn, Instant since);

    /**
     * FAILED entries with a last error kind in {@code kinds} and fewer than
     * {@code maxRounds} recovery rounds, oldest update first.
     */
    List<ScheduleEntry> findRecoverable(Connection conn, Set<ErrorKind> kinds, int maxRounds, int limit);

    /**
     * FAILED entries, oldest update first.
     */
    List<ScheduleEntry> queryFailed(Connection conn, int limit);

    int countFailed(Connection conn);

    /**
     * IN_PROGRESS entries last updated before {@code updatedBefore}.
     */
    List<ScheduleEntry> findStuckInProgress(Connection conn, Instant updatedBefore);

    /**
     * PENDING entries in slot order.
     */
    List<ScheduleEntry> upcoming(Connection conn, int limit);

    /**
     * PENDING entries whose slot is before {@code now}.
     */
    int countOverdue(Connection conn, Instant now);

    /**
     * Journal rows for one entry, oldest first.
     */
    List<StateTransition> history(Connection conn, String entryId);
}
