package slotpost;

/**
 * Thrown when an entry cannot be placed because it conflicts with the existing schedule.
 *
 * @see DuplicateContentException
 * @see SlotCollisionException
 */
public class ScheduleConflictException extends RuntimeException {

    public ScheduleConflictException(String message) {
        super(message);
    }

    public ScheduleConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
