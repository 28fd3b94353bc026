package slotpost;

/**
 * Unchecked exception wrapping JDBC errors raised while reading or writing the schedule.
 */
public final class ScheduleStoreException extends RuntimeException {
    public ScheduleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
