package slotpost.model;

/**
 * How an entry reached the schedule.
 */
public enum EntrySource {
    /** Single item placed after the queue tail. */
    DISCOVERY,
    /** Batch-discovered or recovered item placed on the front-load path. */
    FRONTLOAD
}
