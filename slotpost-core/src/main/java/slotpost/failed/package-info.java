/**
 * Operator tooling for FAILED entries: listing, counting, manual replay and skip.
 *
 * <p>{@link slotpost.failed.FailedEntryManager} provides a connection-managed facade over
 * the {@link slotpost.spi.ScheduleStore} failed-entry methods.
 */
package slotpost.failed;
