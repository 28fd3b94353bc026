/**
 * Crash-safe, fixed-cadence publication scheduler.
 *
 * <p>{@link slotpost.SlotPost} is the composite entry point. Discovered
 * {@link slotpost.model.ContentItem}s are placed on a 15-minute slot grid by the
 * {@link slotpost.allocate.SlotAllocator} and published one slot at a time by the
 * {@link slotpost.execute.ScheduleExecutor} under a process-level lock.
 */
package slotpost;
