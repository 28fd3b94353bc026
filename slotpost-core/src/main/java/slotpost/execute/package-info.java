/**
 * Execution of due entries: the executor, its phases and outcomes, and the retry policy.
 *
 * @see slotpost.execute.ScheduleExecutor
 * @see slotpost.execute.RetryPolicy
 */
package slotpost.execute;
