/**
 * Schedule data model: entries, their lifecycle states, the transition journal,
 * and status summaries.
 *
 * @see slotpost.model.ScheduleEntry
 * @see slotpost.model.EntryState
 */
package slotpost.model;
