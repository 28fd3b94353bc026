/**
 * Bounded re-enqueue of retriable FAILED entries.
 *
 * @see slotpost.recovery.RecoverySweeper
 */
package slotpost.recovery;
