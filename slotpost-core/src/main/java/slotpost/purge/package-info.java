/**
 * Retention-based deletion of finished schedule entries.
 *
 * @see slotpost.purge.RetentionPurge
 * @see slotpost.spi.EntryPurger
 */
package slotpost.purge;
