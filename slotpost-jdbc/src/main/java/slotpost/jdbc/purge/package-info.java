/**
 * JDBC retention purge for finished schedule entries.
 *
 * @see slotpost.purge.RetentionPurge
 */
package slotpost.jdbc.purge;
