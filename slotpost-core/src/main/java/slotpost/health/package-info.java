/**
 * Trailing-window publish success monitoring.
 */
package slotpost.health;
