/**
 * Internal helpers shared by the scheduler components.
 */
package slotpost.util;
