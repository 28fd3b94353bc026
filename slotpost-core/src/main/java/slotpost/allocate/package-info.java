/**
 * Slot grid and allocation of discovered items onto it.
 *
 * @see slotpost.allocate.SlotAllocator
 * @see slotpost.allocate.SlotGrid
 */
package slotpost.allocate;
