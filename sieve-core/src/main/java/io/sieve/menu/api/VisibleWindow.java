package io.sieve.menu.api;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Snapshot of what a renderer should draw for the current frame.
 *
 * <p>Slots are laid out column-major: slot {@code i} sits in column {@code i / rows} and row
 * {@code i % rows}.
 *
 * @param offset position of the first visible element in the filtered list
 * @param entries entry indices to render, in slot order
 * @param selectedSlot slot holding the selection, or {@code -1} if it is not visible
 * @param rows rows per column
 * @param columns columns used by this frame
 * @param filteredCount total number of filtered entries
 * @param fullRedraw whether every slot changed (page change, refilter) rather than just the
 *     highlight
 * @param page current page in paged mode, {@code offset / max_elements} otherwise
 * @param scrollbarHandle scrollbar handle position
 * @param scrollbarLength scrollbar handle length
 */
public record VisibleWindow(
    int offset,
    IntList entries,
    int selectedSlot,
    int rows,
    int columns,
    int filteredCount,
    boolean fullRedraw,
    int page,
    int scrollbarHandle,
    int scrollbarLength) {

  public VisibleWindow {
    entries = IntLists.unmodifiable(entries);
  }

  public int size() {
    return entries.size();
  }

  public int entryAt(int slot) {
    return entries.getInt(slot);
  }

  /** Odd rows use the alternate style. */
  public boolean isAlternate(int slot) {
    return ((slot % rows) & 1) == 1;
  }

  public boolean isSelected(int slot) {
    return slot == selectedSlot;
  }
}
