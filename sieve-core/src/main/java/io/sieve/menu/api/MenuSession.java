package io.sieve.menu.api;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * One interactive filter-and-select interaction over an {@link EntrySource}.
 *
 * <p>A session is confined to the thread that feeds it events. Filter passes triggered by an event
 * complete before {@link #feedEvent(MenuEvent)} returns.
 */
public interface MenuSession {

  /**
   * Applies an input event.
   *
   * @param event key, paste or mouse event
   * @return the state after the event; once terminal, further events are ignored until {@link
   *     #restart()}
   */
  SessionState feedEvent(MenuEvent event);

  /** Current lifecycle state. */
  SessionState state();

  /** What a renderer should draw for the current selection and filter result. */
  VisibleWindow currentVisibleWindow();

  String currentQueryText();

  /** Cursor position in the query, in characters. */
  int cursorPosition();

  int filteredCount();

  /** Read-only view of the current filtered index list. */
  IntList filteredEntries();

  /** Position of the selection in the filtered list, {@code -1} when nothing is filtered. */
  int selectedIndex();

  /** Entry index under the selection, or {@link Outcome#NO_ENTRY}. */
  int selectedEntry();

  MatchingState matchingState();

  /**
   * Moves the selection onto the given entry.
   *
   * @param entryIndex entry source index
   * @return {@code true} if the entry is in the filtered list; otherwise the selection moves to
   *     the first position
   */
  boolean selectEntry(int entryIndex);

  /**
   * The entry following the selected one in the filtered list, or the selected entry itself at the
   * end of the list. Used to reposition a rebuilt session after a delete.
   *
   * @return entry index, or {@link Outcome#NO_ENTRY} when nothing is filtered
   */
  int nextEntryIndex();

  /** Returns a terminal session to the interactive state, clearing its outcome. */
  void restart();
}
