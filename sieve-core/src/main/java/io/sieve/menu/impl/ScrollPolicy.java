package io.sieve.menu.impl;

import io.sieve.menu.api.ScrollMethod;

/** Derives the offset of the visible window from the selection. */
interface ScrollPolicy {

  /**
   * Computes the offset of the first visible element.
   *
   * @param selected selection position in the filtered list
   * @param filtered filtered entry count
   * @return offset into the filtered list
   */
  int offset(int selected, int filtered);

  /** Page the last computed offset belongs to. */
  int page();

  /** Whether the last {@link #offset} call moved the window, clearing the flag. */
  boolean takeFullRedraw();

  /** Forgets the last window so the next frame is drawn in full. */
  void invalidate();

  static ScrollPolicy create(ScrollMethod method, Layout layout) {
    switch (method) {
      case CONTINUOUS:
        return new ContinuousScroll(layout);
      case PAGE:
      default:
        return new PagedScroll(layout);
    }
  }
}
