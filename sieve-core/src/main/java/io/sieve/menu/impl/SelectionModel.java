package io.sieve.menu.impl;

/**
 * Selection position within the filtered list. Up and down wrap, every other move clamps. All
 * moves are no-ops while nothing is filtered.
 */
final class SelectionModel {
  private final Layout layout;
  private int filtered;
  private int selected;

  SelectionModel(Layout layout) {
    this.layout = layout;
  }

  int selected() {
    return selected;
  }

  int filtered() {
    return filtered;
  }

  boolean hasSelection() {
    return selected < filtered;
  }

  /** Adopts a new filtered count, clamping the selection into range. */
  void refiltered(int count) {
    filtered = count;
    selected = count > 0 ? Math.min(selected, count - 1) : 0;
  }

  /** Moves to an absolute position, clamped. */
  void select(int position) {
    if (filtered == 0) {
      return;
    }
    selected = Math.max(0, Math.min(position, filtered - 1));
  }

  void up() {
    if (filtered == 0) {
      return;
    }
    selected = selected == 0 ? filtered - 1 : selected - 1;
  }

  void down() {
    if (filtered == 0) {
      return;
    }
    selected = selected < filtered - 1 ? selected + 1 : 0;
  }

  void left() {
    if (selected >= layout.rows()) {
      selected -= layout.rows();
    }
  }

  void right() {
    if (filtered == 0) {
      return;
    }
    int rows = layout.rows();
    if (selected + rows < filtered) {
      selected += rows;
    } else if (selected < filtered - 1) {
      // a partially filled last column still gets its last entry selected
      int column = selected / rows;
      int lastColumn = (filtered - 1) / rows;
      if (column != lastColumn) {
        selected = filtered - 1;
      }
    }
  }

  void pageNext() {
    if (filtered == 0) {
      return;
    }
    selected = Math.min(selected + layout.maxElements(), filtered - 1);
  }

  void pagePrev() {
    selected = selected < layout.maxElements() ? 0 : selected - layout.maxElements();
  }

  void first() {
    selected = 0;
  }

  void last() {
    if (filtered == 0) {
      return;
    }
    selected = filtered - 1;
  }
}
