package io.sieve.menu.impl;

/** Keeps the selection on the middle row, clamped at both ends of the list. */
final class ContinuousScroll implements ScrollPolicy {
  private final Layout layout;
  private int lastOffset = 0;

  ContinuousScroll(Layout layout) {
    this.layout = layout;
  }

  @Override
  public int offset(int selected, int filtered) {
    int lines = layout.lines();
    int middle = (lines - ((lines & 1) == 0 ? 1 : 0)) / 2;
    int offset = 0;
    if (selected > middle) {
      if (selected < filtered - (lines - middle)) {
        offset = selected - middle;
      } else if (filtered > lines) {
        offset = filtered - lines;
      }
    }
    lastOffset = offset;
    return offset;
  }

  @Override
  public int page() {
    int maxElements = layout.maxElements();
    return maxElements > 0 ? lastOffset / maxElements : 0;
  }

  // every frame may shift by a single row
  @Override
  public boolean takeFullRedraw() {
    return true;
  }

  @Override
  public void invalidate() {}
}
