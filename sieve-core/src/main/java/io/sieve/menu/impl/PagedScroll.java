package io.sieve.menu.impl;

/** Jumps the window by whole pages and keeps it still while the selection stays visible. */
final class PagedScroll implements ScrollPolicy {
  private final Layout layout;
  private int lastOffset = 0;
  private int currentPage = -1;
  private boolean fullRedraw = true;

  PagedScroll(Layout layout) {
    this.layout = layout;
  }

  @Override
  public int offset(int selected, int filtered) {
    int maxElements = layout.maxElements();
    if (selected >= lastOffset && selected - lastOffset < maxElements) {
      return lastOffset;
    }
    int page = maxElements > 0 ? selected / maxElements : 0;
    lastOffset = page * maxElements;
    if (page != currentPage) {
      currentPage = page;
      fullRedraw = true;
    }
    return lastOffset;
  }

  @Override
  public int page() {
    int maxElements = layout.maxElements();
    return maxElements > 0 ? lastOffset / maxElements : 0;
  }

  @Override
  public boolean takeFullRedraw() {
    boolean result = fullRedraw;
    fullRedraw = false;
    return result;
  }

  @Override
  public void invalidate() {
    fullRedraw = true;
  }
}
