package io.sieve.menu.impl;

/**
 * Grid capacity of a session.
 *
 * @param lines configured rows, used by continuous scrolling to center the selection
 * @param rows rows per column, at least {@code 1}
 * @param columns columns
 * @param maxElements visible window capacity
 */
record Layout(int lines, int rows, int columns, int maxElements) {

  Layout {
    if (rows < 1) {
      throw new IllegalArgumentException("rows must be at least 1: " + rows);
    }
  }

  /**
   * Computes the layout for a source of {@code count} entries.
   *
   * <p>In fixed mode the row count is always {@code lines}, and the columns shrink to the fewest
   * that hold every entry when there are fewer entries than cells. Otherwise the capacity never
   * exceeds the entry count and rows shrink to fit.
   */
  static Layout compute(int lines, int columns, boolean fixedNumLines, int count) {
    int menuLines = Math.max(1, lines);
    if (fixedNumLines) {
      int cols = columns;
      int maxElements = menuLines * cols;
      if (count < maxElements) {
        cols = ceilDiv(count, menuLines);
        maxElements = menuLines * cols;
      }
      if (cols == 0) {
        cols = 1;
      }
      return new Layout(menuLines, menuLines, cols, maxElements);
    }
    int maxElements = Math.min(menuLines * columns, count);
    int rows = Math.max(1, Math.min(menuLines, ceilDiv(count, columns)));
    return new Layout(menuLines, rows, columns, maxElements);
  }

  static int ceilDiv(int value, int divisor) {
    return (value + divisor - 1) / divisor;
  }
}
