package io.sieve.menu.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LayoutTest {

  @Test
  void flexibleLayoutShrinksToEntryCount() {
    Layout layout = Layout.compute(15, 1, false, 3);

    assertEquals(3, layout.rows());
    assertEquals(1, layout.columns());
    assertEquals(3, layout.maxElements());
  }

  @Test
  void flexibleLayoutWithManyEntriesUsesFullGrid() {
    Layout layout = Layout.compute(5, 3, false, 100);

    assertEquals(5, layout.rows());
    assertEquals(3, layout.columns());
    assertEquals(15, layout.maxElements());
  }

  @Test
  void flexibleLayoutRoundsRowsUpPerColumn() {
    Layout layout = Layout.compute(10, 3, false, 7);

    assertEquals(3, layout.rows());
    assertEquals(7, layout.maxElements());
  }

  @Test
  void flexibleLayoutKeepsOneRowWhenEmpty() {
    Layout layout = Layout.compute(15, 1, false, 0);

    assertEquals(1, layout.rows());
    assertEquals(0, layout.maxElements());
  }

  @Test
  void fixedLayoutKeepsConfiguredRows() {
    Layout layout = Layout.compute(15, 1, true, 3);

    assertEquals(15, layout.rows());
    assertEquals(1, layout.columns());
    assertEquals(15, layout.maxElements());
  }

  @Test
  void fixedLayoutDropsUnneededColumns() {
    Layout layout = Layout.compute(4, 3, true, 5);

    assertEquals(4, layout.rows());
    assertEquals(2, layout.columns());
    assertEquals(8, layout.maxElements());
  }

  @Test
  void fixedLayoutWithoutEntriesHasOneColumn() {
    Layout layout = Layout.compute(4, 3, true, 0);

    assertEquals(1, layout.columns());
    assertEquals(0, layout.maxElements());
  }

  @Test
  void zeroLinesIsTreatedAsOne() {
    assertEquals(1, Layout.compute(0, 1, true, 10).rows());
  }
}
