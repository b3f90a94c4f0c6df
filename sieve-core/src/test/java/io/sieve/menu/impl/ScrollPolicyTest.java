package io.sieve.menu.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.sieve.menu.api.ScrollMethod;
import org.junit.jupiter.api.Test;

class ScrollPolicyTest {

  @Test
  void pagedWindowStaysWhileSelectionIsVisible() {
    ScrollPolicy scroll = ScrollPolicy.create(ScrollMethod.PAGE, Layout.compute(5, 1, true, 20));

    assertEquals(0, scroll.offset(0, 20));
    assertTrue(scroll.takeFullRedraw());
    assertEquals(0, scroll.offset(4, 20));
    assertFalse(scroll.takeFullRedraw());
  }

  @Test
  void pagedWindowJumpsByWholePages() {
    ScrollPolicy scroll = ScrollPolicy.create(ScrollMethod.PAGE, Layout.compute(5, 1, true, 20));
    scroll.offset(0, 20);
    scroll.takeFullRedraw();

    assertEquals(5, scroll.offset(5, 20));
    assertEquals(1, scroll.page());
    assertTrue(scroll.takeFullRedraw());

    assertEquals(15, scroll.offset(19, 20));
    assertEquals(3, scroll.page());

    assertEquals(0, scroll.offset(3, 20));
    assertEquals(0, scroll.page());
  }

  @Test
  void pagedWindowWithoutCapacityStaysAtZero() {
    ScrollPolicy scroll = ScrollPolicy.create(ScrollMethod.PAGE, Layout.compute(5, 1, false, 0));

    assertEquals(0, scroll.offset(0, 0));
    assertEquals(0, scroll.page());
  }

  @Test
  void continuousWindowCentresSelection() {
    ScrollPolicy scroll =
        ScrollPolicy.create(ScrollMethod.CONTINUOUS, Layout.compute(5, 1, true, 20));

    assertEquals(0, scroll.offset(2, 20));
    assertEquals(1, scroll.offset(3, 20));
    assertEquals(8, scroll.offset(10, 20));
    assertTrue(scroll.takeFullRedraw());
  }

  @Test
  void continuousWindowClampsAtTheEnd() {
    ScrollPolicy scroll =
        ScrollPolicy.create(ScrollMethod.CONTINUOUS, Layout.compute(5, 1, true, 20));

    assertEquals(14, scroll.offset(16, 20));
    assertEquals(15, scroll.offset(17, 20));
    assertEquals(15, scroll.offset(19, 20));
  }

  @Test
  void continuousWindowWithEvenLinesCentresAboveMiddle() {
    ScrollPolicy scroll =
        ScrollPolicy.create(ScrollMethod.CONTINUOUS, Layout.compute(4, 1, true, 10));

    assertEquals(0, scroll.offset(1, 10));
    assertEquals(1, scroll.offset(2, 10));
  }

  @Test
  void continuousWindowNeverScrollsShortLists() {
    ScrollPolicy scroll =
        ScrollPolicy.create(ScrollMethod.CONTINUOUS, Layout.compute(5, 1, true, 4));

    assertEquals(0, scroll.offset(3, 4));
  }
}
