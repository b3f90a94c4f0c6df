package io.sieve.menu.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SemanticActionTest {

  @Test
  void quickSwitchIndices() {
    assertEquals(0, SemanticAction.CUSTOM_1.quickSwitchIndex());
    assertEquals(18, SemanticAction.CUSTOM_19.quickSwitchIndex());
    assertFalse(SemanticAction.ACCEPT_ENTRY.isQuickSwitch());
    assertThrows(IllegalStateException.class, SemanticAction.CANCEL::quickSwitchIndex);
  }

  @Test
  void configKeysRoundTrip() {
    for (SemanticAction action : SemanticAction.values()) {
      assertSame(action, SemanticAction.fromConfigKey(action.configKey()));
    }
    assertNull(SemanticAction.fromConfigKey("kb-nothing"));
  }

  @Test
  void indicator() {
    assertEquals(" ", new MatchingState(false, false).indicator());
    assertEquals("+", new MatchingState(false, true).indicator());
    assertEquals("-", new MatchingState(true, false).indicator());
    assertEquals("\u00b1", new MatchingState(true, true).indicator());
    assertEquals(new MatchingState(true, true), new MatchingState(false, true).toggleCase());
  }
}
