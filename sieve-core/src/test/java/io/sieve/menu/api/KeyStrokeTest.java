package io.sieve.menu.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KeyStrokeTest {

  @Test
  void parsesModifiersInAnyOrder() {
    KeyStroke stroke = KeyStroke.parse("Alt+Control+Tab");

    assertEquals("Tab", stroke.key());
    assertEquals(Set.of(Modifier.CONTROL, Modifier.ALT), stroke.modifiers());
    assertEquals(KeyStroke.of("Tab", Modifier.CONTROL, Modifier.ALT), stroke);
  }

  @Test
  void acceptsModifierAliases() {
    assertEquals(KeyStroke.of("x", Modifier.ALT), KeyStroke.parse("Mod1+x"));
    assertEquals(KeyStroke.of("x", Modifier.SUPER), KeyStroke.parse("mod4+x"));
    assertEquals(KeyStroke.of("x", Modifier.CONTROL), KeyStroke.parse("ctrl+x"));
  }

  @Test
  void toStringUsesCanonicalOrder() {
    KeyStroke stroke =
        KeyStroke.of("a", Modifier.SUPER, Modifier.ALT, Modifier.SHIFT, Modifier.CONTROL);

    assertEquals("Shift+Control+Alt+Super+a", stroke.toString());
    assertEquals(stroke, KeyStroke.parse(stroke.toString()));
  }

  @Test
  void parsesLists() {
    List<KeyStroke> strokes = KeyStroke.parseList(" Return , KP_Enter,,Control+j ");

    assertEquals(
        List.of(
            KeyStroke.of("Return"), KeyStroke.of("KP_Enter"), KeyStroke.of("j", Modifier.CONTROL)),
        strokes);
    assertTrue(KeyStroke.parseList("").isEmpty());
    assertTrue(KeyStroke.parseList(null).isEmpty());
  }

  @Test
  void rejectsMalformedStrokes() {
    assertThrows(SieveConfigurationException.class, () -> KeyStroke.parse(" "));
    assertThrows(SieveConfigurationException.class, () -> KeyStroke.parse("Meta+x"));
    assertThrows(SieveConfigurationException.class, () -> KeyStroke.parse("Control+ "));
  }
}
