package io.sieve.menu.source;

import static org.junit.jupiter.api.Assertions.*;

import io.sieve.menu.internal_api.Tokenizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldedEntrySourceTest {
  private final FieldedEntrySource source =
      new FieldedEntrySource(
          List.of(
              FieldedEntry.parse("Firefox\tWeb Browser\tfirefox %u"),
              FieldedEntry.parse("Terminal\t\tgnome-terminal"),
              FieldedEntry.parse("Caf\u00e9")));

  @Test
  void parsesTabSeparatedFields() {
    FieldedEntry terminal = source.entry(1);

    assertEquals("Terminal", terminal.name());
    assertNull(terminal.genericName());
    assertEquals("gnome-terminal", terminal.command());
    assertEquals("Firefox (Web Browser)", source.displayText(0));
    assertEquals("Terminal", source.displayText(1));
    assertEquals("Firefox", source.completion(0));
  }

  @Test
  void tokensMayMatchDifferentFields() {
    assertTrue(source.matches(0, Tokenizer.tokenize("fire browser", false), false));
    assertTrue(source.matches(1, Tokenizer.tokenize("gnome", false), false));
    assertFalse(source.matches(0, Tokenizer.tokenize("browser gnome", false), false));
  }

  @Test
  void emptyQueryMatchesEverything() {
    assertTrue(source.matches(1, Tokenizer.tokenize("  ", false), false));
  }

  @Test
  void classifiesShownFieldsOnly() {
    assertFalse(source.isNotAscii(0));
    assertTrue(source.isNotAscii(2));
    assertTrue(source.matches(2, Tokenizer.tokenize("caf\u00c9", false), true));
  }
}
