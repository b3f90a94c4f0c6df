package io.sieve.menu.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A key with its held modifiers, named after X11 keysyms ({@code Return}, {@code Up}, {@code
 * space}, {@code a}). Binding strings use the {@code Modifier+Modifier+Key} form.
 */
public record KeyStroke(String key, Set<Modifier> modifiers) {

  public KeyStroke {
    Objects.requireNonNull(key, "key");
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Key name must not be empty");
    }
    modifiers = modifiers.isEmpty() ? Set.of() : Set.copyOf(modifiers);
  }

  public static KeyStroke of(String key, Modifier... modifiers) {
    if (modifiers.length == 0) {
      return new KeyStroke(key, Set.of());
    }
    return new KeyStroke(key, EnumSet.of(modifiers[0], modifiers));
  }

  /**
   * Parses a single stroke such as {@code Control+Shift+Tab}.
   *
   * @throws SieveConfigurationException if a modifier name is unknown or the key is missing
   */
  public static KeyStroke parse(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      throw new SieveConfigurationException("Empty key stroke");
    }
    // a literal '+' key is written as "plus", so splitting on '+' is unambiguous
    String[] parts = trimmed.split("\\+", -1);
    EnumSet<Modifier> mods = EnumSet.noneOf(Modifier.class);
    for (int i = 0; i < parts.length - 1; i++) {
      Modifier m = Modifier.fromName(parts[i].trim());
      if (m == null) {
        throw SieveConfigurationException.unknownKey(text, parts[i].trim());
      }
      mods.add(m);
    }
    String key = parts[parts.length - 1].trim();
    if (key.isEmpty()) {
      throw SieveConfigurationException.unknownKey(text, key);
    }
    return new KeyStroke(key, mods);
  }

  /** Parses a comma separated binding list; blank input yields an empty list. */
  public static List<KeyStroke> parseList(String text) {
    List<KeyStroke> strokes = new ArrayList<>();
    if (text == null) {
      return strokes;
    }
    for (String part : text.split(",")) {
      if (!part.isBlank()) {
        strokes.add(parse(part));
      }
    }
    return strokes;
  }

  public boolean has(Modifier modifier) {
    return modifiers.contains(modifier);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Modifier m : Modifier.values()) {
      if (modifiers.contains(m)) {
        sb.append(m.keyName()).append('+');
      }
    }
    return sb.append(key).toString();
  }
}
