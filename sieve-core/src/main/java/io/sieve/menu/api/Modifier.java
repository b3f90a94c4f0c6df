package io.sieve.menu.api;

import java.util.Locale;

/** Keyboard modifiers a {@link KeyStroke} can carry. */
public enum Modifier {
  SHIFT("Shift"),
  CONTROL("Control"),
  ALT("Alt"),
  SUPER("Super");

  private final String keyName;

  Modifier(String keyName) {
    this.keyName = keyName;
  }

  /** Name used in binding strings, e.g. {@code Control}. */
  public String keyName() {
    return keyName;
  }

  /**
   * Resolves a modifier from its binding name. Accepts the X11 aliases {@code Mod1} (Alt) and
   * {@code Mod4} (Super) and is case-insensitive.
   *
   * @return the modifier, or {@code null} if the name is not a modifier
   */
  public static Modifier fromName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "shift":
        return SHIFT;
      case "control":
      case "ctrl":
        return CONTROL;
      case "alt":
      case "mod1":
        return ALT;
      case "super":
      case "mod4":
        return SUPER;
      default:
        return null;
    }
  }
}
