package io.sieve.menu.api;

import java.util.Locale;

/** How the visible window follows the selection. */
public enum ScrollMethod {
  /** Jump by whole pages of {@code max_elements}. */
  PAGE,
  /** Keep the selection vertically centred, clamped at both ends. */
  CONTINUOUS;

  /**
   * Parses {@code page}/{@code continuous}, or the numeric forms {@code 0}/{@code 1}.
   *
   * @return the method, or {@code null} if unrecognized
   */
  public static ScrollMethod parse(String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "0":
      case "page":
        return PAGE;
      case "1":
      case "continuous":
        return CONTINUOUS;
      default:
        return null;
    }
  }
}
