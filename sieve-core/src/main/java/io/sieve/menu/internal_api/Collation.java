package io.sieve.menu.internal_api;

import java.text.Normalizer;
import java.util.Locale;

/** Comparable forms of query tokens and entry text. */
public final class Collation {
  private Collation() {}

  /**
   * Builds the collation key of a string: NFC normalized, and case folded when matching is
   * case-insensitive.
   *
   * @param text source text
   * @param caseSensitive whether case is significant
   * @return the collation key
   */
  public static String key(String text, boolean caseSensitive) {
    String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
    return caseSensitive ? normalized : fold(normalized);
  }

  /** Case folding for matching; upper then lower maps variants like final sigma together. */
  static String fold(String text) {
    return text.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
  }

  /** Whether the text contains any code point above {@code 0x7F}. */
  public static boolean isNotAscii(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) > 0x7F) {
        return true;
      }
    }
    return false;
  }
}
