package io.sieve.menu.internal_api;

import io.sieve.menu.api.TokenSet;

/**
 * Substring matching of collated tokens against entry text.
 *
 * <p>ASCII-only entries skip normalization and are scanned in place; case-insensitive scans use
 * {@link String#regionMatches(boolean, int, String, int, int)}.
 */
public final class TokenMatcher {
  private TokenMatcher() {}

  /**
   * Tests whether every token is contained in the input.
   *
   * @param tokens collated tokens
   * @param input entry text
   * @param notAscii whether the input has non-ASCII code points
   * @return {@code true} if all tokens match, always for an empty token set
   */
  public static boolean matchesAll(TokenSet tokens, String input, boolean notAscii) {
    if (tokens.isEmpty()) {
      return true;
    }
    String haystack = notAscii ? Collation.key(input, tokens.caseSensitive()) : input;
    for (String token : tokens.tokens()) {
      if (!contains(haystack, token, notAscii || tokens.caseSensitive())) {
        return false;
      }
    }
    return true;
  }

  /**
   * Tests a single collated token against the input.
   *
   * @param token collated token
   * @param input entry text, raw
   * @param notAscii whether the input has non-ASCII code points
   * @param caseSensitive whether the token was collated case-sensitively
   * @return {@code true} if the input contains the token
   */
  public static boolean matchesToken(
      String token, String input, boolean notAscii, boolean caseSensitive) {
    if (input == null) {
      return false;
    }
    if (notAscii) {
      return Collation.key(input, caseSensitive).contains(token);
    }
    return contains(input, token, caseSensitive);
  }

  private static boolean contains(String haystack, String token, boolean exact) {
    if (exact) {
      return haystack.contains(token);
    }
    int last = haystack.length() - token.length();
    for (int i = 0; i <= last; i++) {
      if (haystack.regionMatches(true, i, token, 0, token.length())) {
        return true;
      }
    }
    return false;
  }
}
