package io.sieve.menu.internal_api;

import io.sieve.menu.api.TokenSet;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Splits a query into whitespace separated tokens. */
public final class Tokenizer {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private Tokenizer() {}

  /**
   * Tokenizes a query.
   *
   * @param query raw query, {@code null} treated as empty
   * @param caseSensitive whether tokens keep their case
   * @return tokens reduced to collation keys, empty for a blank query
   */
  public static TokenSet tokenize(String query, boolean caseSensitive) {
    if (query == null || query.isBlank()) {
      return caseSensitive ? new TokenSet(List.of(), true) : TokenSet.EMPTY;
    }
    List<String> tokens = new ArrayList<>();
    for (String part : WHITESPACE.split(query.strip())) {
      if (!part.isEmpty()) {
        tokens.add(Collation.key(part, caseSensitive));
      }
    }
    return new TokenSet(tokens, caseSensitive);
  }
}
