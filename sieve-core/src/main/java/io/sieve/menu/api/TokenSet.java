package io.sieve.menu.api;

import io.sieve.menu.internal_api.Tokenizer;
import java.util.List;
import java.util.Objects;

/**
 * Ordered tokens derived from a query by splitting on whitespace. When {@link #caseSensitive()} is
 * {@code false} every token is already reduced to its case-folded collation key.
 *
 * <p>An empty token set matches every entry.
 */
public record TokenSet(List<String> tokens, boolean caseSensitive) {

  public static final TokenSet EMPTY = new TokenSet(List.of(), false);

  public TokenSet {
    tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
  }

  /**
   * Tokenizes a query.
   *
   * @param query the raw query text, may be {@code null}
   * @param caseSensitive whether tokens keep their case
   * @return the token set, empty for a blank query
   */
  public static TokenSet of(String query, boolean caseSensitive) {
    return Tokenizer.tokenize(query, caseSensitive);
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }
}
