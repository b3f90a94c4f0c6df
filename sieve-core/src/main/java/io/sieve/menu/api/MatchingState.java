package io.sieve.menu.api;

/**
 * Per-session matching flags, toggled at runtime by {@link SemanticAction#TOGGLE_SORT} and {@link
 * SemanticAction#TOGGLE_CASE_SENSITIVITY}.
 */
public record MatchingState(boolean caseSensitive, boolean sort) {

  public MatchingState toggleCase() {
    return new MatchingState(!caseSensitive, sort);
  }

  public MatchingState toggleSort() {
    return new MatchingState(caseSensitive, !sort);
  }

  /**
   * One-character indicator shown next to the query: {@code ±} case-sensitive and sorted, {@code
   * -} case-sensitive, {@code +} sorted, blank otherwise.
   */
  public String indicator() {
    if (caseSensitive) {
      return sort ? "±" : "-";
    }
    return sort ? "+" : " ";
  }
}
