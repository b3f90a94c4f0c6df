package io.sieve.menu.api;

/**
 * Read-only view of the candidates a menu session filters. Indices run from {@code 0} to {@code
 * count() - 1} and must stay stable (same count, same per-index content) for the lifetime of a
 * session.
 *
 * <p>Implementations are called concurrently from filter workers, each worker touching a disjoint
 * index range, so every method must be safe for concurrent reads.
 */
public interface EntrySource {

  /** Number of entries. */
  int count();

  /**
   * Text shown for the entry.
   *
   * @param index entry index
   * @return display text, never {@code null}
   */
  String displayText(int index);

  /**
   * Text the query is replaced with on row-select, and the text similarity ranking compares
   * against.
   *
   * @param index entry index
   * @return completion text, never {@code null}
   */
  String completion(int index);

  /**
   * Tests whether the entry satisfies every token of the set. Sources with several searchable
   * fields must accept a token if <em>any</em> field contains it, and require all tokens to be
   * accepted.
   *
   * @param index entry index
   * @param tokens tokens derived from the query, already collated for the set's case mode
   * @param notAscii whether the entry was classified as containing non-ASCII text
   * @return {@code true} if the entry matches
   */
  boolean matches(int index, TokenSet tokens, boolean notAscii);

  /**
   * Whether any searchable field of the entry contains non-ASCII code points. Evaluated once per
   * session by the classification pass.
   */
  boolean isNotAscii(int index);
}
