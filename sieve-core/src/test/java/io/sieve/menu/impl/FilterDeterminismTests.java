package io.sieve.menu.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.sieve.menu.api.MatchingState;
import io.sieve.menu.internal_api.WorkerPool;
import io.sieve.menu.source.LineEntrySource;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.List;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

/**
 * Property tests for the chunked filter pass: the result must not depend on how the work is split
 * or how many workers run it.
 */
@PropertyDefaults(tries = 100, shrinking = ShrinkingMode.BOUNDED)
public class FilterDeterminismTests {

  @Property
  void sameResultForAnyWorkerCount(
      @ForAll("entries") List<String> entries,
      @ForAll("queries") String query,
      @ForAll @IntRange(min = 1, max = 32) int workers,
      @ForAll boolean caseSensitive,
      @ForAll boolean sort) {
    LineEntrySource source = new LineEntrySource(entries);
    MatchingState matching = new MatchingState(caseSensitive, sort);

    IntList reference = run(source, query, matching, 1, Integer.MAX_VALUE);
    IntList parallel = run(source, query, matching, workers, 3);

    assertEquals(reference, parallel);
  }

  @Property
  void unrankedResultIsAscendingSubsequence(
      @ForAll("entries") List<String> entries,
      @ForAll("queries") String query,
      @ForAll @IntRange(min = 1, max = 8) int workers) {
    LineEntrySource source = new LineEntrySource(entries);

    IntList result = run(source, query, new MatchingState(false, false), workers, 2);

    int previous = -1;
    for (int i = 0; i < result.size(); i++) {
      int index = result.getInt(i);
      assertTrue(index > previous, "indices must be strictly ascending");
      assertTrue(index < entries.size());
      previous = index;
    }
  }

  @Property
  void rankedResultIsPermutationOfUnranked(
      @ForAll("entries") List<String> entries, @ForAll("queries") String query) {
    LineEntrySource source = new LineEntrySource(entries);

    IntList plain = run(source, query, new MatchingState(false, false), 4, 2);
    IntList ranked = run(source, query, new MatchingState(false, true), 4, 2);

    assertEquals(plain.size(), ranked.size());
    assertTrue(ranked.containsAll(plain));
  }

  @Provide
  Arbitrary<List<String>> entries() {
    return Arbitraries.strings().withChars("abcfirFIé -").ofMaxLength(8).list().ofMaxSize(60);
  }

  @Provide
  Arbitrary<String> queries() {
    return Arbitraries.strings().withChars("abcfiRé ").ofMaxLength(3);
  }

  private static IntList run(
      LineEntrySource source, String query, MatchingState matching, int workers, int chunk) {
    try (WorkerPool pool = new WorkerPool(workers)) {
      boolean[] notAscii = AsciiClassifier.classify(source, pool, chunk);
      return new FilterEngine(pool, chunk).filter(source, notAscii, query, matching);
    }
  }
}
