package io.sieve.menu.impl;

import io.sieve.menu.api.EntrySource;
import io.sieve.menu.api.MatchingState;
import io.sieve.menu.api.TokenSet;
import io.sieve.menu.internal_api.Collation;
import io.sieve.menu.internal_api.IndexSlice;
import io.sieve.menu.internal_api.Levenshtein;
import io.sieve.menu.internal_api.WorkerPool;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chunked parallel filter pass.
 *
 * <p>Each chunk packs its matches at the front of its own range of the destination array; the
 * ranges are then compacted in chunk order, so the result equals a single left-to-right scan
 * whatever the worker count. Ranking applies a stable sort by edit distance afterwards.
 */
final class FilterEngine {
  private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

  private final WorkerPool pool;
  private final int chunkSize;

  FilterEngine(WorkerPool pool, int chunkSize) {
    this.pool = pool;
    this.chunkSize = chunkSize;
  }

  /**
   * Filters the source.
   *
   * @param source entries
   * @param notAscii per-entry classification from {@link AsciiClassifier}
   * @param query raw query text
   * @param matching case and ranking flags
   * @return matching entry indices
   */
  IntList filter(EntrySource source, boolean[] notAscii, String query, MatchingState matching) {
    long start = System.nanoTime();
    int total = source.count();
    TokenSet tokens = TokenSet.of(query, matching.caseSensitive());
    if (tokens.isEmpty()) {
      int[] identity = new int[total];
      for (int i = 0; i < total; i++) {
        identity[i] = i;
      }
      return IntArrayList.wrap(identity);
    }

    int[] lineMap = new int[total];
    int[] distance = matching.sort() ? new int[total] : null;
    String needle = matching.sort() ? Collation.key(query, matching.caseSensitive()) : null;

    List<IndexSlice> slices = IndexSlice.partition(lineMap, total, chunkSize);
    pool.forkJoin(
        slices,
        slice -> {
          for (int i = slice.start(); i < slice.stop(); i++) {
            if (source.matches(i, tokens, notAscii[i])) {
              slice.append(i);
              if (distance != null) {
                String completion = Collation.key(source.completion(i), matching.caseSensitive());
                distance[i] = Levenshtein.distance(needle, completion);
              }
            }
          }
        });
    int count = IndexSlice.compact(lineMap, slices);

    if (distance != null) {
      IntArrays.mergeSort(lineMap, 0, count, (a, b) -> Integer.compare(distance[a], distance[b]));
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Filtered {} of {} entries in {} chunks, {} us",
          count,
          total,
          slices.size(),
          (System.nanoTime() - start) / 1000);
    }
    return IntArrayList.wrap(lineMap, count);
  }
}
