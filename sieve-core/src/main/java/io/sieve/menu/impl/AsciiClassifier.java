package io.sieve.menu.impl;

import io.sieve.menu.api.EntrySource;
import io.sieve.menu.internal_api.IndexSlice;
import io.sieve.menu.internal_api.WorkerPool;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One-off pass flagging entries with non-ASCII text, run when a session starts. */
final class AsciiClassifier {
  private static final Logger log = LoggerFactory.getLogger(AsciiClassifier.class);

  private AsciiClassifier() {}

  static boolean[] classify(EntrySource source, WorkerPool pool, int chunkSize) {
    long start = System.nanoTime();
    int total = source.count();
    boolean[] notAscii = new boolean[total];
    List<IndexSlice> ranges = IndexSlice.ranges(total, chunkSize);
    pool.forkJoin(
        ranges,
        range -> {
          for (int i = range.start(); i < range.stop(); i++) {
            notAscii[i] = source.isNotAscii(i);
          }
        });
    log.debug(
        "Classified {} entries in {} chunks, {} us",
        total,
        ranges.size(),
        (System.nanoTime() - start) / 1000);
    return notAscii;
  }
}
