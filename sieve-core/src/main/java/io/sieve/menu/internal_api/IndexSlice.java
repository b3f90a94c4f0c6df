package io.sieve.menu.internal_api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exclusive write handle over the range {@code [start, stop)} of a shared {@code int[]}.
 *
 * <p>Slices are only obtained from {@link #partition(int[], int, int)}, which hands out
 * non-overlapping ranges, so each worker owns the positions it writes. Matches are appended at the
 * front of the slice and later moved into place by {@link #compact(int[], List)}.
 */
public final class IndexSlice {
  private final int[] target;
  private final int start;
  private final int stop;
  private int count;

  private IndexSlice(int[] target, int start, int stop) {
    this.target = target;
    this.start = start;
    this.stop = stop;
  }

  /**
   * Splits {@code [0, total)} into {@code max(1, total / chunkSize)} contiguous chunks of nearly
   * equal size.
   *
   * @param target destination array, at least {@code total} long
   * @param total number of indices to cover
   * @param chunkSize nominal entries per chunk
   * @return slices in ascending range order, never empty
   */
  public static List<IndexSlice> partition(int[] target, int total, int chunkSize) {
    if (total < 0 || total > target.length) {
      throw new IllegalArgumentException(
          "total " + total + " outside target of length " + target.length);
    }
    return split(target, total, chunkSize);
  }

  /**
   * Splits {@code [0, total)} like {@link #partition(int[], int, int)} but without a destination
   * array, for passes that only read their range.
   */
  public static List<IndexSlice> ranges(int total, int chunkSize) {
    if (total < 0) {
      throw new IllegalArgumentException("total must not be negative: " + total);
    }
    return split(null, total, chunkSize);
  }

  private static List<IndexSlice> split(int[] target, int total, int chunkSize) {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    int chunks = Math.max(1, total / chunkSize);
    int steps = (total + chunks) / chunks;
    List<IndexSlice> slices = new ArrayList<>(chunks);
    for (int i = 0; i < chunks; i++) {
      int start = Math.min(total, i * steps);
      int stop = Math.min(total, (i + 1) * steps);
      slices.add(new IndexSlice(target, start, stop));
    }
    return Collections.unmodifiableList(slices);
  }

  /**
   * Moves the packed matches of every slice down so they form one contiguous prefix of the target,
   * in slice order.
   *
   * @param target the array the slices were partitioned from
   * @param slices slices in ascending range order
   * @return total number of matches
   */
  public static int compact(int[] target, List<IndexSlice> slices) {
    int cursor = 0;
    for (IndexSlice slice : slices) {
      if (slice.target != target) {
        throw new IllegalArgumentException("Slice does not belong to target array");
      }
      if (slice.start != cursor && slice.count > 0) {
        System.arraycopy(target, slice.start, target, cursor, slice.count);
      }
      cursor += slice.count;
    }
    return cursor;
  }

  /**
   * Writes the next packed value of this slice.
   *
   * @throws IndexOutOfBoundsException if the slice is full
   * @throws UnsupportedOperationException if the slice came from {@link #ranges(int, int)}
   */
  public void append(int value) {
    if (target == null) {
      throw new UnsupportedOperationException("Read-only range " + this);
    }
    if (start + count >= stop) {
      throw new IndexOutOfBoundsException(
          "Slice [" + start + ", " + stop + ") is full, cannot append " + value);
    }
    target[start + count] = value;
    count++;
  }

  public int start() {
    return start;
  }

  public int stop() {
    return stop;
  }

  /** Values appended so far. */
  public int count() {
    return count;
  }

  @Override
  public String toString() {
    return "IndexSlice[" + start + ", " + stop + "), count=" + count;
  }
}
