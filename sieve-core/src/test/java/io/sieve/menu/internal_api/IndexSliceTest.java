package io.sieve.menu.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndexSliceTest {

  @Test
  void partitionCoversRangeWithoutOverlap() {
    List<IndexSlice> slices = IndexSlice.partition(new int[1200], 1200, 500);

    assertEquals(2, slices.size());
    assertEquals(0, slices.get(0).start());
    assertEquals(601, slices.get(0).stop());
    assertEquals(601, slices.get(1).start());
    assertEquals(1200, slices.get(1).stop());
  }

  @Test
  void smallInputUsesSingleChunk() {
    List<IndexSlice> slices = IndexSlice.partition(new int[10], 10, 500);

    assertEquals(1, slices.size());
    assertEquals(0, slices.get(0).start());
    assertEquals(10, slices.get(0).stop());
  }

  @Test
  void emptyInputStillHasOneEmptyChunk() {
    List<IndexSlice> slices = IndexSlice.partition(new int[0], 0, 500);

    assertEquals(1, slices.size());
    assertEquals(slices.get(0).start(), slices.get(0).stop());
  }

  @Test
  void compactMovesPackedMatchesIntoOrder() {
    int[] target = new int[10];
    List<IndexSlice> slices = IndexSlice.partition(target, 10, 5);
    assertEquals(6, slices.get(1).start());

    slices.get(0).append(1);
    slices.get(0).append(3);
    slices.get(1).append(7);
    slices.get(1).append(9);

    assertEquals(4, IndexSlice.compact(target, slices));
    assertArrayEquals(new int[] {1, 3, 7, 9}, Arrays.copyOf(target, 4));
  }

  @Test
  void appendPastEndOfSliceFails() {
    IndexSlice slice = IndexSlice.partition(new int[2], 2, 500).get(0);
    slice.append(0);
    slice.append(1);

    assertThrows(IndexOutOfBoundsException.class, () -> slice.append(2));
  }

  @Test
  void rangesAreReadOnly() {
    IndexSlice range = IndexSlice.ranges(5, 500).get(0);

    assertEquals(5, range.stop());
    assertThrows(UnsupportedOperationException.class, () -> range.append(0));
  }

  @Test
  void rejectsNonPositiveChunkSize() {
    assertThrows(IllegalArgumentException.class, () -> IndexSlice.partition(new int[1], 1, 0));
  }
}
