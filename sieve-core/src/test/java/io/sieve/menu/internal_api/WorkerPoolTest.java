package io.sieve.menu.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import io.sieve.menu.api.SieveConfigurationException;
import io.sieve.menu.api.SieveException;
import io.sieve.menu.api.SieveFilterException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {
  private WorkerPool pool;

  @BeforeEach
  void setUp() {
    pool = new WorkerPool(4);
  }

  @AfterEach
  void tearDown() {
    pool.close();
  }

  @Test
  void runsEverySliceOnce() {
    List<IndexSlice> ranges = IndexSlice.ranges(10_000, 500);
    AtomicInteger visited = new AtomicInteger();

    pool.forkJoin(ranges, r -> visited.addAndGet(r.stop() - r.start()));

    assertEquals(20, ranges.size());
    assertEquals(10_000, visited.get());
  }

  @Test
  void firstSliceRunsOnCallingThread() {
    List<IndexSlice> ranges = IndexSlice.ranges(2_000, 500);
    ConcurrentHashMap<Integer, Thread> threads = new ConcurrentHashMap<>();

    pool.forkJoin(ranges, r -> threads.put(r.start(), Thread.currentThread()));

    assertSame(Thread.currentThread(), threads.get(0));
    assertEquals(ranges.size(), threads.size());
  }

  @Test
  void taskFailureIsWrapped() {
    List<IndexSlice> ranges = IndexSlice.ranges(2_000, 500);
    IllegalStateException boom = new IllegalStateException("boom");

    SieveFilterException e =
        assertThrows(
            SieveFilterException.class,
            () ->
                pool.forkJoin(
                    ranges,
                    r -> {
                      if (r.start() > 0) {
                        throw boom;
                      }
                    }));

    assertSame(boom, e.getCause());
    assertEquals(SieveException.Kind.FILTER, e.kind());
    assertTrue(e.subject().startsWith("entries "));
  }

  @Test
  void closedPoolRejectsWork() {
    pool.close();

    assertThrows(
        IllegalStateException.class, () -> pool.forkJoin(IndexSlice.ranges(1, 1), r -> {}));
  }

  @Test
  void invalidThreadCountIsConfigurationError() {
    SieveConfigurationException e =
        assertThrows(SieveConfigurationException.class, () -> new WorkerPool(0));

    assertEquals("threads", e.subject());
    assertEquals(SieveException.Kind.CONFIGURATION, e.kind());
  }
}
