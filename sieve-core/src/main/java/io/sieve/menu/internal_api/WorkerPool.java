package io.sieve.menu.internal_api;

import io.sieve.menu.api.SieveConfigurationException;
import io.sieve.menu.api.SieveFilterException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed pool of daemon worker threads running chunked passes to completion.
 *
 * <p>{@link #forkJoin(List, Consumer)} submits every chunk but the first, runs the first chunk on
 * the calling thread and then blocks until the rest are done.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

  private final ExecutorService executor;
  private final int threads;
  private volatile boolean closed = false;

  /**
   * Starts the pool.
   *
   * @param threads number of worker threads
   * @throws SieveConfigurationException if the threads cannot be created
   */
  public WorkerPool(int threads) {
    this.threads = threads;
    AtomicInteger counter = new AtomicInteger();
    try {
      this.executor =
          Executors.newFixedThreadPool(
              threads,
              r -> {
                Thread t = new Thread(r, "sieve-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
              });
    } catch (RuntimeException e) {
      log.error("Failed to create worker pool with {} threads", threads, e);
      throw SieveConfigurationException.poolCreationFailed(threads, e);
    }
    log.debug("Started worker pool with {} threads", threads);
  }

  public int threads() {
    return threads;
  }

  /**
   * Runs the task once per slice and waits for all of them.
   *
   * @param slices work items, processed in parallel
   * @param task work to run per slice; must only write inside its slice
   * @throws SieveFilterException if any task threw
   */
  public void forkJoin(List<IndexSlice> slices, Consumer<IndexSlice> task) {
    if (closed) {
      throw new IllegalStateException("Worker pool is closed");
    }
    if (slices.isEmpty()) {
      return;
    }
    List<Future<?>> results = new ArrayList<>(slices.size() - 1);
    for (int i = 1; i < slices.size(); i++) {
      IndexSlice slice = slices.get(i);
      results.add(executor.submit(() -> task.accept(slice)));
    }
    IndexSlice first = slices.get(0);
    try {
      task.accept(first);
    } catch (RuntimeException e) {
      results.forEach(f -> f.cancel(true));
      throw SieveFilterException.chunkFailed(first.start(), first.stop(), e);
    }
    for (int i = 0; i < results.size(); i++) {
      IndexSlice slice = slices.get(i + 1);
      try {
        results.get(i).get();
      } catch (ExecutionException e) {
        results.forEach(f -> f.cancel(true));
        throw SieveFilterException.chunkFailed(slice.start(), slice.stop(), e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        results.forEach(f -> f.cancel(true));
        throw SieveFilterException.chunkFailed(slice.start(), slice.stop(), e);
      }
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      int dropped = executor.shutdownNow().size();
      log.debug("Stopped worker pool, {} queued tasks dropped", dropped);
    }
  }
}
