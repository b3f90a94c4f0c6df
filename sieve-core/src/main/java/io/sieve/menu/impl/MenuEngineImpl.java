package io.sieve.menu.impl;

import io.sieve.menu.api.ActionResolver;
import io.sieve.menu.api.EntrySource;
import io.sieve.menu.api.MatchingState;
import io.sieve.menu.api.MenuConfig;
import io.sieve.menu.api.MenuEngine;
import io.sieve.menu.api.MenuSession;
import io.sieve.menu.internal_api.WorkerPool;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MenuEngineImpl implements MenuEngine {
  private static final Logger log = LoggerFactory.getLogger(MenuEngineImpl.class);

  private final MenuConfig config;
  private final WorkerPool pool;
  private final FilterEngine filterEngine;
  private final BindingTable bindings;

  public MenuEngineImpl(MenuConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.bindings = new BindingTable(config.bindings());
    this.pool = new WorkerPool(config.effectiveThreads());
    this.filterEngine = new FilterEngine(pool, config.filterChunkSize());
    log.debug("Menu engine ready, {} workers", pool.threads());
  }

  @Override
  public MenuConfig config() {
    return config;
  }

  @Override
  public MenuSession newSession(EntrySource source, ActionResolver resolver, String initialQuery) {
    boolean[] notAscii = AsciiClassifier.classify(source, pool, config.asciiChunkSize());
    return new MenuSessionImpl(source, resolver, filterEngine, notAscii, config, initialQuery);
  }

  @Override
  public MenuSession newSession(EntrySource source, String initialQuery) {
    return newSession(source, bindings, initialQuery);
  }

  @Override
  public IntList filter(EntrySource source, String query, MatchingState matching) {
    boolean[] notAscii = AsciiClassifier.classify(source, pool, config.asciiChunkSize());
    return filterEngine.filter(source, notAscii, query, matching);
  }

  @Override
  public void close() {
    pool.close();
  }
}
