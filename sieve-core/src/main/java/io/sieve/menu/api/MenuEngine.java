package io.sieve.menu.api;

import io.sieve.menu.impl.MenuEngineImpl;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Owns the worker pool shared by filter passes and creates menu sessions.
 *
 * <p>Reuse one engine for every session of a process and close it on shutdown; closing discards
 * tasks that have not started.
 */
public interface MenuEngine extends AutoCloseable {

  /**
   * Creates an engine with a worker pool sized by {@link MenuConfig#effectiveThreads()}.
   *
   * @param config engine configuration
   * @return a new engine
   * @throws SieveConfigurationException if the worker pool cannot be created
   */
  static MenuEngine create(MenuConfig config) {
    return new MenuEngineImpl(config);
  }

  MenuConfig config();

  /**
   * Starts a session. The first filter pass runs before this method returns, so an auto-select
   * configuration may already have produced a terminal state.
   *
   * @param source entries to filter, must stay stable while the session lives
   * @param resolver key binding capability
   * @param initialQuery pre-filled query text, may be empty
   * @return the new session
   */
  MenuSession newSession(EntrySource source, ActionResolver resolver, String initialQuery);

  /**
   * Starts a session resolving keys through the bindings of {@link #config()}.
   *
   * @param source entries to filter
   * @param initialQuery pre-filled query text, may be empty
   * @return the new session
   */
  MenuSession newSession(EntrySource source, String initialQuery);

  /**
   * Runs a single filter pass outside any session.
   *
   * @param source entries to filter
   * @param query raw query text
   * @param matching case sensitivity and ranking flags
   * @return matching entry indices in source order, or by ascending edit distance when ranking
   * @throws SieveFilterException if the source threw while matching
   */
  IntList filter(EntrySource source, String query, MatchingState matching);

  @Override
  void close();
}
