package io.sieve.shell;

import io.sieve.menu.api.MenuEngine;
import io.sieve.menu.api.MenuSession;
import io.sieve.menu.api.Outcome;
import io.sieve.menu.api.SessionState;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs sessions over the modes until one ends with a result for the caller. Mode changes and
 * entry deletions are handled here by rebuilding the session.
 */
final class MenuLoop {
  private static final Logger LOG = LoggerFactory.getLogger(MenuLoop.class);

  /** Drives a session until it is terminal. */
  interface Interactor {
    Outcome interact(MenuSession session, Modes modes) throws IOException;
  }

  /**
   * Final outcome and the mode it was produced in.
   *
   * @param outcome accept, custom text, cancel or a quick-switch to a missing mode
   * @param mode mode the outcome refers to
   */
  record Result(Outcome outcome, Modes.Mode mode) {}

  private final MenuEngine engine;
  private final Interactor interactor;

  MenuLoop(MenuEngine engine, Interactor interactor) {
    this.engine = engine;
    this.interactor = interactor;
  }

  Result run(Modes modes, String initialQuery, int selectedRow) throws IOException {
    String query = initialQuery;
    int reselectEntry = -1;
    while (true) {
      Modes.Mode mode = modes.current();
      MenuSession session = engine.newSession(mode.source(), query);
      if (reselectEntry >= 0) {
        session.selectEntry(reselectEntry);
      } else if (selectedRow > 0 && session.filteredCount() > 0) {
        int row = Math.min(selectedRow, session.filteredCount() - 1);
        session.selectEntry(session.filteredEntries().getInt(row));
      }
      selectedRow = 0;
      reselectEntry = -1;

      Outcome outcome =
          session.state().isTerminal()
              ? ((SessionState.Terminal) session.state()).outcome()
              : interactor.interact(session, modes);
      LOG.debug("Mode '{}' ended with {}", mode.name(), outcome);

      if (outcome instanceof Outcome.NextMode) {
        modes.next();
        query = "";
      } else if (outcome instanceof Outcome.PreviousMode) {
        modes.previous();
        query = "";
      } else if (outcome instanceof Outcome.QuickSwitch
          && modes.size() > 1
          && modes.select(((Outcome.QuickSwitch) outcome).modeIndex())) {
        query = "";
      } else if (outcome instanceof Outcome.DeleteEntry) {
        int deleted = ((Outcome.DeleteEntry) outcome).entryIndex();
        int next = session.nextEntryIndex();
        modes.deleteEntry(deleted);
        if (next != deleted) {
          // indices after the deleted entry shift down by one
          reselectEntry = next > deleted ? next - 1 : next;
        } else {
          // deleted the last filtered entry, keep the row above it
          selectedRow = session.selectedIndex() - 1;
        }
        query = session.currentQueryText();
      } else {
        return new Result(outcome, mode);
      }
    }
  }
}
