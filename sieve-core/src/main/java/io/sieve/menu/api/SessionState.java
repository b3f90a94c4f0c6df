package io.sieve.menu.api;

import java.util.Objects;

/** Lifecycle state reported after each event. */
public sealed interface SessionState permits SessionState.Interactive, SessionState.Terminal {

  SessionState INTERACTIVE = new Interactive();

  boolean isTerminal();

  record Interactive() implements SessionState {
    @Override
    public boolean isTerminal() {
      return false;
    }
  }

  record Terminal(Outcome outcome) implements SessionState {
    public Terminal {
      Objects.requireNonNull(outcome, "outcome");
    }

    @Override
    public boolean isTerminal() {
      return true;
    }
  }
}
