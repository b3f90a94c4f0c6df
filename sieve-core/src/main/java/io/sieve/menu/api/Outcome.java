package io.sieve.menu.api;

import java.util.Objects;

/** Terminal result of a menu session. Set exactly once. */
public sealed interface Outcome
    permits Outcome.Accept,
        Outcome.AcceptCustomText,
        Outcome.Cancel,
        Outcome.NextMode,
        Outcome.PreviousMode,
        Outcome.QuickSwitch,
        Outcome.DeleteEntry {

  /** Marker for outcomes that carry no entry. */
  int NO_ENTRY = -1;

  /**
   * The selected entry was accepted.
   *
   * @param entryIndex index into the entry source
   * @param modified whether the custom-accept variant was used
   */
  record Accept(int entryIndex, boolean modified) implements Outcome {}

  /** Nothing was selected; the raw query text is the result. */
  record AcceptCustomText(String text, boolean modified) implements Outcome {
    public AcceptCustomText {
      Objects.requireNonNull(text, "text");
    }
  }

  record Cancel() implements Outcome {}

  record NextMode() implements Outcome {}

  record PreviousMode() implements Outcome {}

  /**
   * Jump to another mode.
   *
   * @param modeIndex zero-based mode index
   * @param entryIndex selected entry at the time of the switch, or {@link #NO_ENTRY}
   */
  record QuickSwitch(int modeIndex, int entryIndex) implements Outcome {
    public boolean hasEntry() {
      return entryIndex != NO_ENTRY;
    }
  }

  /** The caller should delete the entry and rebuild the session. */
  record DeleteEntry(int entryIndex) implements Outcome {}
}
