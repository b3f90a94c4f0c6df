package io.sieve.shell;

import io.sieve.menu.source.LineEntrySource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Named entry lists the user cycles through; one of them is current. */
final class Modes {

  record Mode(String name, LineEntrySource source) {
    Mode {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(source, "source");
    }
  }

  private final List<Mode> modes;
  private int current = 0;

  Modes(List<Mode> modes) {
    if (modes.isEmpty()) {
      throw new IllegalArgumentException("At least one mode is required");
    }
    this.modes = new ArrayList<>(modes);
  }

  int size() {
    return modes.size();
  }

  int currentIndex() {
    return current;
  }

  Mode current() {
    return modes.get(current);
  }

  List<String> names() {
    List<String> names = new ArrayList<>(modes.size());
    for (Mode m : modes) {
      names.add(m.name());
    }
    return names;
  }

  void next() {
    current = (current + 1) % modes.size();
  }

  void previous() {
    current = (current + modes.size() - 1) % modes.size();
  }

  /** Switches to the mode; returns {@code false} if there is no such mode. */
  boolean select(int index) {
    if (index < 0 || index >= modes.size()) {
      return false;
    }
    current = index;
    return true;
  }

  /** Removes an entry from the current mode's list. */
  void deleteEntry(int entryIndex) {
    Mode mode = current();
    modes.set(current, new Mode(mode.name(), mode.source().without(entryIndex)));
  }
}
