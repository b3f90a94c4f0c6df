package io.sieve.menu.source;

import io.sieve.menu.api.EntrySource;
import io.sieve.menu.api.TokenSet;
import io.sieve.menu.internal_api.Collation;
import io.sieve.menu.internal_api.TokenMatcher;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Entries that are plain lines of text, shown and completed verbatim. */
public final class LineEntrySource implements EntrySource {
  private final List<String> lines;

  public LineEntrySource(List<String> lines) {
    this.lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
  }

  /** Reads one entry per line, skipping empty lines. */
  public static LineEntrySource read(BufferedReader reader) throws IOException {
    List<String> lines = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      if (!line.isEmpty()) {
        lines.add(line);
      }
    }
    return new LineEntrySource(lines);
  }

  public List<String> lines() {
    return lines;
  }

  /** Copy of this source without the entry at {@code index}. */
  public LineEntrySource without(int index) {
    List<String> copy = new ArrayList<>(lines);
    copy.remove(index);
    return new LineEntrySource(copy);
  }

  @Override
  public int count() {
    return lines.size();
  }

  @Override
  public String displayText(int index) {
    return lines.get(index);
  }

  @Override
  public String completion(int index) {
    return lines.get(index);
  }

  @Override
  public boolean matches(int index, TokenSet tokens, boolean notAscii) {
    return TokenMatcher.matchesAll(tokens, lines.get(index), notAscii);
  }

  @Override
  public boolean isNotAscii(int index) {
    return Collation.isNotAscii(lines.get(index));
  }
}
