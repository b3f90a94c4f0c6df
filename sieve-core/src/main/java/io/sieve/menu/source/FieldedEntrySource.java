package io.sieve.menu.source;

import io.sieve.menu.api.EntrySource;
import io.sieve.menu.api.TokenSet;
import io.sieve.menu.internal_api.Collation;
import io.sieve.menu.internal_api.TokenMatcher;
import java.util.List;
import java.util.Objects;

/**
 * Entries with several searchable fields. A query matches when every token is found in at least
 * one of name, generic name or command; different tokens may match different fields.
 */
public final class FieldedEntrySource implements EntrySource {
  private final List<FieldedEntry> entries;

  public FieldedEntrySource(List<FieldedEntry> entries) {
    this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
  }

  public FieldedEntry entry(int index) {
    return entries.get(index);
  }

  @Override
  public int count() {
    return entries.size();
  }

  @Override
  public String displayText(int index) {
    return entries.get(index).displayText();
  }

  @Override
  public String completion(int index) {
    return entries.get(index).name();
  }

  @Override
  public boolean matches(int index, TokenSet tokens, boolean notAscii) {
    FieldedEntry e = entries.get(index);
    boolean cs = tokens.caseSensitive();
    for (String token : tokens.tokens()) {
      boolean found =
          TokenMatcher.matchesToken(token, e.name(), notAscii, cs)
              || TokenMatcher.matchesToken(token, e.genericName(), notAscii, cs)
              || TokenMatcher.matchesToken(token, e.command(), notAscii, cs);
      if (!found) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean isNotAscii(int index) {
    FieldedEntry e = entries.get(index);
    return Collation.isNotAscii(e.name())
        || (e.genericName() != null && Collation.isNotAscii(e.genericName()));
  }
}
