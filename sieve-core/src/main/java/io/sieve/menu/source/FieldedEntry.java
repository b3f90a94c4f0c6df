package io.sieve.menu.source;

import java.util.Objects;

/**
 * An application-like entry.
 *
 * @param name primary name, shown and completed
 * @param genericName secondary name, may be {@code null}
 * @param command command line, searchable but not shown, may be {@code null}
 */
public record FieldedEntry(String name, String genericName, String command) {

  public FieldedEntry {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Parses a tab separated line: {@code name[\tgeneric name[\tcommand]]}. Empty fields are read as
   * absent.
   */
  public static FieldedEntry parse(String line) {
    String[] parts = line.split("\t", 3);
    return new FieldedEntry(
        parts[0],
        parts.length > 1 ? emptyToNull(parts[1]) : null,
        parts.length > 2 ? emptyToNull(parts[2]) : null);
  }

  private static String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }

  /** {@code name (generic name)}, or just the name. */
  public String displayText() {
    return genericName == null ? name : name + " (" + genericName + ")";
  }
}
