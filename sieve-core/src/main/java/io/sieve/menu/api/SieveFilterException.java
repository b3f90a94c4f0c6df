package io.sieve.menu.api;

/**
 * Thrown when a filter pass cannot complete because a worker task failed. Matching is expected
 * to be total, so this points at a misbehaving {@link EntrySource}.
 */
public class SieveFilterException extends SieveException {

  public SieveFilterException(String message, String subject, Throwable cause) {
    super(Kind.FILTER, message, subject, cause);
  }

  public static SieveFilterException chunkFailed(int start, int stop, Throwable cause) {
    return new SieveFilterException(
        "matching failed", "entries " + start + ".." + stop, cause);
  }
}
