package io.sieve.menu.api;

/**
 * Base exception for all sieve engine errors. The {@link Kind} tells a front end whether the
 * session could not be set up or a running filter pass broke; {@link #subject()} names the
 * configuration key, binding or entry range at fault when there is one.
 */
public abstract class SieveException extends RuntimeException {

  /** Where an engine error originates. */
  public enum Kind {
    /** A configuration value, key binding or the worker pool is unusable. */
    CONFIGURATION,
    /** A worker failed while matching entries. */
    FILTER
  }

  private final Kind kind;
  private final String subject;

  protected SieveException(Kind kind, String message, String subject, Throwable cause) {
    super(subject == null ? message : subject + ": " + message, cause);
    this.kind = kind;
    this.subject = subject;
  }

  public Kind kind() {
    return kind;
  }

  /** The offending key, binding or entry range, or {@code null}. */
  public String subject() {
    return subject;
  }
}
