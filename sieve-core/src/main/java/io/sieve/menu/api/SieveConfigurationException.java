package io.sieve.menu.api;

/**
 * Thrown when the engine cannot be set up: invalid configuration values, unparsable key bindings
 * or a worker pool that cannot be created. These errors are fatal for the session being started.
 */
public class SieveConfigurationException extends SieveException {

  public SieveConfigurationException(String message) {
    this(message, null, null);
  }

  public SieveConfigurationException(String message, String subject, Throwable cause) {
    super(Kind.CONFIGURATION, message, subject, cause);
  }

  public static SieveConfigurationException invalidValue(String key, String value) {
    return new SieveConfigurationException(
        String.format("invalid value '%s'", value), key, null);
  }

  public static SieveConfigurationException unknownKey(String binding, String key) {
    return new SieveConfigurationException(
        String.format("unknown key name '%s'", key), binding, null);
  }

  public static SieveConfigurationException unknownAction(String key) {
    return new SieveConfigurationException("no such action", key, null);
  }

  public static SieveConfigurationException poolCreationFailed(int threads, Throwable cause) {
    return new SieveConfigurationException(
        "failed to start " + threads + " worker threads", "threads", cause);
  }
}
