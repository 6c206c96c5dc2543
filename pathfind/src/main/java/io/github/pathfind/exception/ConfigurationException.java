package io.github.pathfind.exception;

/**
 * The configuration is missing, unreadable, or has no lane role for the calling context.
 */
public class ConfigurationException extends PathFindException {

  /**
   * Instantiates a new configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
