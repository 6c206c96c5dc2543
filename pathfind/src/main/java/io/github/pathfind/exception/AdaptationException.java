package io.github.pathfind.exception;

/**
 * A lane role could not be applied to a row found in a tracking database.
 */
public class AdaptationException extends PathFindException {

  /**
   * Instantiates a new adaptation exception.
   *
   * @param message the message
   */
  public AdaptationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new adaptation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public AdaptationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
