package io.github.pathfind.exception;

/**
 * Base class for failures that end a pathfind run.
 */
public class PathFindException extends RuntimeException {

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   */
  public PathFindException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PathFindException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
