package io.github.pathfind.exception;

/**
 * A partition is not configured or its database cannot be reached.
 */
public class PartitionConnectionException extends PathFindException {

  /**
   * Instantiates a new partition connection exception.
   *
   * @param message the message
   */
  public PartitionConnectionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new partition connection exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PartitionConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
