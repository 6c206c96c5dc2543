package io.github.pathfind.exception;

import java.nio.file.Path;

/**
 * An output file, link or directory could not be created or written.
 */
public class FilesystemException extends PathFindException {

  private final transient Path path;

  /**
   * Instantiates a new filesystem exception.
   *
   * @param message the message; the path is appended
   * @param path    the path that could not be written
   * @param cause   the cause
   */
  public FilesystemException(final String message, final Path path, final Throwable cause) {
    super(message + " (" + path + ")" + (cause == null ? "" : ": " + cause.getMessage()), cause);
    this.path = path;
  }

  /**
   * Instantiates a new filesystem exception without an underlying cause.
   *
   * @param message the message
   * @param path    the path
   */
  public FilesystemException(final String message, final Path path) {
    this(message, path, null);
  }

  /**
   * The path that could not be written.
   *
   * @return the path
   */
  public Path path() {
    return path;
  }
}
