package io.github.pathfind.cli.format;

/**
 * Archive encodings.
 */
public enum ArchiveFormat {
  /**
   * Uncompressed tar.
   */
  TAR(".tar"),

  /**
   * Gzip compressed tar.
   */
  TAR_GZ(".tar.gz"),

  /**
   * Zip.
   */
  ZIP(".zip");

  private final String extension;

  ArchiveFormat(final String extension) {
    this.extension = extension;
  }

  /**
   * File name extension, including the leading dot.
   *
   * @return the extension
   */
  public String extension() {
    return extension;
  }
}
