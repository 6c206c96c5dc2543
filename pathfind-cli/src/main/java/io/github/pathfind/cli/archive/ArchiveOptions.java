package io.github.pathfind.cli.archive;

import org.immutables.value.Value;

/**
 * How files are named inside an archive.
 */
@Value.Immutable
public interface ArchiveOptions {

  /**
   * Top level directory inside the archive.
   *
   * @return the directory name
   */
  String groupDirectoryName();

  /**
   * Replace '#' with '_' in file names.
   *
   * @return true to rename
   */
  @Value.Default
  default boolean renameHashes() {
    return false;
  }
}
