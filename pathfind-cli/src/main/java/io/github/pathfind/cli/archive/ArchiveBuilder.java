package io.github.pathfind.cli.archive;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds an archive of files in memory.
 */
public interface ArchiveBuilder {

  /**
   * Build the archive.
   *
   * @param files   the files, in member order
   * @param options naming options
   * @return the archive
   * @throws io.github.pathfind.exception.FilesystemException if a file can't be read
   */
  BuiltArchive build(List<Path> files, ArchiveOptions options);
}
