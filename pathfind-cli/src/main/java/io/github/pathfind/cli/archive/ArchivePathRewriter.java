package io.github.pathfind.cli.archive;

import io.github.pathfind.helper.NameHelper;
import java.io.File;
import java.nio.file.Path;

/**
 * Names of archive members. Members always use forward slashes.
 */
public final class ArchivePathRewriter {

  private ArchivePathRewriter() {
  }

  /**
   * Member name for a file: {@code <group>/<basename>}. Hashes are always replaced in the group
   * directory, and in the file name only when asked.
   *
   * @param groupDirectoryName the top level directory
   * @param file               the file
   * @param renameHashes       replace hashes in the file name
   * @return the member name
   */
  public static String memberName(final String groupDirectoryName, final Path file, final boolean renameHashes) {
    final String baseName = file.getFileName().toString();
    return NameHelper.replaceHashes(groupDirectoryName) + "/"
        + (renameHashes ? NameHelper.replaceHashes(baseName) : baseName);
  }

  /**
   * The member name used when a file can't be renamed: its absolute path without the leading
   * slash.
   *
   * @param file the file
   * @return the member name
   */
  public static String originalName(final Path file) {
    String name = file.toAbsolutePath().toString();
    if (File.separatorChar != '/') {
      name = name.replace(File.separatorChar, '/');
    }
    while (name.startsWith("/")) {
      name = name.substring(1);
    }
    return name;
  }
}
