package io.github.pathfind.cli.model;

import io.github.pathfind.cli.format.ArchiveFormat;
import io.github.pathfind.model.FileCategory;
import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * What to do with the lanes found by one invocation.
 */
@Value.Immutable
public interface ExportRequest {

  /**
   * Action.
   *
   * @return the action
   */
  ExportAction action();

  /**
   * Output for the symlink, archive and stats actions.
   *
   * @return the target
   */
  @Value.Default
  default OutputTarget target() {
    return OutputTarget.off();
  }

  /**
   * Archive encoding, only used by the archive action.
   *
   * @return the archive format
   */
  @Value.Default
  default ArchiveFormat archiveFormat() {
    return ArchiveFormat.TAR_GZ;
  }

  /**
   * Stats column separator.
   *
   * @return the separator
   */
  @Value.Default
  default char separator() {
    return ',';
  }

  /**
   * Replace '#' with '_' in link and archive member names.
   *
   * @return true to rename
   */
  @Value.Default
  default boolean renameHashes() {
    return false;
  }

  /**
   * File category asked for on the command line, if any.
   *
   * @return the file category
   */
  Optional<FileCategory> fileCategory();

  /**
   * The searched ID with hashes replaced; default output names and the archive's top level
   * directory are built from it.
   *
   * @return the group name
   */
  String groupName();

  /**
   * Directory that default output names are resolved against; the process working directory
   * unless set.
   *
   * @return the working directory
   */
  @Value.Default
  default Path workingDirectory() {
    return Path.of("");
  }

  /**
   * The target's path, or {@code defaultName} in the working directory when the target has no
   * path of its own.
   *
   * @param defaultName the default file or directory name
   * @return the output path
   */
  default Path outputPath(final String defaultName) {
    return target().resolve(workingDirectory().resolve(defaultName));
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if (action() == ExportAction.LIST_PATHS && target().isOn()) {
      throw new IllegalStateException("Listing paths has no output target");
    }
  }
}
