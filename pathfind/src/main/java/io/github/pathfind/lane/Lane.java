package io.github.pathfind.lane;

import io.github.pathfind.exception.FilesystemException;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.helper.NameHelper;
import io.github.pathfind.lane.role.LaneRole;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.FileRef;
import io.github.pathfind.model.LaneRow;
import io.github.pathfind.registry.PartitionHandle;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A sequencing lane found in one partition. What files it has, and how it is summarised, is
 * decided by its {@link LaneRole}.
 */
public class Lane {

  private static final Logger log = LoggerFactory.getLogger(Lane.class);

  private final LaneRow row;
  private final PartitionHandle partition;
  private final LaneRole role;
  private final FileSystemHelper fileSystemHelper;

  private List<FileRef> files = List.of();
  private FileCategory discoveredCategory;

  /**
   * Instantiates a new lane.
   *
   * @param row              the row it was built from
   * @param partition        the partition the row came from
   * @param role             the role
   * @param fileSystemHelper the file system helper
   * @throws io.github.pathfind.exception.AdaptationException if the role can't handle the row
   */
  public Lane(final LaneRow row,
              final PartitionHandle partition,
              final LaneRole role,
              final FileSystemHelper fileSystemHelper) {
    role.checkApplicable(row);
    this.row = row;
    this.partition = partition;
    this.role = role;
    this.fileSystemHelper = fileSystemHelper;
  }

  public String name() {
    return row.name();
  }

  public Optional<String> qcStatus() {
    return row.qcStatus();
  }

  public LaneRow row() {
    return row;
  }

  public PartitionHandle partition() {
    return partition;
  }

  public LaneRole role() {
    return role;
  }

  /**
   * The lane's directory on disk.
   *
   * @return the directory
   */
  public Path directory() {
    return partition.hierarchyRoot().resolve(row.hierarchyName().orElseThrow());
  }

  /**
   * Files found by the last {@link #discoverFiles} call.
   *
   * @return the files
   */
  public List<FileRef> files() {
    return files;
  }

  /**
   * The category of the last discovery, empty if discovery never ran.
   *
   * @return the category
   */
  public Optional<FileCategory> discoveredCategory() {
    return Optional.ofNullable(discoveredCategory);
  }

  /**
   * Find this lane's files of the given category. Calling again with the same category does
   * nothing; finding no files is not an error.
   *
   * @param category the category
   */
  public void discoverFiles(final FileCategory category) {
    if (category == discoveredCategory) {
      return;
    }
    files = List.copyOf(role.findFiles(this, category));
    discoveredCategory = category;
    log.debug("lane {}: found {} {} files", name(), files.size(), category.value());
  }

  public boolean hasFiles() {
    return !files.isEmpty();
  }

  public List<String> statsHeader() {
    return role.statsHeader();
  }

  public List<String> statsRow() {
    return role.statsRow(this);
  }

  /**
   * Link this lane's files into {@code destination}. Without a prior discovery the lane
   * directory itself is linked, named after the lane.
   *
   * @param destination  existing directory to hold the links
   * @param renameHashes replace '#' with '_' in link names
   * @throws FilesystemException if the destination isn't a directory or a link fails
   */
  public void createSymlinks(final Path destination, final boolean renameHashes) {
    if (!Files.isDirectory(destination)) {
      throw new FilesystemException("Link destination is not a directory", destination);
    }
    if (discoveredCategory == null) {
      fileSystemHelper.createSymlink(directory(), destination.resolve(linkName(name(), renameHashes)));
      return;
    }
    for (final FileRef file : files) {
      fileSystemHelper.createSymlink(file.absolutePath(),
          destination.resolve(linkName(file.fileName(), renameHashes)));
    }
  }

  /**
   * Print the discovered files, or the lane directory if discovery never ran, one per line.
   *
   * @param out the stream
   */
  public void printPaths(final PrintStream out) {
    if (discoveredCategory == null) {
      out.println(directory());
      return;
    }
    files.forEach(f -> out.println(f.absolutePath()));
  }

  private String linkName(final String name, final boolean renameHashes) {
    return renameHashes ? NameHelper.replaceHashes(name) : name;
  }

  @Override
  public String toString() {
    return "Lane{" + name() + " in " + partition.name() + "}";
  }
}
