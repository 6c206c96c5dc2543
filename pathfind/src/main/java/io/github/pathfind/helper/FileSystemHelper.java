package io.github.pathfind.helper;

import io.github.pathfind.exception.FilesystemException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The filesystem operations pathfind needs: listing a lane directory, making links, and making
 * output directories.
 */
@Singleton
public class FileSystemHelper {

  private static final Logger log = LoggerFactory.getLogger(FileSystemHelper.class);

  /**
   * Instantiates a new File system helper.
   */
  @Inject
  public FileSystemHelper() {
    // injectable
  }

  /**
   * Regular files directly inside {@code directory} whose names match, sorted by name. A missing
   * or unreadable directory gives an empty list.
   *
   * @param directory   the directory
   * @param nameMatcher test applied to the file name
   * @return absolute paths of the matching files
   */
  public List<Path> listFiles(final Path directory, final Predicate<String> nameMatcher) {
    if (!Files.isDirectory(directory)) {
      log.debug("No directory at {}", directory);
      return List.of();
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> nameMatcher.test(p.getFileName().toString()))
          .map(Path::toAbsolutePath)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .collect(Collectors.toList());
    } catch (IOException e) {
      log.warn("Couldn't list files in {}: {}", directory, e.getMessage());
      return List.of();
    }
  }

  /**
   * Create {@code directory} (and parents) unless it exists, and check it is a directory.
   *
   * @param directory the directory
   * @return the directory
   * @throws FilesystemException if it cannot be created or is not a directory
   */
  public Path ensureDirectory(final Path directory) {
    if (!Files.exists(directory)) {
      try {
        Files.createDirectories(directory);
      } catch (IOException e) {
        throw new FilesystemException("Couldn't make directory", directory, e);
      }
    }
    if (!Files.isDirectory(directory)) {
      throw new FilesystemException("Not a directory", directory);
    }
    return directory;
  }

  /**
   * Link {@code link} to {@code target}. An existing entry at {@code link} is left alone.
   *
   * @param target the target
   * @param link   the link to create
   * @return true if a link was created
   * @throws FilesystemException if the link cannot be created
   */
  public boolean createSymlink(final Path target, final Path link) {
    if (Files.exists(link, LinkOption.NOFOLLOW_LINKS)) {
      log.warn("Not linking {}; {} already exists", target, link);
      return false;
    }
    try {
      Files.createSymbolicLink(link, target);
      log.debug("Linked {} -> {}", link, target);
      return true;
    } catch (IOException e) {
      throw new FilesystemException("Couldn't create link to " + target, link, e);
    }
  }
}
