package io.github.pathfind.lane.role;

import io.github.pathfind.exception.AdaptationException;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.FileRef;
import io.github.pathfind.model.LaneRow;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Shared file finding: each category maps to a file name test, applied to one directory under
 * the lane directory.
 */
public abstract class BaseLaneRole implements LaneRole {

  private final FileSystemHelper fileSystemHelper;

  /**
   * Instantiates a new base lane role.
   *
   * @param fileSystemHelper the file system helper
   */
  protected BaseLaneRole(final FileSystemHelper fileSystemHelper) {
    this.fileSystemHelper = fileSystemHelper;
  }

  /**
   * File name tests, by category.
   *
   * @return the matchers
   */
  protected abstract Map<FileCategory, Predicate<String>> fileMatchers();

  /**
   * Where the files are, relative to the lane directory.
   *
   * @param lane the lane
   * @return the directory to search
   */
  protected abstract Path searchDirectory(Lane lane);

  @Override
  public Set<FileCategory> supportedCategories() {
    return fileMatchers().keySet();
  }

  @Override
  public void checkApplicable(final LaneRow row) {
    if (row.hierarchyName().isEmpty()) {
      throw new AdaptationException("Lane " + row.name() + " has no hierarchy path, so its files can't be located");
    }
  }

  @Override
  public List<FileRef> findFiles(final Lane lane, final FileCategory category) {
    final Predicate<String> matcher = fileMatchers().get(category);
    if (matcher == null) {
      return List.of();
    }
    return fileSystemHelper.listFiles(searchDirectory(lane), matcher).stream()
        .map(path -> FileRef.of(path, category))
        .collect(Collectors.toList());
  }

  /**
   * Count of the lane's files in the default category, without touching its discovered files.
   *
   * @param lane the lane
   * @return the count
   */
  protected int countDefaultFiles(final Lane lane) {
    return findFiles(lane, defaultCategory()).size();
  }

  /**
   * Value or empty string.
   *
   * @param value the value
   * @return the string
   */
  protected static String orEmpty(final Optional<String> value) {
    return value.orElse("");
  }
}
