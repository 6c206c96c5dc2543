package io.github.pathfind.model;

import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * A data file found for a lane.
 */
@Value.Immutable
public interface FileRef {

  /**
   * Absolute path.
   *
   * @return the path
   */
  @Value.Parameter
  Path absolutePath();

  /**
   * Category.
   *
   * @return the file category
   */
  @Value.Parameter
  FileCategory category();

  /**
   * Of file ref.
   *
   * @param absolutePath the absolute path
   * @param category     the category
   * @return the file ref
   */
  static FileRef of(final Path absolutePath, final FileCategory category) {
    return ImmutableFileRef.of(absolutePath, category);
  }

  /**
   * File name.
   *
   * @return the last path element
   */
  default String fileName() {
    return absolutePath().getFileName().toString();
  }
}
