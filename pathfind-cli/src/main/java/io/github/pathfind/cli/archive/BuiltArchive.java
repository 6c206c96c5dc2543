package io.github.pathfind.cli.archive;

import java.util.List;
import org.immutables.value.Value;

/**
 * An archive assembled in memory.
 */
@Value.Immutable
public interface BuiltArchive {

  /**
   * Member names, in the order they were added.
   *
   * @return the member names
   */
  List<String> memberNames();

  /**
   * The encoded archive.
   *
   * @return the bytes
   */
  byte[] bytes();
}
