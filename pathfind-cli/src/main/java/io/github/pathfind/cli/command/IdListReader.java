package io.github.pathfind.cli.command;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads a file of IDs, one per line. Surrounding whitespace is trimmed and blank lines skipped.
 */
public final class IdListReader {

  private IdListReader() {
  }

  /**
   * Read the IDs.
   *
   * @param file the file
   * @return the IDs, in file order
   * @throws IOException if the file can't be read
   */
  public static List<String> read(final Path file) throws IOException {
    return Files.readAllLines(file).stream()
        .map(String::trim)
        .filter(line -> !line.isEmpty())
        .collect(Collectors.toList());
  }
}
