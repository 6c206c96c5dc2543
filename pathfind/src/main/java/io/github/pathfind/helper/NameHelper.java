package io.github.pathfind.helper;

/**
 * File name clean-up shared by links, archives and generated output names.
 */
public final class NameHelper {

  private NameHelper() {
  }

  /**
   * Replace every '#' with '_'. Tagged lane names such as 5477_6#1 contain hashes, which upset
   * shells and some archive tools.
   *
   * @param name the name
   * @return the name without hashes
   */
  public static String replaceHashes(final String name) {
    return name.replace('#', '_');
  }
}
