package io.github.pathfind.cli.model;

/**
 * The terminal action applied to the lanes found by a search.
 */
public enum ExportAction {
  LIST_PATHS,
  SYMLINK,
  ARCHIVE,
  STATS
}
