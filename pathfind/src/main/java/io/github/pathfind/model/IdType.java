package io.github.pathfind.model;

/**
 * The kinds of identifier a search can be run with.
 */
public enum IdType {
  STUDY,
  SAMPLE,
  LIBRARY,
  LANE,
  SPECIES,
  /**
   * A file of identifiers; expanded by the caller before searching.
   */
  FILE
}
