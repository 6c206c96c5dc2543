package io.github.pathfind.model;

import java.util.Locale;

/**
 * Quality control state recorded against a lane.
 */
public enum QcStatus {
  PASSED,
  FAILED,
  PENDING;

  /**
   * The value stored in the tracking database.
   *
   * @return the lower case value
   */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Whether a raw status read from the database is this status.
   *
   * @param rawStatus the status column value
   * @return true if they match
   */
  public boolean matches(final String rawStatus) {
    return value().equalsIgnoreCase(rawStatus.trim());
  }
}
