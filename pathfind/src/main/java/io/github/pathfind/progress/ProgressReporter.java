package io.github.pathfind.progress;

/**
 * Creates progress trackers for slow steps. Progress is advisory: nothing may depend on it.
 */
public interface ProgressReporter {

  /**
   * Start tracking a step.
   *
   * @param name  short description, e.g. "finding lanes"
   * @param total number of units of work in the step
   * @return the tracker; close it when the step is done
   */
  ProgressTracker start(String name, long total);
}
