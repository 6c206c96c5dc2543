package io.github.pathfind.progress;

/**
 * Progress of one step.
 */
public interface ProgressTracker extends AutoCloseable {

  /**
   * One unit of work has completed.
   */
  void tick();

  /**
   * The step is over.
   */
  @Override
  void close();
}
