package io.github.pathfind.progress;

/**
 * Reports nothing. Used when progress bars are switched off.
 */
public class NoOpProgressReporter implements ProgressReporter {

  private static final ProgressTracker NO_OP_TRACKER = new ProgressTracker() {
    @Override
    public void tick() {
      // nothing to report
    }

    @Override
    public void close() {
      // nothing to clear
    }
  };

  @Override
  public ProgressTracker start(final String name, final long total) {
    return NO_OP_TRACKER;
  }
}
