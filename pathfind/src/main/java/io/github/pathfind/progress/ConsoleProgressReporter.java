package io.github.pathfind.progress;

import java.io.PrintStream;

/**
 * Draws a single-line progress bar on a console stream and removes it when the step ends.
 */
public class ConsoleProgressReporter implements ProgressReporter {

  private static final int BAR_WIDTH = 40;

  private final PrintStream out;

  /**
   * Instantiates a new console progress reporter.
   *
   * @param out where to draw, normally standard error
   */
  public ConsoleProgressReporter(final PrintStream out) {
    this.out = out;
  }

  @Override
  public ProgressTracker start(final String name, final long total) {
    return new ConsoleTracker(name, total);
  }

  private class ConsoleTracker implements ProgressTracker {

    private final String name;
    private final long total;
    private long done;
    private int lastPercent = -1;
    private int lastWidth;

    ConsoleTracker(final String name, final long total) {
      this.name = name;
      this.total = total;
      draw();
    }

    @Override
    public void tick() {
      done++;
      draw();
    }

    @Override
    public void close() {
      if (lastWidth > 0) {
        out.print("\r" + " ".repeat(lastWidth) + "\r");
        out.flush();
      }
    }

    private void draw() {
      if (total <= 0) {
        return;
      }
      final int percent = (int) Math.min(100, (done * 100) / total);
      if (percent == lastPercent) {
        return;
      }
      lastPercent = percent;
      final int filled = percent * BAR_WIDTH / 100;
      final String line = String.format("%s: %3d%% [%s%s]",
          name, percent, "=".repeat(filled), " ".repeat(BAR_WIDTH - filled));
      lastWidth = line.length();
      out.print("\r" + line);
      out.flush();
    }
  }
}
