package io.github.pathfind.cli.exporter;

import io.github.pathfind.dagger.CommonModule;
import io.github.pathfind.lane.Lane;
import java.io.PrintStream;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Named;

/**
 * Prints each lane's files, or its directory when no file type was asked for.
 */
public class PathListExporter {

  private final PrintStream stdout;

  /**
   * Constructor.
   *
   * @param stdout the stream
   */
  @Inject
  public PathListExporter(@Named(CommonModule.STDOUT) final PrintStream stdout) {
    this.stdout = stdout;
  }

  public void export(final List<Lane> lanes) {
    lanes.forEach(lane -> lane.printPaths(stdout));
    stdout.flush();
  }
}
