package io.github.pathfind.cli.exporter;

import io.github.pathfind.cli.model.ExportRequest;
import io.github.pathfind.dagger.CommonModule;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.progress.ProgressReporter;
import io.github.pathfind.progress.ProgressTracker;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links lane files, or lane directories, into one directory.
 */
public class SymlinkExporter {

  private static final Logger log = LoggerFactory.getLogger(SymlinkExporter.class);

  private final FileSystemHelper fileSystemHelper;
  private final ProgressReporter progressReporter;
  private final PrintStream stderr;

  /**
   * Constructor.
   *
   * @param fileSystemHelper the file system helper
   * @param progressReporter progress while linking
   * @param stderr           where the destination is reported
   */
  @Inject
  public SymlinkExporter(final FileSystemHelper fileSystemHelper,
                         final ProgressReporter progressReporter,
                         @Named(CommonModule.STDERR) final PrintStream stderr) {
    this.fileSystemHelper = fileSystemHelper;
    this.progressReporter = progressReporter;
    this.stderr = stderr;
  }

  /**
   * Link into the directory named by the request, or {@code pathfind_<group>}, creating it if
   * needed.
   *
   * @param lanes   the lanes
   * @param request the request
   * @return the directory holding the links
   */
  public Path export(final List<Lane> lanes, final ExportRequest request) {
    final Path destination = fileSystemHelper.ensureDirectory(request.outputPath("pathfind_" + request.groupName()));
    stderr.println("Creating links in '" + destination + "'");
    try (ProgressTracker progress = progressReporter.start("linking", lanes.size())) {
      for (final Lane lane : lanes) {
        lane.createSymlinks(destination, request.renameHashes());
        progress.tick();
      }
    }
    log.debug("linked {} lanes into {}", lanes.size(), destination);
    return destination;
  }
}
