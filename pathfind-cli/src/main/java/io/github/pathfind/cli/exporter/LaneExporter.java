package io.github.pathfind.cli.exporter;

import io.github.pathfind.cli.model.ExportRequest;
import io.github.pathfind.lane.Lane;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main orchestrator for lane exports: hands the lanes to the exporter for the requested action.
 */
public class LaneExporter {

  private static final Logger log = LoggerFactory.getLogger(LaneExporter.class);

  private final PathListExporter pathListExporter;
  private final SymlinkExporter symlinkExporter;
  private final ArchiveExporter archiveExporter;
  private final StatsCsvExporter statsCsvExporter;

  /**
   * Constructor.
   *
   * @param pathListExporter the path list exporter
   * @param symlinkExporter  the symlink exporter
   * @param archiveExporter  the archive exporter
   * @param statsCsvExporter the stats exporter
   */
  public LaneExporter(final PathListExporter pathListExporter,
                      final SymlinkExporter symlinkExporter,
                      final ArchiveExporter archiveExporter,
                      final StatsCsvExporter statsCsvExporter) {
    this.pathListExporter = pathListExporter;
    this.symlinkExporter = symlinkExporter;
    this.archiveExporter = archiveExporter;
    this.statsCsvExporter = statsCsvExporter;
  }

  /**
   * Export lanes.
   *
   * @param lanes   the lanes, already filtered and sorted
   * @param request the request
   */
  public void export(final List<Lane> lanes, final ExportRequest request) {
    log.debug("Exporting {} lanes: {}", lanes.size(), request);

    switch (request.action()) {
      case LIST_PATHS:
        pathListExporter.export(lanes);
        break;
      case SYMLINK:
        symlinkExporter.export(lanes, request);
        break;
      case ARCHIVE:
        archiveExporter.export(lanes, request);
        break;
      case STATS:
        statsCsvExporter.export(lanes, request);
        break;
      default:
        throw new IllegalArgumentException("Unsupported export action: " + request.action());
    }
  }
}
