package io.github.pathfind.finder;

import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.role.LaneRole;
import io.github.pathfind.model.Configuration;
import io.github.pathfind.progress.ProgressReporter;
import io.github.pathfind.registry.PartitionRegistry;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Builds a {@link Finder} for a calling command.
 */
@Singleton
public class FinderFactory {

  private final Configuration configuration;
  private final Map<String, LaneRole> laneRoles;
  private final PartitionRegistry partitionRegistry;
  private final LaneSorter laneSorter;
  private final ProgressReporter progressReporter;
  private final FileSystemHelper fileSystemHelper;

  /**
   * Instantiates a new finder factory.
   *
   * @param configuration     the configuration
   * @param laneRoles         the lane roles
   * @param partitionRegistry the partition registry
   * @param laneSorter        the lane sorter
   * @param progressReporter  the progress reporter
   * @param fileSystemHelper  the file system helper
   */
  @Inject
  public FinderFactory(final Configuration configuration,
                       final Map<String, LaneRole> laneRoles,
                       final PartitionRegistry partitionRegistry,
                       final LaneSorter laneSorter,
                       final ProgressReporter progressReporter,
                       final FileSystemHelper fileSystemHelper) {
    this.configuration = configuration;
    this.laneRoles = laneRoles;
    this.partitionRegistry = partitionRegistry;
    this.laneSorter = laneSorter;
    this.progressReporter = progressReporter;
    this.fileSystemHelper = fileSystemHelper;
  }

  /**
   * Create a finder.
   *
   * @param callerContext the calling command
   * @return the finder
   */
  public Finder create(final String callerContext) {
    return new Finder(configuration, callerContext, laneRoles, partitionRegistry, laneSorter,
        progressReporter, fileSystemHelper);
  }
}
