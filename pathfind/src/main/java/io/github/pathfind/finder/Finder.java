package io.github.pathfind.finder;

import io.github.pathfind.exception.AdaptationException;
import io.github.pathfind.exception.ConfigurationException;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.lane.role.LaneRole;
import io.github.pathfind.model.Configuration;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.IdType;
import io.github.pathfind.model.Identifier;
import io.github.pathfind.model.LaneRow;
import io.github.pathfind.model.QcStatus;
import io.github.pathfind.model.QueryFilter;
import io.github.pathfind.progress.ProgressReporter;
import io.github.pathfind.progress.ProgressTracker;
import io.github.pathfind.registry.PartitionHandle;
import io.github.pathfind.registry.PartitionRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds lanes matching a set of identifiers across every partition, then filters and sorts them.
 */
public class Finder {

  private static final Logger log = LoggerFactory.getLogger(Finder.class);

  private final LaneRole role;
  private final PartitionRegistry partitionRegistry;
  private final LaneSorter laneSorter;
  private final ProgressReporter progressReporter;
  private final FileSystemHelper fileSystemHelper;

  /**
   * Instantiates a new finder. The lane role is looked up from the configuration using the
   * calling context.
   *
   * @param configuration     the configuration
   * @param callerContext     the calling command, e.g. "data"
   * @param laneRoles         the known lane roles, by name
   * @param partitionRegistry the partition registry
   * @param laneSorter        the lane sorter
   * @param progressReporter  the progress reporter
   * @param fileSystemHelper  the file system helper
   * @throws ConfigurationException if no usable role is configured for the context
   */
  public Finder(final Configuration configuration,
                final String callerContext,
                final Map<String, LaneRole> laneRoles,
                final PartitionRegistry partitionRegistry,
                final LaneSorter laneSorter,
                final ProgressReporter progressReporter,
                final FileSystemHelper fileSystemHelper) {
    final String roleName = configuration.laneRoles().get(callerContext);
    if (roleName == null) {
      throw new ConfigurationException(
          "Couldn't find a lane role for the current command (" + callerContext + ")");
    }
    final LaneRole laneRole = laneRoles.get(roleName);
    if (laneRole == null) {
      throw new ConfigurationException("Unknown lane role '" + roleName + "' configured for command '"
          + callerContext + "'; known roles are " + laneRoles.keySet());
    }
    this.role = laneRole;
    this.partitionRegistry = partitionRegistry;
    this.laneSorter = laneSorter;
    this.progressReporter = progressReporter;
    this.fileSystemHelper = fileSystemHelper;
    log.debug("Finder for '{}' uses lane role '{}'", callerContext, roleName);
  }

  /**
   * The lane role applied to every lane this finder builds.
   *
   * @return the role
   */
  public LaneRole role() {
    return role;
  }

  /**
   * Find lanes.
   *
   * @param ids    the identifier values
   * @param type   the type of every value
   * @param filter the filter
   * @return the surviving lanes, sorted
   * @throws IllegalArgumentException if the type is FILE or the filter asks for a file category
   *                                  this finder's role doesn't have
   */
  public List<Lane> findLanes(final List<String> ids, final IdType type, final QueryFilter filter) {
    if (type == IdType.FILE) {
      throw new IllegalArgumentException("IDs read from a file must be searched using the ID type in the file");
    }
    final Optional<FileCategory> category = filter.fileCategory();
    if (category.isPresent() && !role.supportedCategories().contains(category.get())) {
      throw new IllegalArgumentException("File type '" + category.get().value() + "' is not available for "
          + role.name() + " searches");
    }
    log.debug("searching with {} IDs of type \"{}\"", ids.size(), type);
    final List<Identifier> identifiers = ids.stream()
        .map(id -> Identifier.of(type, id))
        .collect(Collectors.toList());

    final List<Lane> lanes = findAll(identifiers);
    log.debug("found {} lanes", lanes.size());

    final List<Lane> filtered = new ArrayList<>();
    for (final Lane lane : lanes) {
      if (failsQc(lane, filter.qcStatus())) {
        continue;
      }
      if (category.isPresent()) {
        lane.discoverFiles(category.get());
        if (!lane.hasFiles()) {
          log.debug("lane \"{}\" has no files of type \"{}\"; filtered out", lane.name(), category.get().value());
          continue;
        }
      }
      filtered.add(lane);
    }
    return laneSorter.sort(filtered);
  }

  private List<Lane> findAll(final List<Identifier> identifiers) {
    final List<PartitionHandle> partitions = partitionRegistry.listPartitions();
    final List<Lane> lanes = new ArrayList<>();
    try (ProgressTracker progress = progressReporter.start(
        "finding lanes", (long) partitions.size() * identifiers.size())) {
      for (final PartitionHandle partition : partitions) {
        log.debug("searching \"{}\"", partition.name());
        for (final Identifier identifier : identifiers) {
          log.debug("looking for ID \"{}\"", identifier.value());
          final List<LaneRow> rows = partition.queryByIdentifier(identifier);
          for (final LaneRow row : rows) {
            lanes.add(adapt(row, partition));
          }
          progress.tick();
        }
      }
    }
    return lanes;
  }

  private Lane adapt(final LaneRow row, final PartitionHandle partition) {
    try {
      return new Lane(row, partition, role, fileSystemHelper);
    } catch (AdaptationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new AdaptationException("Couldn't apply role \"" + role.name() + "\" to lane " + row.name()
          + " from " + partition.name() + ": " + e.getMessage(), e);
    }
  }

  // Lanes without a recorded QC status are never filtered out.
  private boolean failsQc(final Lane lane, final Optional<QcStatus> required) {
    if (required.isEmpty() || lane.qcStatus().isEmpty()) {
      return false;
    }
    if (required.get().matches(lane.qcStatus().get())) {
      return false;
    }
    log.debug("lane \"{}\" filtered by QC status (actual status is \"{}\"; requiring status \"{}\")",
        lane.name(), lane.qcStatus().get(), required.get().value());
    return true;
  }
}
