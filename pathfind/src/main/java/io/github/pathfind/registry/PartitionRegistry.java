package io.github.pathfind.registry;

import io.github.pathfind.dao.LaneDao;
import io.github.pathfind.dbu.factory.JdbiFactory;
import io.github.pathfind.dbu.liquibase.LiquibaseHelper;
import io.github.pathfind.exception.PartitionConnectionException;
import io.github.pathfind.model.Configuration;
import io.github.pathfind.model.PartitionConfig;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the configured partitions. Every partition is searched for every identifier, so there
 * is no routing here; handles are opened on first use and kept for the rest of the run.
 */
@Singleton
public class PartitionRegistry {

  /**
   * Changelog creating the latest_lane table on managed partitions.
   */
  public static final String TRACKING_CHANGELOG = "liquibase/pathfind-tracking.xml";

  private static final Logger log = LoggerFactory.getLogger(PartitionRegistry.class);

  private final Map<String, PartitionConfig> partitionConfigs;
  private final LiquibaseHelper liquibaseHelper;
  private final Map<String, PartitionHandle> openHandles = new LinkedHashMap<>();

  /**
   * Instantiates a new partition registry.
   *
   * @param configuration   the configuration
   * @param liquibaseHelper the liquibase helper
   */
  @Inject
  public PartitionRegistry(final Configuration configuration,
                           final LiquibaseHelper liquibaseHelper) {
    this.liquibaseHelper = liquibaseHelper;
    this.partitionConfigs = new LinkedHashMap<>();
    configuration.partitions().forEach(p -> partitionConfigs.put(p.name(), p));
    log.debug("Configured partitions: {}", partitionConfigs.keySet());
  }

  /**
   * Open every partition, in configuration order.
   *
   * @return the partition handles
   */
  public List<PartitionHandle> listPartitions() {
    final List<PartitionHandle> handles = new ArrayList<>();
    for (final String name : partitionConfigs.keySet()) {
      handles.add(open(name));
    }
    return handles;
  }

  /**
   * Open a partition by name.
   *
   * @param name the name
   * @return the partition handle
   * @throws PartitionConnectionException if the partition is unknown or unreachable
   */
  public PartitionHandle open(final String name) {
    final PartitionHandle existing = openHandles.get(name);
    if (existing != null) {
      return existing;
    }
    final PartitionConfig config = partitionConfigs.get(name);
    if (config == null) {
      throw new PartitionConnectionException("No such partition: " + name);
    }
    log.debug("Opening partition {}", name);
    final Jdbi jdbi = new JdbiFactory(config.database()).createJdbi();
    try (Handle handle = jdbi.open()) {
      log.trace("Partition {} reachable, connection valid={}", name, handle.getConnection().isValid(0));
    } catch (JdbiException | SQLException e) {
      throw new PartitionConnectionException("Couldn't connect to partition '" + name + "'", e);
    }
    if (config.manageSchema()) {
      liquibaseHelper.runLiquibase(jdbi, TRACKING_CHANGELOG);
    }
    final PartitionHandle handle = new PartitionHandle(
        name, Path.of(config.hierarchyRoot()), jdbi.onDemand(LaneDao.class));
    openHandles.put(name, handle);
    return handle;
  }
}
