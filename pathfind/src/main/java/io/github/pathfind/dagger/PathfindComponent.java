package io.github.pathfind.dagger;

import dagger.Component;
import io.github.pathfind.finder.FinderFactory;
import io.github.pathfind.lane.role.LaneRole;
import io.github.pathfind.model.Configuration;
import io.github.pathfind.registry.PartitionRegistry;
import java.util.Map;
import javax.inject.Singleton;

/**
 * The interface Pathfind component.
 */
@Singleton
@Component(modules = {PathfindModule.class, ConfigurationModule.class, CommonModule.class})
public interface PathfindComponent {

  /**
   * Instance pathfind component.
   *
   * @param configuration the configuration
   * @return the pathfind component
   */
  static PathfindComponent instance(final Configuration configuration) {
    return DaggerPathfindComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Finder factory.
   *
   * @return the finder factory
   */
  FinderFactory finderFactory();

  /**
   * Partition registry.
   *
   * @return the partition registry
   */
  PartitionRegistry partitionRegistry();

  /**
   * Lane roles by name.
   *
   * @return the lane roles
   */
  Map<String, LaneRole> laneRoles();
}
