package io.github.pathfind.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * The configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(as = ImmutableConfiguration.class)
public interface Configuration {

  /**
   * Partitions, searched in this order.
   *
   * @return the partitions
   */
  List<PartitionConfig> partitions();

  /**
   * Maps a calling context (the command name) to the name of the lane role it uses.
   *
   * @return the lane roles
   */
  Map<String, String> laneRoles();

  /**
   * Suppress progress output.
   *
   * @return true to hide progress
   */
  @Value.Default
  default boolean noProgressBars() {
    return false;
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    final long distinct = partitions().stream().map(PartitionConfig::name).distinct().count();
    if (distinct != partitions().size()) {
      throw new IllegalStateException("Partition names must be unique");
    }
  }
}
