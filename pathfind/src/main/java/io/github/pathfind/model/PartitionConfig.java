package io.github.pathfind.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.pathfind.dbu.model.Database;
import org.immutables.value.Value;

/**
 * One tracking database and the directory tree holding its data.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePartitionConfig.class)
@JsonDeserialize(as = ImmutablePartitionConfig.class)
public interface PartitionConfig {

  /**
   * Partition name.
   *
   * @return the name
   */
  String name();

  /**
   * Database connection settings.
   *
   * @return the database
   */
  Database database();

  /**
   * Root of the on-disk hierarchy. Lane hierarchy names are resolved against it.
   *
   * @return the hierarchy root
   */
  String hierarchyRoot();

  /**
   * Create the latest_lane table with liquibase when the partition is opened. Only meant for
   * development databases.
   *
   * @return true to manage the schema
   */
  @Value.Default
  default boolean manageSchema() {
    return false;
  }
}
