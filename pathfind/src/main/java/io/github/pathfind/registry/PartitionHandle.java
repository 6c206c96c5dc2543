package io.github.pathfind.registry;

import io.github.pathfind.dao.LaneDao;
import io.github.pathfind.model.Identifier;
import io.github.pathfind.model.LaneRow;
import java.nio.file.Path;
import java.util.List;

/**
 * An open partition: its name, where its data lives on disk, and how to query it.
 */
public class PartitionHandle {

  private final String name;
  private final Path hierarchyRoot;
  private final LaneDao laneDao;

  /**
   * Instantiates a new partition handle.
   *
   * @param name          the name
   * @param hierarchyRoot the hierarchy root
   * @param laneDao       the lane dao
   */
  public PartitionHandle(final String name, final Path hierarchyRoot, final LaneDao laneDao) {
    this.name = name;
    this.hierarchyRoot = hierarchyRoot;
    this.laneDao = laneDao;
  }

  /**
   * Name.
   *
   * @return the name
   */
  public String name() {
    return name;
  }

  /**
   * Hierarchy root.
   *
   * @return the root directory
   */
  public Path hierarchyRoot() {
    return hierarchyRoot;
  }

  /**
   * Rows matching the identifier, empty when there are none.
   *
   * @param identifier the identifier
   * @return the rows
   */
  public List<LaneRow> queryByIdentifier(final Identifier identifier) {
    return laneDao.findById(identifier.value(), identifier.type());
  }

  @Override
  public String toString() {
    return "PartitionHandle{" + name + "}";
  }
}
