package io.github.pathfind.lane.role;

import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.FileRef;
import io.github.pathfind.model.LaneRow;
import java.util.List;
import java.util.Set;

/**
 * Adapts lanes to one kind of search: which files exist, where they live, and what goes into the
 * stats report. Chosen once per run from the calling command.
 */
public interface LaneRole {

  /**
   * Name used in the configuration's laneRoles mapping.
   *
   * @return the name
   */
  String name();

  /**
   * File categories this role knows how to find.
   *
   * @return the categories
   */
  Set<FileCategory> supportedCategories();

  /**
   * Category collected for archives when no file type was requested.
   *
   * @return the category
   */
  FileCategory defaultCategory();

  /**
   * Check that lanes can be built from this row.
   *
   * @param row the row
   * @throws io.github.pathfind.exception.AdaptationException if they can't
   */
  void checkApplicable(LaneRow row);

  /**
   * Find the lane's files of a category.
   *
   * @param lane     the lane
   * @param category the category
   * @return the files, possibly empty
   */
  List<FileRef> findFiles(Lane lane, FileCategory category);

  /**
   * Column names for the stats report.
   *
   * @return the header
   */
  List<String> statsHeader();

  /**
   * Stats values for one lane; same length as {@link #statsHeader()}.
   *
   * @param lane the lane
   * @return the row
   */
  List<String> statsRow(Lane lane);
}
