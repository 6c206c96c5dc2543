package io.github.pathfind.lane.role;

import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.LaneRow;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import javax.inject.Inject;

/**
 * Annotation output, kept in the lane's annotation directory.
 */
public class AnnotationLaneRole extends BaseLaneRole {

  /**
   * The constant NAME.
   */
  public static final String NAME = "annotation";

  private static final List<String> HEADER = List.of(
      "Study ID", "Sample", "Lane Name", "Species", "GFF Files");

  private static final Map<FileCategory, Predicate<String>> MATCHERS = Map.of(
      FileCategory.GFF, n -> n.endsWith(".gff"),
      FileCategory.FAA, n -> n.endsWith(".faa"),
      FileCategory.FFN, n -> n.endsWith(".ffn"));

  /**
   * Instantiates a new annotation lane role.
   *
   * @param fileSystemHelper the file system helper
   */
  @Inject
  public AnnotationLaneRole(final FileSystemHelper fileSystemHelper) {
    super(fileSystemHelper);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public FileCategory defaultCategory() {
    return FileCategory.GFF;
  }

  @Override
  protected Map<FileCategory, Predicate<String>> fileMatchers() {
    return MATCHERS;
  }

  @Override
  protected Path searchDirectory(final Lane lane) {
    return lane.directory().resolve("annotation");
  }

  @Override
  public List<String> statsHeader() {
    return HEADER;
  }

  @Override
  public List<String> statsRow(final Lane lane) {
    final LaneRow row = lane.row();
    return List.of(
        orEmpty(row.studyId()),
        orEmpty(row.sampleName()),
        row.name(),
        orEmpty(row.speciesName()),
        String.valueOf(countDefaultFiles(lane)));
  }
}
