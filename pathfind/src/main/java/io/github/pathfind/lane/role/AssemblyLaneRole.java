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
 * De novo assemblies, kept in the lane's assembly directory.
 */
public class AssemblyLaneRole extends BaseLaneRole {

  /**
   * The constant NAME.
   */
  public static final String NAME = "assembly";

  private static final List<String> HEADER = List.of(
      "Study ID", "Sample", "Lane Name", "Species", "Contig Files");

  private static final Map<FileCategory, Predicate<String>> MATCHERS = Map.of(
      FileCategory.CONTIGS, n -> n.contains("contigs") && n.endsWith(".fa"),
      FileCategory.SCAFFOLDS, n -> n.contains("scaffolds") && n.endsWith(".fa"));

  /**
   * Instantiates a new assembly lane role.
   *
   * @param fileSystemHelper the file system helper
   */
  @Inject
  public AssemblyLaneRole(final FileSystemHelper fileSystemHelper) {
    super(fileSystemHelper);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public FileCategory defaultCategory() {
    return FileCategory.CONTIGS;
  }

  @Override
  protected Map<FileCategory, Predicate<String>> fileMatchers() {
    return MATCHERS;
  }

  @Override
  protected Path searchDirectory(final Lane lane) {
    return lane.directory().resolve("assembly");
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
