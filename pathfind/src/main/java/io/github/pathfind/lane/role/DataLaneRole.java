package io.github.pathfind.lane.role;

import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.model.LaneRow;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import javax.inject.Inject;

/**
 * Raw sequencing data: reads and alignments sitting in the lane directory.
 */
public class DataLaneRole extends BaseLaneRole {

  /**
   * The constant NAME.
   */
  public static final String NAME = "data";

  private static final String CORRECTED_SUFFIX = ".corrected.fastq.gz";

  private static final List<String> HEADER = List.of(
      "Study ID", "Sample", "Lane Name", "Cycles", "Reads", "Bases", "Paired", "QC Status");

  private final Map<FileCategory, Predicate<String>> matchers;

  /**
   * Instantiates a new data lane role.
   *
   * @param fileSystemHelper the file system helper
   */
  @Inject
  public DataLaneRole(final FileSystemHelper fileSystemHelper) {
    super(fileSystemHelper);
    final Map<FileCategory, Predicate<String>> map = new LinkedHashMap<>();
    map.put(FileCategory.FASTQ, n -> n.endsWith(".fastq.gz") && !n.endsWith(CORRECTED_SUFFIX));
    map.put(FileCategory.BAM, n -> n.endsWith(".bam"));
    map.put(FileCategory.PACBIO, n -> n.endsWith(".h5"));
    map.put(FileCategory.CORRECTED, n -> n.endsWith(CORRECTED_SUFFIX));
    this.matchers = Map.copyOf(map);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public FileCategory defaultCategory() {
    return FileCategory.FASTQ;
  }

  @Override
  protected Map<FileCategory, Predicate<String>> fileMatchers() {
    return matchers;
  }

  @Override
  protected Path searchDirectory(final Lane lane) {
    return lane.directory();
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
        String.valueOf(row.cycles()),
        String.valueOf(row.readCount()),
        String.valueOf(row.baseCount()),
        row.paired() ? "yes" : "no",
        orEmpty(row.qcStatus()));
  }
}
