package io.github.pathfind.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * One row of the latest_lane table in a tracking database.
 */
@Value.Immutable
public interface LaneRow {

  /**
   * Lane id.
   *
   * @return the id
   */
  long id();

  /**
   * Lane name, e.g. 5477_6#1.
   *
   * @return the name
   */
  String name();

  /**
   * QC status as stored, if any.
   *
   * @return the qc status
   */
  Optional<String> qcStatus();

  /**
   * Lane directory relative to the partition's hierarchy root.
   *
   * @return the hierarchy name
   */
  Optional<String> hierarchyName();

  /**
   * Study id.
   *
   * @return the study id
   */
  Optional<String> studyId();

  /**
   * Study name.
   *
   * @return the study name
   */
  Optional<String> studyName();

  /**
   * Sample name.
   *
   * @return the sample name
   */
  Optional<String> sampleName();

  /**
   * Sample accession.
   *
   * @return the sample accession
   */
  Optional<String> sampleAccession();

  /**
   * Library name.
   *
   * @return the library name
   */
  Optional<String> libraryName();

  /**
   * Species name.
   *
   * @return the species name
   */
  Optional<String> speciesName();

  /**
   * Read length.
   *
   * @return the cycles
   */
  @Value.Default
  default int cycles() {
    return 0;
  }

  /**
   * Read count.
   *
   * @return the read count
   */
  @Value.Default
  default long readCount() {
    return 0L;
  }

  /**
   * Base count.
   *
   * @return the base count
   */
  @Value.Default
  default long baseCount() {
    return 0L;
  }

  /**
   * Paired end run.
   *
   * @return true if paired
   */
  @Value.Default
  default boolean paired() {
    return false;
  }
}
