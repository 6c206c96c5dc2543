package io.github.pathfind.model;

import java.util.Locale;

/**
 * Categories of data file that can be found for a lane.
 */
public enum FileCategory {
  BAM,
  FASTQ,
  PACBIO,
  CORRECTED,
  GFF,
  FAA,
  FFN,
  CONTIGS,
  SCAFFOLDS;

  /**
   * Lower case name, as typed on the command line.
   *
   * @return the value
   */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
