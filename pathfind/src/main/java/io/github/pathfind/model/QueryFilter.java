package io.github.pathfind.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Optional restrictions applied to the lanes found by a search.
 */
@Value.Immutable
public interface QueryFilter {

  /**
   * Required QC status. Lanes without a recorded status are never excluded.
   *
   * @return the qc status
   */
  Optional<QcStatus> qcStatus();

  /**
   * Required file category. Lanes without files of this category are excluded.
   *
   * @return the file category
   */
  Optional<FileCategory> fileCategory();

  /**
   * A filter that lets everything through.
   *
   * @return the query filter
   */
  static QueryFilter none() {
    return ImmutableQueryFilter.builder().build();
  }
}
