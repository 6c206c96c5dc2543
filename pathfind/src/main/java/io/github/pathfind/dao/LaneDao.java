package io.github.pathfind.dao;

import io.github.pathfind.model.IdType;
import io.github.pathfind.model.LaneRow;
import java.util.List;
import java.util.Locale;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

/**
 * Lane lookups against the latest_lane table. Every query orders by lane name then id, so the
 * same data always comes back in the same order.
 */
@RegisterRowMapper(LaneRowMapper.class)
public interface LaneDao {

  /**
   * The constant COLUMNS.
   */
  String COLUMNS = "lane_id, lane_name, qc_status, hierarchy_name, study_id, study_name, sample_name, "
      + "sample_accession, library_name, species_name, cycles, read_count, base_count, paired";

  /**
   * The LIKE escape character used in all patterns.
   */
  char LIKE_ESCAPE = '!';

  /**
   * Find lanes by an identifier of the given type.
   *
   * @param id   the identifier
   * @param type the type
   * @return matching rows, empty when nothing matches
   */
  default List<LaneRow> findById(final String id, final IdType type) {
    return switch (type) {
      case LANE -> findByLane(id, escapeLike(id) + "#%");
      case SAMPLE -> findBySample(id);
      case LIBRARY -> findByLibrary(id);
      case STUDY -> findByStudy(id);
      case SPECIES -> findBySpecies("%" + escapeLike(id.toLowerCase(Locale.ROOT)) + "%");
      case FILE -> throw new IllegalArgumentException("IDs of type 'file' must be expanded before searching");
    };
  }

  /**
   * Lanes named exactly {@code id}, or tagged lanes of that run lane, e.g. 5477_6#1 for 5477_6.
   *
   * @param id            the lane name
   * @param taggedPattern LIKE pattern for the tagged lanes
   * @return the rows
   */
  @SqlQuery("SELECT " + COLUMNS + " FROM latest_lane"
      + " WHERE lane_name = :id OR lane_name LIKE :tagged ESCAPE '!'"
      + " ORDER BY lane_name, lane_id")
  List<LaneRow> findByLane(@Bind("id") String id, @Bind("tagged") String taggedPattern);

  /**
   * Lanes from a sample, by name or accession.
   *
   * @param id the sample
   * @return the rows
   */
  @SqlQuery("SELECT " + COLUMNS + " FROM latest_lane"
      + " WHERE sample_name = :id OR sample_accession = :id"
      + " ORDER BY lane_name, lane_id")
  List<LaneRow> findBySample(@Bind("id") String id);

  /**
   * Lanes from a library.
   *
   * @param id the library name
   * @return the rows
   */
  @SqlQuery("SELECT " + COLUMNS + " FROM latest_lane"
      + " WHERE library_name = :id"
      + " ORDER BY lane_name, lane_id")
  List<LaneRow> findByLibrary(@Bind("id") String id);

  /**
   * Lanes from a study, by id or name.
   *
   * @param id the study
   * @return the rows
   */
  @SqlQuery("SELECT " + COLUMNS + " FROM latest_lane"
      + " WHERE study_id = :id OR study_name = :id"
      + " ORDER BY lane_name, lane_id")
  List<LaneRow> findByStudy(@Bind("id") String id);

  /**
   * Lanes whose species name contains the pattern, ignoring case.
   *
   * @param pattern lower case LIKE pattern
   * @return the rows
   */
  @SqlQuery("SELECT " + COLUMNS + " FROM latest_lane"
      + " WHERE LOWER(species_name) LIKE :pattern ESCAPE '!'"
      + " ORDER BY lane_name, lane_id")
  List<LaneRow> findBySpecies(@Bind("pattern") String pattern);

  /**
   * Escape LIKE wildcards; lane names are full of underscores.
   *
   * @param value the literal value
   * @return the escaped value
   */
  static String escapeLike(final String value) {
    final StringBuilder builder = new StringBuilder(value.length() + 4);
    for (final char c : value.toCharArray()) {
      if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
        builder.append(LIKE_ESCAPE);
      }
      builder.append(c);
    }
    return builder.toString();
  }
}
