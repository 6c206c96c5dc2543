package io.github.pathfind.dao;

import io.github.pathfind.model.ImmutableLaneRow;
import io.github.pathfind.model.LaneRow;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps a latest_lane row to a {@link LaneRow}.
 */
public class LaneRowMapper implements RowMapper<LaneRow> {

  @Override
  public LaneRow map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    return ImmutableLaneRow.builder()
        .id(rs.getLong("lane_id"))
        .name(rs.getString("lane_name"))
        .qcStatus(optionalString(rs, "qc_status"))
        .hierarchyName(optionalString(rs, "hierarchy_name"))
        .studyId(optionalString(rs, "study_id"))
        .studyName(optionalString(rs, "study_name"))
        .sampleName(optionalString(rs, "sample_name"))
        .sampleAccession(optionalString(rs, "sample_accession"))
        .libraryName(optionalString(rs, "library_name"))
        .speciesName(optionalString(rs, "species_name"))
        .cycles(rs.getInt("cycles"))
        .readCount(rs.getLong("read_count"))
        .baseCount(rs.getLong("base_count"))
        .paired(rs.getBoolean("paired"))
        .build();
  }

  private Optional<String> optionalString(final ResultSet rs, final String column) throws SQLException {
    final String value = rs.getString(column);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value);
  }
}
