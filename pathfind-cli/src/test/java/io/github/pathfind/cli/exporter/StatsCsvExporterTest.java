package io.github.pathfind.cli.exporter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.github.pathfind.cli.LaneFixtures;
import io.github.pathfind.cli.archive.ChunkedWriter;
import io.github.pathfind.cli.model.ImmutableExportRequest;
import io.github.pathfind.cli.model.ExportAction;
import io.github.pathfind.cli.model.OutputTarget;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.lane.role.LaneRole;
import io.github.pathfind.progress.NoOpProgressReporter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StatsCsvExporterTest {

  @TempDir Path tempDir;

  @Mock private LaneRole brokenRole;

  private StatsCsvExporter statsCsvExporter;

  @BeforeEach
  void setUp() {
    statsCsvExporter = new StatsCsvExporter(new ChunkedWriter(new NoOpProgressReporter(), ChunkedWriter.DEFAULT_CHUNKS));
  }

  @Test
  void toCsv_hasHeaderAndOneRowPerLane() throws Exception {
    // Given
    final List<Lane> lanes = List.of(
        LaneFixtures.dataLane(tempDir, "5477_6#1"),
        LaneFixtures.dataLane(tempDir, "5477_6#2"),
        LaneFixtures.dataLane(tempDir, "5477_6#3"));

    // When
    final String csv = new String(statsCsvExporter.toCsv(lanes, ','), StandardCharsets.UTF_8);

    // Then
    final List<CSVRecord> records = CSVParser.parse(csv, CSVFormat.DEFAULT).getRecords();
    assertThat(records).hasSize(4);
    assertThat(records).allSatisfy(r -> assertThat(r.size()).isEqualTo(8));
    assertThat(records.get(0).get(0)).isEqualTo("Study ID");
    assertThat(records.get(2).get(2)).isEqualTo("5477_6#2");
    assertThat(csv).startsWith("Study ID,Sample,Lane Name,").doesNotContain("\r");
  }

  @Test
  void toCsv_usesSeparator() throws Exception {
    // Given
    final List<Lane> lanes = List.of(LaneFixtures.dataLane(tempDir, "5477_6#1"));

    // When
    final String csv = new String(statsCsvExporter.toCsv(lanes, '\t'), StandardCharsets.UTF_8);

    // Then
    assertThat(csv.lines()).containsExactly(
        "Study ID\tSample\tLane Name\tCycles\tReads\tBases\tPaired\tQC Status",
        "607\tSAMPLE_5477_6#1\t5477_6#1\t100\t1000\t100000\tyes\tpassed");
  }

  @Test
  void toCsv_noLanes_isEmpty() {
    assertThat(statsCsvExporter.toCsv(List.of(), ',')).isEmpty();
  }

  @Test
  void toCsv_rowArityMismatch_throws() throws Exception {
    // Given
    when(brokenRole.statsHeader()).thenReturn(List.of("Lane Name", "Reads"));
    when(brokenRole.statsRow(any())).thenReturn(List.of("5477_6#1"));
    final Lane lane = LaneFixtures.lane(tempDir, "5477_6#1", brokenRole);

    // When / Then
    assertThatThrownBy(() -> statsCsvExporter.toCsv(List.of(lane), ','))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("5477_6#1");
  }

  @Test
  void export_namedTarget_writesFile() throws Exception {
    // Given
    final List<Lane> lanes = List.of(LaneFixtures.dataLane(tempDir, "5477_6#1"));
    final Path target = tempDir.resolve("my-stats.csv");

    // When
    final Path written = statsCsvExporter.export(lanes, ImmutableExportRequest.builder()
        .action(ExportAction.STATS)
        .target(OutputTarget.named(target))
        .groupName("5477_6_1")
        .build());

    // Then
    assertThat(written).isEqualTo(target);
    assertThat(Files.readAllLines(target)).hasSize(2);
  }

  @Test
  void export_defaultTarget_writesIdNamedFileInWorkingDirectory() throws Exception {
    // Given
    final List<Lane> lanes = List.of(LaneFixtures.dataLane(tempDir.resolve("data"), "5477_6#1"));
    final Path workingDirectory = Files.createDirectories(tempDir.resolve("cwd"));

    // When
    final Path written = statsCsvExporter.export(lanes, ImmutableExportRequest.builder()
        .action(ExportAction.STATS)
        .target(OutputTarget.defaultName())
        .groupName("5477_6_1")
        .workingDirectory(workingDirectory)
        .build());

    // Then
    assertThat(written).isEqualTo(workingDirectory.resolve("5477_6_1.stats.csv"));
    assertThat(Files.readAllLines(written)).hasSize(2);
  }
}
