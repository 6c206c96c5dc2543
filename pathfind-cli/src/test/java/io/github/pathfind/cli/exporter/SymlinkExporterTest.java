package io.github.pathfind.cli.exporter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.pathfind.cli.LaneFixtures;
import io.github.pathfind.cli.model.ExportAction;
import io.github.pathfind.cli.model.ImmutableExportRequest;
import io.github.pathfind.cli.model.OutputTarget;
import io.github.pathfind.exception.FilesystemException;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.progress.NoOpProgressReporter;
import io.github.pathfind.progress.ProgressReporter;
import io.github.pathfind.progress.ProgressTracker;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SymlinkExporterTest {

  @TempDir Path tempDir;

  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

  private final SymlinkExporter symlinkExporter = new SymlinkExporter(new FileSystemHelper(),
      new NoOpProgressReporter(), new PrintStream(stderr, true, StandardCharsets.UTF_8));

  @Test
  void export_createsDestinationAndLinksFiles() throws Exception {
    // Given
    final Lane lane = LaneFixtures.dataLane(tempDir.resolve("data"), "5477_6#1", "5477_6#1_1.fastq.gz",
        "5477_6#1_2.fastq.gz");
    lane.discoverFiles(FileCategory.FASTQ);
    final Path destination = tempDir.resolve("out/links");

    // When
    final Path linked = symlinkExporter.export(List.of(lane), ImmutableExportRequest.builder()
        .action(ExportAction.SYMLINK)
        .target(OutputTarget.named(destination))
        .renameHashes(true)
        .groupName("5477_6_1")
        .build());

    // Then
    assertThat(linked).isEqualTo(destination);
    assertThat(Files.isSymbolicLink(destination.resolve("5477_6_1_1.fastq.gz"))).isTrue();
    assertThat(Files.isSymbolicLink(destination.resolve("5477_6_1_2.fastq.gz"))).isTrue();
    assertThat(stderr.toString(StandardCharsets.UTF_8)).isEqualTo("Creating links in '" + destination + "'" + System.lineSeparator());
  }

  @Test
  void export_withoutDirectory_linksIntoDefaultDirectory() throws Exception {
    // Given
    final Lane lane = LaneFixtures.dataLane(tempDir.resolve("data"), "5477_6#1", "5477_6#1_1.fastq.gz");
    final Path workingDirectory = Files.createDirectories(tempDir.resolve("cwd"));

    // When
    final Path linked = symlinkExporter.export(List.of(lane), ImmutableExportRequest.builder()
        .action(ExportAction.SYMLINK)
        .target(OutputTarget.defaultName())
        .groupName("5477_6_1")
        .workingDirectory(workingDirectory)
        .build());

    // Then
    assertThat(linked).isEqualTo(workingDirectory.resolve("pathfind_5477_6_1"));
    assertThat(linked.resolve("5477_6#1")).isSymbolicLink();
    assertThat(Files.readSymbolicLink(linked.resolve("5477_6#1"))).isEqualTo(lane.directory());
  }

  @Test
  void export_ticksOncePerLane() throws Exception {
    // Given
    final ProgressReporter progressReporter = mock(ProgressReporter.class);
    final ProgressTracker progressTracker = mock(ProgressTracker.class);
    when(progressReporter.start("linking", 2L)).thenReturn(progressTracker);
    final SymlinkExporter exporter = new SymlinkExporter(new FileSystemHelper(), progressReporter,
        new PrintStream(stderr, true, StandardCharsets.UTF_8));
    final Path data = tempDir.resolve("data");
    final List<Lane> lanes = List.of(LaneFixtures.dataLane(data, "5477_6#1"), LaneFixtures.dataLane(data, "5477_6#2"));

    // When
    exporter.export(lanes, ImmutableExportRequest.builder()
        .action(ExportAction.SYMLINK)
        .target(OutputTarget.named(tempDir.resolve("links")))
        .groupName("5477_6")
        .build());

    // Then
    verify(progressTracker, times(2)).tick();
    verify(progressTracker).close();
  }

  @Test
  void export_destinationIsAFile_throws() throws Exception {
    // Given
    final Lane lane = LaneFixtures.dataLane(tempDir.resolve("data"), "5477_6#1");
    final Path destination = Files.writeString(tempDir.resolve("taken"), "not a directory");

    // When / Then
    assertThatThrownBy(() -> symlinkExporter.export(List.of(lane), ImmutableExportRequest.builder()
        .action(ExportAction.SYMLINK)
        .target(OutputTarget.named(destination))
        .groupName("5477_6_1")
        .build()))
        .isInstanceOf(FilesystemException.class)
        .hasMessageContaining("taken");
  }
}
