package io.github.pathfind.cli.exporter;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.pathfind.cli.LaneFixtures;
import io.github.pathfind.cli.archive.ChunkedWriter;
import io.github.pathfind.cli.archive.TarArchiveBuilder;
import io.github.pathfind.cli.archive.ZipArchiveBuilder;
import io.github.pathfind.cli.format.ArchiveFormat;
import io.github.pathfind.cli.model.ExportAction;
import io.github.pathfind.cli.model.ImmutableExportRequest;
import io.github.pathfind.cli.model.OutputTarget;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileCategory;
import io.github.pathfind.progress.NoOpProgressReporter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ArchiveExporterTest {

  @TempDir Path tempDir;

  private ByteArrayOutputStream stdout;
  private ArchiveExporter archiveExporter;
  private List<Lane> lanes;

  @BeforeEach
  void setUp() throws Exception {
    stdout = new ByteArrayOutputStream();
    final ChunkedWriter chunkedWriter = new ChunkedWriter(new NoOpProgressReporter(), ChunkedWriter.DEFAULT_CHUNKS);
    archiveExporter = new ArchiveExporter(
        new TarArchiveBuilder(),
        new ZipArchiveBuilder(),
        chunkedWriter,
        new StatsCsvExporter(chunkedWriter),
        new FileSystemHelper(),
        new PrintStream(stdout, true, StandardCharsets.UTF_8),
        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    final Path data = tempDir.resolve("data");
    lanes = List.of(
        LaneFixtures.dataLane(data, "5477_6#1", "5477_6#1_1.fastq.gz", "5477_6#1.bam"),
        LaneFixtures.dataLane(data, "5477_6#2", "5477_6#2_1.fastq.gz"));
  }

  @Test
  void export_zip_bundlesDefaultCategoryFilesAndStats() throws Exception {
    // Given
    final Path target = tempDir.resolve("out/lanes.zip");

    // When
    final Path written = archiveExporter.export(lanes, request(ArchiveFormat.ZIP, target, null));

    // Then
    assertThat(written).isEqualTo(target);
    final List<String> expected = List.of(
        "5477_6/5477_6_1_1.fastq.gz", "5477_6/5477_6_2_1.fastq.gz", "5477_6/stats.csv");
    try (InputStream in = Files.newInputStream(target)) {
      assertThat(zipMembers(in)).containsExactlyElementsOf(expected);
    }
    assertThat(stdout.toString(StandardCharsets.UTF_8).lines()).containsExactlyElementsOf(expected);
  }

  @Test
  void export_tarGz_usesRequestedFileType() throws Exception {
    // Given
    final Path target = tempDir.resolve("lanes.tar.gz");

    // When
    archiveExporter.export(lanes, request(ArchiveFormat.TAR_GZ, target, FileCategory.BAM));

    // Then
    try (InputStream in = new GZIPInputStream(Files.newInputStream(target))) {
      assertThat(tarMembers(in)).containsExactly("5477_6/5477_6_1.bam", "5477_6/stats.csv");
    }
  }

  @Test
  void export_tar_isUncompressed() throws Exception {
    // Given
    final Path target = tempDir.resolve("lanes.tar");

    // When
    archiveExporter.export(lanes, request(ArchiveFormat.TAR, target, null));

    // Then
    try (InputStream in = Files.newInputStream(target)) {
      assertThat(tarMembers(in)).hasSize(3);
    }
  }

  @ParameterizedTest
  @CsvSource({
      "TAR_GZ, pathfind_5477_6.tar.gz",
      "TAR, pathfind_5477_6.tar",
      "ZIP, pathfind_5477_6.zip"
  })
  void export_defaultTarget_writesIdNamedArchiveInWorkingDirectory(final ArchiveFormat format,
                                                                   final String expectedName) throws Exception {
    // Given
    final Path workingDirectory = Files.createDirectories(tempDir.resolve("cwd"));

    // When
    final Path written = archiveExporter.export(lanes, ImmutableExportRequest.builder()
        .action(ExportAction.ARCHIVE)
        .target(OutputTarget.defaultName())
        .archiveFormat(format)
        .groupName("5477_6")
        .workingDirectory(workingDirectory)
        .build());

    // Then
    assertThat(written).isEqualTo(workingDirectory.resolve(expectedName));
    assertThat(written).isRegularFile();
    assertThat(stdout.toString(StandardCharsets.UTF_8).lines()).contains("5477_6/stats.csv");
  }

  private static ImmutableExportRequest request(final ArchiveFormat format, final Path target,
                                                final FileCategory category) {
    final ImmutableExportRequest.Builder builder = ImmutableExportRequest.builder()
        .action(ExportAction.ARCHIVE)
        .target(OutputTarget.named(target))
        .archiveFormat(format)
        .renameHashes(true)
        .groupName("5477_6");
    if (category != null) {
      builder.fileCategory(category);
    }
    return builder.build();
  }

  private static List<String> zipMembers(final InputStream in) throws IOException {
    final List<String> names = new ArrayList<>();
    try (ZipInputStream zip = new ZipInputStream(in)) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        names.add(entry.getName());
      }
    }
    return names;
  }

  private static List<String> tarMembers(final InputStream in) throws IOException {
    final List<String> names = new ArrayList<>();
    try (TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        names.add(entry.getName());
      }
    }
    return names;
  }
}
