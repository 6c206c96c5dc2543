package io.github.pathfind.cli.exporter;

import io.github.pathfind.cli.archive.ArchiveBuilder;
import io.github.pathfind.cli.archive.BuiltArchive;
import io.github.pathfind.cli.archive.ChunkedWriter;
import io.github.pathfind.cli.archive.ImmutableArchiveOptions;
import io.github.pathfind.cli.format.ArchiveFormat;
import io.github.pathfind.cli.model.ExportRequest;
import io.github.pathfind.exception.FilesystemException;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.lane.Lane;
import io.github.pathfind.model.FileRef;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exporter for tar, tar.gz and zip archives of lane files. Each archive also carries a
 * {@code stats.csv} describing its lanes.
 */
public class ArchiveExporter {

  /**
   * Name of the stats file inside archives.
   */
  public static final String STATS_FILE_NAME = "stats.csv";

  private static final Logger log = LoggerFactory.getLogger(ArchiveExporter.class);

  private final ArchiveBuilder tarArchiveBuilder;
  private final ArchiveBuilder zipArchiveBuilder;
  private final ChunkedWriter chunkedWriter;
  private final StatsCsvExporter statsCsvExporter;
  private final FileSystemHelper fileSystemHelper;
  private final PrintStream stdout;
  private final PrintStream stderr;

  /**
   * Constructor.
   *
   * @param tarArchiveBuilder the tar archive builder
   * @param zipArchiveBuilder the zip archive builder
   * @param chunkedWriter     the chunked writer
   * @param statsCsvExporter  the stats exporter
   * @param fileSystemHelper  the file system helper
   * @param stdout            where the member list goes
   * @param stderr            where the archive name is reported
   */
  public ArchiveExporter(final ArchiveBuilder tarArchiveBuilder,
                         final ArchiveBuilder zipArchiveBuilder,
                         final ChunkedWriter chunkedWriter,
                         final StatsCsvExporter statsCsvExporter,
                         final FileSystemHelper fileSystemHelper,
                         final PrintStream stdout,
                         final PrintStream stderr) {
    this.tarArchiveBuilder = tarArchiveBuilder;
    this.zipArchiveBuilder = zipArchiveBuilder;
    this.chunkedWriter = chunkedWriter;
    this.statsCsvExporter = statsCsvExporter;
    this.fileSystemHelper = fileSystemHelper;
    this.stdout = stdout;
    this.stderr = stderr;
  }

  /**
   * Archive the lanes' files. Without a requested file type each lane contributes the files of
   * its role's default category.
   *
   * @param lanes   the lanes
   * @param request the request
   * @return the archive written
   */
  public Path export(final List<Lane> lanes, final ExportRequest request) {
    final ArchiveFormat format = request.archiveFormat();
    final Path archive = request.outputPath("pathfind_" + request.groupName() + format.extension());
    stderr.println("Archiving lane data to '" + archive + "'");

    final List<Path> files = new ArrayList<>();
    for (final Lane lane : lanes) {
      lane.discoverFiles(request.fileCategory().orElse(lane.role().defaultCategory()));
      lane.files().stream().map(FileRef::absolutePath).forEach(files::add);
    }

    final Path statsDirectory = createTempDirectory();
    try {
      final Path statsFile = statsDirectory.resolve(STATS_FILE_NAME);
      statsCsvExporter.writeTo(lanes, request.separator(), statsFile);
      files.add(statsFile);

      final ArchiveBuilder builder = format == ArchiveFormat.ZIP ? zipArchiveBuilder : tarArchiveBuilder;
      final BuiltArchive built = builder.build(files, ImmutableArchiveOptions.builder()
          .groupDirectoryName(request.groupName())
          .renameHashes(request.renameHashes())
          .build());
      final byte[] contents = format == ArchiveFormat.TAR_GZ
          ? chunkedWriter.compress(built.bytes())
          : built.bytes();

      final Path parent = archive.toAbsolutePath().getParent();
      if (parent != null) {
        fileSystemHelper.ensureDirectory(parent);
      }
      chunkedWriter.writeFile(contents, archive);
      log.info("Wrote {} members to {}", built.memberNames().size(), archive);
      built.memberNames().forEach(stdout::println);
      stdout.flush();
      return archive;
    } finally {
      removeTempDirectory(statsDirectory);
    }
  }

  private Path createTempDirectory() {
    final Path tempRoot = Path.of(System.getProperty("java.io.tmpdir"));
    try {
      return Files.createTempDirectory(tempRoot, "pathfind");
    } catch (IOException e) {
      throw new FilesystemException("Couldn't make temporary directory", tempRoot, e);
    }
  }

  private void removeTempDirectory(final Path directory) {
    try {
      Files.deleteIfExists(directory.resolve(STATS_FILE_NAME));
      Files.deleteIfExists(directory);
    } catch (IOException e) {
      log.warn("Couldn't remove temporary directory {}: {}", directory, e.getMessage());
    }
  }
}
