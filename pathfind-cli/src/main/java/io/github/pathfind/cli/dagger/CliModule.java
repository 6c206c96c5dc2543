package io.github.pathfind.cli.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.pathfind.cli.archive.ChunkedWriter;
import io.github.pathfind.cli.archive.TarArchiveBuilder;
import io.github.pathfind.cli.archive.ZipArchiveBuilder;
import io.github.pathfind.cli.exporter.ArchiveExporter;
import io.github.pathfind.cli.exporter.LaneExporter;
import io.github.pathfind.cli.exporter.PathListExporter;
import io.github.pathfind.cli.exporter.StatsCsvExporter;
import io.github.pathfind.cli.exporter.SymlinkExporter;
import io.github.pathfind.dagger.CommonModule;
import io.github.pathfind.helper.FileSystemHelper;
import io.github.pathfind.progress.ProgressReporter;
import java.io.PrintStream;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Provide chunked writer.
   *
   * @param progressReporter the progress reporter
   * @return the chunked writer
   */
  @Provides
  @Singleton
  public ChunkedWriter chunkedWriter(final ProgressReporter progressReporter) {
    return new ChunkedWriter(progressReporter, ChunkedWriter.DEFAULT_CHUNKS);
  }

  /**
   * Provide tar archive builder.
   *
   * @return the tar archive builder
   */
  @Provides
  @Singleton
  public TarArchiveBuilder tarArchiveBuilder() {
    return new TarArchiveBuilder();
  }

  /**
   * Provide zip archive builder.
   *
   * @return the zip archive builder
   */
  @Provides
  @Singleton
  public ZipArchiveBuilder zipArchiveBuilder() {
    return new ZipArchiveBuilder();
  }

  /**
   * Provide stats CSV exporter.
   *
   * @param chunkedWriter the chunked writer
   * @return the stats CSV exporter
   */
  @Provides
  @Singleton
  public StatsCsvExporter statsCsvExporter(final ChunkedWriter chunkedWriter) {
    return new StatsCsvExporter(chunkedWriter);
  }

  /**
   * Provide archive exporter.
   *
   * @param tarArchiveBuilder the tar archive builder
   * @param zipArchiveBuilder the zip archive builder
   * @param chunkedWriter     the chunked writer
   * @param statsCsvExporter  the stats CSV exporter
   * @param fileSystemHelper  the file system helper
   * @param stdout            standard output
   * @param stderr            standard error
   * @return the archive exporter
   */
  @Provides
  @Singleton
  public ArchiveExporter archiveExporter(
      final TarArchiveBuilder tarArchiveBuilder,
      final ZipArchiveBuilder zipArchiveBuilder,
      final ChunkedWriter chunkedWriter,
      final StatsCsvExporter statsCsvExporter,
      final FileSystemHelper fileSystemHelper,
      @Named(CommonModule.STDOUT) final PrintStream stdout,
      @Named(CommonModule.STDERR) final PrintStream stderr) {
    return new ArchiveExporter(
        tarArchiveBuilder,
        zipArchiveBuilder,
        chunkedWriter,
        statsCsvExporter,
        fileSystemHelper,
        stdout,
        stderr);
  }

  /**
   * Provide lane exporter.
   *
   * @param pathListExporter the path list exporter
   * @param symlinkExporter  the symlink exporter
   * @param archiveExporter  the archive exporter
   * @param statsCsvExporter the stats CSV exporter
   * @return the lane exporter
   */
  @Provides
  @Singleton
  public LaneExporter laneExporter(
      final PathListExporter pathListExporter,
      final SymlinkExporter symlinkExporter,
      final ArchiveExporter archiveExporter,
      final StatsCsvExporter statsCsvExporter) {
    return new LaneExporter(pathListExporter, symlinkExporter, archiveExporter, statsCsvExporter);
  }
}
