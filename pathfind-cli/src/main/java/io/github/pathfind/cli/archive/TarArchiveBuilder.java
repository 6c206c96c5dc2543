package io.github.pathfind.cli.archive;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;

/**
 * Tar archives, with GNU long names so deep lane paths survive.
 */
public class TarArchiveBuilder extends BaseArchiveBuilder {

  @Override
  protected ArchiveSink openSink(final OutputStream out) {
    final TarArchiveOutputStream tar = new TarArchiveOutputStream(out);
    tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_GNU);
    tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
    return new ArchiveSink() {
      @Override
      public void add(final String memberName, final Path file) throws IOException {
        final TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), memberName);
        tar.putArchiveEntry(entry);
        Files.copy(file, tar);
        tar.closeArchiveEntry();
      }

      @Override
      public void finish() throws IOException {
        tar.finish();
      }

      @Override
      public void close() throws IOException {
        tar.close();
      }
    };
  }

  @Override
  protected String formatName() {
    return "tar";
  }
}
