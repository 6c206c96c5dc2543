package io.github.pathfind.cli.archive;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zip archives.
 */
public class ZipArchiveBuilder extends BaseArchiveBuilder {

  @Override
  protected ArchiveSink openSink(final OutputStream out) {
    final ZipOutputStream zip = new ZipOutputStream(out);
    return new ArchiveSink() {
      @Override
      public void add(final String memberName, final Path file) throws IOException {
        final ZipEntry entry = new ZipEntry(memberName);
        entry.setTime(Files.getLastModifiedTime(file).toMillis());
        zip.putNextEntry(entry);
        Files.copy(file, zip);
        zip.closeEntry();
      }

      @Override
      public void finish() throws IOException {
        zip.finish();
      }

      @Override
      public void close() throws IOException {
        zip.close();
      }
    };
  }

  @Override
  protected String formatName() {
    return "zip";
  }
}
