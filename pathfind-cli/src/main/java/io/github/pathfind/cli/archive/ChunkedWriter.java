package io.github.pathfind.cli.archive;

import io.github.pathfind.exception.FilesystemException;
import io.github.pathfind.progress.ProgressReporter;
import io.github.pathfind.progress.ProgressTracker;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gzips and writes byte payloads a chunk at a time, ticking progress after each chunk. The chunk
 * count only affects progress; the last chunk takes whatever is left over.
 */
public class ChunkedWriter {

  /**
   * The constant DEFAULT_CHUNKS.
   */
  public static final int DEFAULT_CHUNKS = 100;

  private static final Logger log = LoggerFactory.getLogger(ChunkedWriter.class);

  private final ProgressReporter progressReporter;
  private final int chunks;

  /**
   * Instantiates a new chunked writer.
   *
   * @param progressReporter the progress reporter
   * @param chunks           the number of chunks
   */
  public ChunkedWriter(final ProgressReporter progressReporter, final int chunks) {
    if (chunks < 1) {
      throw new IllegalArgumentException("chunks must be at least 1: " + chunks);
    }
    this.progressReporter = progressReporter;
    this.chunks = chunks;
  }

  /**
   * Gzip the data.
   *
   * @param data the data
   * @return the compressed data
   */
  public byte[] compress(final byte[] data) {
    final ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
      writeChunks(data, gzip, "compressing");
    } catch (IOException e) {
      throw new UncheckedIOException("Couldn't compress archive", e);
    }
    log.debug("compressed {} bytes to {}", data.length, compressed.size());
    return compressed.toByteArray();
  }

  /**
   * Write the data to a file, replacing it if it exists. Nothing is left at {@code path} if the
   * write fails.
   *
   * @param data the data
   * @param path the path
   * @throws FilesystemException if the file can't be opened or written
   */
  public void writeFile(final byte[] data, final Path path) {
    boolean opened = false;
    try (OutputStream out = Files.newOutputStream(path)) {
      opened = true;
      writeChunks(data, out, "writing");
    } catch (IOException e) {
      if (opened) {
        removePartialFile(path);
      }
      throw new FilesystemException("Couldn't write file", path, e);
    } catch (RuntimeException e) {
      if (opened) {
        removePartialFile(path);
      }
      throw e;
    }
    log.debug("wrote {} bytes to {}", data.length, path);
  }

  private void writeChunks(final byte[] data, final OutputStream out, final String step) throws IOException {
    // payloads shorter than the chunk count go out a byte at a time
    final int chunkCount = Math.min(chunks, data.length);
    try (ProgressTracker progress = progressReporter.start(step, chunkCount)) {
      if (chunkCount == 0) {
        return;
      }
      final int chunkSize = data.length / chunkCount;
      for (int i = 0; i < chunkCount; i++) {
        final int offset = i * chunkSize;
        final int length = i == chunkCount - 1 ? data.length - offset : chunkSize;
        out.write(data, offset, length);
        progress.tick();
      }
    }
  }

  private void removePartialFile(final Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Couldn't remove partially written file {}: {}", path, e.getMessage());
    }
  }
}
