package io.github.pathfind.cli.archive;

import io.github.pathfind.exception.FilesystemException;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Member naming shared by the archive encodings. Each file goes in as {@code <group>/<name>};
 * when that name is already taken the file keeps its own path instead.
 */
public abstract class BaseArchiveBuilder implements ArchiveBuilder {

  private static final Logger log = LoggerFactory.getLogger(BaseArchiveBuilder.class);

  /**
   * Writes members in one encoding.
   */
  protected interface ArchiveSink extends Closeable {

    /**
     * Add a file.
     *
     * @param memberName name inside the archive
     * @param file       the file
     * @throws IOException if the file can't be read
     */
    void add(String memberName, Path file) throws IOException;

    /**
     * Write the archive trailer.
     *
     * @throws IOException on failure
     */
    void finish() throws IOException;
  }

  /**
   * Start an archive on the stream.
   *
   * @param out the stream
   * @return the sink
   * @throws IOException on failure
   */
  protected abstract ArchiveSink openSink(OutputStream out) throws IOException;

  /**
   * Encoding name for messages.
   *
   * @return the name
   */
  protected abstract String formatName();

  @Override
  public BuiltArchive build(final List<Path> files, final ArchiveOptions options) {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final List<String> memberNames = new ArrayList<>();
    final Set<String> taken = new HashSet<>();
    final Set<Path> sources = new HashSet<>();
    try (ArchiveSink sink = openSink(bytes)) {
      for (final Path file : files) {
        final Path source = file.toAbsolutePath().normalize();
        if (!sources.add(source)) {
          log.warn("{} is already in the archive; not adding it again", source);
          continue;
        }
        final String memberName = memberName(source, options, taken);
        if (memberName == null) {
          continue;
        }
        try {
          sink.add(memberName, source);
        } catch (IOException e) {
          throw new FilesystemException("Couldn't add file to " + formatName() + " archive", source, e);
        }
        taken.add(memberName);
        memberNames.add(memberName);
      }
      sink.finish();
    } catch (IOException e) {
      throw new UncheckedIOException("Couldn't finish " + formatName() + " archive", e);
    }
    log.debug("built {} archive with {} members, {} bytes", formatName(), memberNames.size(), bytes.size());
    return ImmutableBuiltArchive.builder()
        .memberNames(memberNames)
        .bytes(bytes.toByteArray())
        .build();
  }

  private String memberName(final Path source, final ArchiveOptions options, final Set<String> taken) {
    final String renamed = ArchivePathRewriter.memberName(
        options.groupDirectoryName(), source, options.renameHashes());
    if (!taken.contains(renamed)) {
      return renamed;
    }
    final String original = ArchivePathRewriter.originalName(source);
    if (taken.contains(original)) {
      log.warn("Couldn't add {}; both {} and {} are already in the archive", source, renamed, original);
      return null;
    }
    log.warn("Couldn't rename {} to {} in archive, name already used; keeping {}", source, renamed, original);
    return original;
  }
}
