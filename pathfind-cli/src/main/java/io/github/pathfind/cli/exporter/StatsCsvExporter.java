package io.github.pathfind.cli.exporter;

import io.github.pathfind.cli.archive.ChunkedWriter;
import io.github.pathfind.cli.model.ExportRequest;
import io.github.pathfind.lane.Lane;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exporter for the lane stats CSV. The header comes from the first lane, then one row per lane.
 */
public class StatsCsvExporter {

  private static final Logger log = LoggerFactory.getLogger(StatsCsvExporter.class);

  private final ChunkedWriter chunkedWriter;

  /**
   * Constructor.
   *
   * @param chunkedWriter the chunked writer
   */
  public StatsCsvExporter(final ChunkedWriter chunkedWriter) {
    this.chunkedWriter = chunkedWriter;
  }

  /**
   * Write the stats file named by the request, or {@code <group>.stats.csv}.
   *
   * @param lanes   the lanes
   * @param request the request
   * @return the file written
   */
  public Path export(final List<Lane> lanes, final ExportRequest request) {
    final Path path = request.outputPath(request.groupName() + ".stats.csv");
    writeTo(lanes, request.separator(), path);
    log.info("Wrote stats for {} lanes to {}", lanes.size(), path);
    return path;
  }

  /**
   * Write stats CSV to a file.
   *
   * @param lanes     the lanes
   * @param separator the separator
   * @param path      the path
   */
  public void writeTo(final List<Lane> lanes, final char separator, final Path path) {
    chunkedWriter.writeFile(toCsv(lanes, separator), path);
  }

  /**
   * Stats CSV for the lanes. No lanes gives no bytes.
   *
   * @param lanes     the lanes
   * @param separator the separator
   * @return the CSV
   * @throws IllegalStateException if a lane's row doesn't have one value per header column
   */
  public byte[] toCsv(final List<Lane> lanes, final char separator) {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    if (lanes.isEmpty()) {
      return bytes.toByteArray();
    }
    final List<String> header = lanes.get(0).statsHeader();
    final CSVFormat format = CSVFormat.DEFAULT.builder()
        .setDelimiter(separator)
        .setRecordSeparator("\n")
        .build();
    try (Writer writer = new OutputStreamWriter(bytes, StandardCharsets.UTF_8);
        CSVPrinter csvPrinter = new CSVPrinter(writer, format)) {
      csvPrinter.printRecord(header);
      for (final Lane lane : lanes) {
        final List<String> row = lane.statsRow();
        if (row.size() != header.size()) {
          throw new IllegalStateException("Stats row for lane " + lane.name() + " has " + row.size()
              + " values but the header has " + header.size());
        }
        csvPrinter.printRecord(row);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Couldn't build stats CSV", e);
    }
    return bytes.toByteArray();
  }
}
