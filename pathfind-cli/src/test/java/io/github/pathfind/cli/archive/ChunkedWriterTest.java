package io.github.pathfind.cli.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.pathfind.exception.FilesystemException;
import io.github.pathfind.progress.NoOpProgressReporter;
import io.github.pathfind.progress.ProgressReporter;
import io.github.pathfind.progress.ProgressTracker;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Random;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChunkedWriterTest {

  @TempDir Path tempDir;

  @Mock private ProgressReporter progressReporter;

  @Mock private ProgressTracker progressTracker;

  @ParameterizedTest
  @CsvSource({
      "0, 100",
      "1, 100",
      "99, 100",
      "100, 100",
      "101, 100",
      "12345, 100",
      "12345, 7",
      "12345, 1"
  })
  void writeFile_storesEveryByte(final int length, final int chunks) throws Exception {
    // Given
    final byte[] data = payload(length);
    final ChunkedWriter writer = new ChunkedWriter(new NoOpProgressReporter(), chunks);
    final Path file = tempDir.resolve("out-" + length + "-" + chunks + ".bin");

    // When
    writer.writeFile(data, file);

    // Then
    assertThat(Files.readAllBytes(file)).isEqualTo(data);
  }

  @Test
  void writeFile_ticksOncePerChunk() {
    // Given
    when(progressReporter.start(anyString(), anyLong())).thenReturn(progressTracker);
    final ChunkedWriter writer = new ChunkedWriter(progressReporter, 100);

    // When
    writer.writeFile(payload(1050), tempDir.resolve("out.bin"));

    // Then
    verify(progressReporter).start("writing", 100L);
    verify(progressTracker, times(100)).tick();
    verify(progressTracker).close();
  }

  @Test
  void writeFile_shortPayload_ticksOncePerByte() {
    // Given
    when(progressReporter.start(anyString(), anyLong())).thenReturn(progressTracker);
    final ChunkedWriter writer = new ChunkedWriter(progressReporter, 100);

    // When
    writer.writeFile(payload(5), tempDir.resolve("out.bin"));

    // Then
    verify(progressTracker, times(5)).tick();
  }

  @Test
  void writeFile_unwritablePath_throwsWithPath() {
    // Given
    final Path file = tempDir.resolve("no/such/dir/out.tar");
    final ChunkedWriter writer = new ChunkedWriter(new NoOpProgressReporter(), 100);

    // When / Then
    assertThatThrownBy(() -> writer.writeFile(payload(10), file))
        .isInstanceOf(FilesystemException.class)
        .hasMessageContaining(file.toString())
        .hasCauseInstanceOf(NoSuchFileException.class);
    assertThat(file).doesNotExist();
  }

  @Test
  void writeFile_failsAfterOpening_removesPartialFile() {
    // Given
    when(progressReporter.start(anyString(), anyLong())).thenReturn(progressTracker);
    doNothing().doNothing().doThrow(new IllegalStateException("progress display closed"))
        .when(progressTracker).tick();
    final ChunkedWriter writer = new ChunkedWriter(progressReporter, 10);
    final Path file = tempDir.resolve("pathfind_5477_6_1.tar.gz");

    // When / Then
    assertThatThrownBy(() -> writer.writeFile(payload(1000), file))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("progress display closed");
    verify(progressTracker, times(3)).tick();
    verify(progressTracker).close();
    assertThat(file).doesNotExist();
  }

  @Test
  void compress_producesGzipOfInput() throws Exception {
    // Given
    final byte[] data = payload(54321);
    final ChunkedWriter writer = new ChunkedWriter(new NoOpProgressReporter(), 100);

    // When
    final byte[] compressed = writer.compress(data);

    // Then
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      assertThat(gzip.readAllBytes()).isEqualTo(data);
    }
  }

  @Test
  void constructor_rejectsZeroChunks() {
    assertThatThrownBy(() -> new ChunkedWriter(new NoOpProgressReporter(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static byte[] payload(final int length) {
    final byte[] data = new byte[length];
    new Random(length).nextBytes(data);
    return data;
  }
}
