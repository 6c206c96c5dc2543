package io.github.pathfind.cli.archive;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ZipArchiveBuilderTest {

  @TempDir Path tempDir;

  private final ZipArchiveBuilder builder = new ZipArchiveBuilder();

  @Test
  void build_writesMembersInOrder() throws Exception {
    // Given
    final Path bam = write("lane/5477_6#1.bam", "alignment");
    final Path stats = write("tmp/stats.csv", "a,b\n");

    // When
    final BuiltArchive archive = builder.build(List.of(bam, stats),
        ImmutableArchiveOptions.builder().groupDirectoryName("5477_6#1").build());

    // Then
    assertThat(archive.memberNames()).containsExactly("5477_6_1/5477_6#1.bam", "5477_6_1/stats.csv");
    final Map<String, String> contents = read(archive.bytes());
    assertThat(contents).containsExactly(
        Map.entry("5477_6_1/5477_6#1.bam", "alignment"),
        Map.entry("5477_6_1/stats.csv", "a,b\n"));
  }

  @Test
  void build_nameCollision_usesOriginalPath() throws Exception {
    // Given
    final Path first = write("a/contigs.fa", "one");
    final Path second = write("b/contigs.fa", "two");

    // When
    final BuiltArchive archive = builder.build(List.of(first, second),
        ImmutableArchiveOptions.builder().groupDirectoryName("study").build());

    // Then
    assertThat(read(archive.bytes())).containsOnlyKeys("study/contigs.fa", ArchivePathRewriter.originalName(second));
  }

  private Path write(final String relative, final String contents) throws IOException {
    final Path file = tempDir.resolve(relative);
    Files.createDirectories(file.getParent());
    return Files.writeString(file, contents);
  }

  private static Map<String, String> read(final byte[] bytes) throws IOException {
    final Map<String, String> entries = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return entries;
  }
}
