package io.github.pathfind.cli.archive;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ArchivePathRewriterTest {

  private final Path file = Path.of("/lustre/seq/5477_6#1/read#1.fastq.gz");

  @Test
  void memberName_withRename_replacesHashesInBaseName() {
    assertThat(ArchivePathRewriter.memberName("5477_6#1", file, true)).isEqualTo("5477_6_1/read_1.fastq.gz");
  }

  @Test
  void memberName_withoutRename_keepsBaseName() {
    assertThat(ArchivePathRewriter.memberName("5477_6#1", file, false)).isEqualTo("5477_6_1/read#1.fastq.gz");
  }

  @Test
  void memberName_usesOnlyTheBaseName() {
    assertThat(ArchivePathRewriter.memberName("group", file, false))
        .doesNotContain("\\")
        .doesNotContain("lustre")
        .isEqualTo("group/read#1.fastq.gz");
  }

  @Test
  void originalName_trimsLeadingSlash() {
    final String original = ArchivePathRewriter.originalName(file);

    assertThat(original).doesNotStartWith("/").endsWith("5477_6#1/read#1.fastq.gz");
  }
}
