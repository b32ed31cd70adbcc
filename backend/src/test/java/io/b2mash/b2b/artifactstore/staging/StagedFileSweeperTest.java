package io.b2mash.b2b.artifactstore.staging;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagedFileSweeperTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @TempDir Path tempDir;

  @Test
  void sweep_removesOnlyFilesOlderThanMaxAge() throws IOException {
    Path stale = Files.write(tempDir.resolve("file-1-1.pdf"), new byte[] {1});
    Path fresh = Files.write(tempDir.resolve("file-2-2.pdf"), new byte[] {1});
    Files.setLastModifiedTime(stale, FileTime.from(NOW.minus(Duration.ofHours(2))));
    Files.setLastModifiedTime(fresh, FileTime.from(NOW.minus(Duration.ofMinutes(5))));

    var sweeper =
        new StagedFileSweeper(tempDir, Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));

    assertThat(sweeper.sweep()).isEqualTo(1);
    assertThat(Files.exists(stale)).isFalse();
    assertThat(Files.exists(fresh)).isTrue();
  }

  @Test
  void sweep_missingDirectoryIsNoOp() {
    var sweeper =
        new StagedFileSweeper(
            tempDir.resolve("absent"), Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));

    assertThat(sweeper.sweep()).isZero();
  }

  @Test
  void sweep_leavesDirectoriesAlone() throws IOException {
    Path nested = Files.createDirectory(tempDir.resolve("nested"));
    Files.setLastModifiedTime(nested, FileTime.from(NOW.minus(Duration.ofDays(1))));

    var sweeper =
        new StagedFileSweeper(tempDir, Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));

    assertThat(sweeper.sweep()).isZero();
    assertThat(Files.exists(nested)).isTrue();
  }
}
