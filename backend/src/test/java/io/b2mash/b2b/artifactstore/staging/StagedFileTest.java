package io.b2mash.b2b.artifactstore.staging;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagedFileTest {

  @TempDir Path tempDir;

  @Test
  void acquire_capturesSizeAndMetadata() throws IOException {
    Path path = Files.write(tempDir.resolve("field-1-2.pdf"), new byte[42]);

    var staged = StagedFile.acquire(path, "notice.pdf", "application/pdf");

    assertThat(staged.size()).isEqualTo(42);
    assertThat(staged.originalName()).isEqualTo("notice.pdf");
    assertThat(staged.declaredMimeType()).isEqualTo("application/pdf");
    assertThat(staged.isReleased()).isFalse();
  }

  @Test
  void release_removesFileAndIsIdempotent() throws IOException {
    Path path = Files.write(tempDir.resolve("upload.bin"), new byte[] {1, 2, 3});
    var staged = StagedFile.acquire(path);

    assertThat(staged.release()).isTrue();
    assertThat(Files.exists(path)).isFalse();
    assertThat(staged.release()).isTrue();
    assertThat(staged.isReleased()).isTrue();
  }

  @Test
  void close_releasesFile() throws IOException {
    Path path = Files.write(tempDir.resolve("upload.bin"), new byte[] {1});

    try (var staged = StagedFile.acquire(path)) {
      assertThat(staged.originalName()).isEqualTo("upload.bin");
    }

    assertThat(Files.exists(path)).isFalse();
  }

  @Test
  void release_toleratesAlreadyDeletedFile() throws IOException {
    Path path = Files.write(tempDir.resolve("upload.bin"), new byte[] {1});
    var staged = StagedFile.acquire(path);
    Files.delete(path);

    assertThat(staged.release()).isTrue();
  }
}
