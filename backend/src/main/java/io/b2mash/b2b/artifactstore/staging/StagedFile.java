package io.b2mash.b2b.artifactstore.staging;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped ownership of a locally staged upload. The file is removed by {@link #release()} (or by
 * closing the handle), which upload paths call on every exit, including failures. Releasing twice
 * is a no-op.
 */
public final class StagedFile implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(StagedFile.class);

  private final Path path;
  private final String originalName;
  private final String declaredMimeType;
  private final long size;
  private final AtomicBoolean released = new AtomicBoolean();

  private StagedFile(Path path, String originalName, String declaredMimeType, long size) {
    this.path = path;
    this.originalName = originalName;
    this.declaredMimeType = declaredMimeType;
    this.size = size;
  }

  /** Takes ownership of an existing file; the caller must not delete it independently. */
  public static StagedFile acquire(Path path, String originalName, String declaredMimeType) {
    Objects.requireNonNull(path, "path");
    try {
      return new StagedFile(path, originalName, declaredMimeType, Files.size(path));
    } catch (IOException e) {
      throw new UncheckedIOException("Staged file is not readable", e);
    }
  }

  public static StagedFile acquire(Path path) {
    return acquire(path, path.getFileName().toString(), null);
  }

  public Path path() {
    return path;
  }

  public String originalName() {
    return originalName;
  }

  public String declaredMimeType() {
    return declaredMimeType;
  }

  public long size() {
    return size;
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * Deletes the staged file if it still exists.
   *
   * @return true if the file is gone afterwards
   */
  public boolean release() {
    if (!released.compareAndSet(false, true)) {
      return !Files.exists(path);
    }
    try {
      Files.deleteIfExists(path);
      return true;
    } catch (IOException e) {
      log.warn("Failed to remove staged file {}: {}", path.getFileName(), e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    release();
  }
}
