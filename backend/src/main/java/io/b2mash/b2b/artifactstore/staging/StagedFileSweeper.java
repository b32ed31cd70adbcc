package io.b2mash.b2b.artifactstore.staging;

import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled removal of staged uploads that outlived {@code artifacts.staging.max-age}. Normal
 * uploads release their staged file themselves; this catches files left by a process that died
 * mid-upload.
 */
@Component
public class StagedFileSweeper {

  private static final Logger log = LoggerFactory.getLogger(StagedFileSweeper.class);

  private final Path directory;
  private final Duration maxAge;
  private final Clock clock;

  @Autowired
  public StagedFileSweeper(ArtifactStoreProperties properties) {
    this(properties.staging().directory(), properties.staging().maxAge(), Clock.systemUTC());
  }

  StagedFileSweeper(Path directory, Duration maxAge, Clock clock) {
    this.directory = directory;
    this.maxAge = maxAge;
    this.clock = clock;
  }

  @Scheduled(fixedRate = 900000) // every 15 minutes
  public void sweepStaleFiles() {
    int removed = sweep();
    if (removed > 0) {
      log.info("Removed {} stale staged uploads from {}", removed, directory);
    }
  }

  /** Deletes regular files older than the max age and returns how many were removed. */
  int sweep() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(maxAge);
    int removed = 0;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        try {
          if (Files.isRegularFile(entry)
              && Files.getLastModifiedTime(entry).toInstant().isBefore(cutoff)
              && Files.deleteIfExists(entry)) {
            removed++;
          }
        } catch (IOException e) {
          log.warn(
              "Failed to remove stale staged upload {}: {}", entry.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      log.warn("Failed to scan staging directory {}: {}", directory, e.getMessage());
    }
    return removed;
  }
}
