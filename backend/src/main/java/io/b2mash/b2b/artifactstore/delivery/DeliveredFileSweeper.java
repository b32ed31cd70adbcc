package io.b2mash.b2b.artifactstore.delivery;

import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled removal of presented files older than {@code artifacts.delivery.retention}. Each
 * delivery lives in its own subdirectory of the delivery directory; the whole subdirectory goes.
 */
@Component
public class DeliveredFileSweeper {

  private static final Logger log = LoggerFactory.getLogger(DeliveredFileSweeper.class);

  private final Path directory;
  private final Duration retention;
  private final Clock clock;

  @Autowired
  public DeliveredFileSweeper(ArtifactStoreProperties properties) {
    this(properties.delivery().directory(), properties.delivery().retention(), Clock.systemUTC());
  }

  DeliveredFileSweeper(Path directory, Duration retention, Clock clock) {
    this.directory = directory;
    this.retention = retention;
    this.clock = clock;
  }

  @Scheduled(fixedRate = 3600000) // hourly
  public void sweepExpiredDeliveries() {
    int removed = sweep();
    if (removed > 0) {
      log.info("Removed {} expired deliveries from {}", removed, directory);
    }
  }

  /** Deletes delivery subdirectories last modified before the cutoff and returns the count. */
  int sweep() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(retention);
    int removed = 0;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, Files::isDirectory)) {
      for (Path entry : entries) {
        try {
          if (Files.getLastModifiedTime(entry).toInstant().isBefore(cutoff)) {
            deleteTree(entry);
            removed++;
          }
        } catch (IOException e) {
          log.warn("Failed to remove expired delivery {}: {}", entry.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      log.warn("Failed to scan delivery directory {}: {}", directory, e.getMessage());
    }
    return removed;
  }

  private static void deleteTree(Path root) throws IOException {
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(root)) {
      paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    }
    for (Path path : paths) {
      Files.deleteIfExists(path);
    }
  }
}
