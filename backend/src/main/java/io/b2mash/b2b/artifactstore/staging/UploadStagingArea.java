package io.b2mash.b2b.artifactstore.staging;

import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import io.b2mash.b2b.artifactstore.exception.ArtifactTooLargeException;
import io.b2mash.b2b.artifactstore.exception.UnsupportedArtifactTypeException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes incoming uploads to the staging directory before they are handed to the remote store.
 * Rejects disallowed MIME types up front and enforces the size limit while copying; a rejected
 * upload leaves nothing behind.
 */
@Component
public class UploadStagingArea {

  private static final Logger log = LoggerFactory.getLogger(UploadStagingArea.class);

  private static final Pattern SAFE_EXTENSION = Pattern.compile("^\\.[A-Za-z0-9]{1,10}$");

  private final Path directory;
  private final long maxBytes;
  private final List<String> allowedTypes;

  public UploadStagingArea(ArtifactStoreProperties properties) {
    this.directory = properties.staging().directory();
    this.maxBytes = properties.staging().maxSize().toBytes();
    this.allowedTypes =
        properties.staging().allowedTypes().stream()
            .map(t -> t.toLowerCase(Locale.ROOT))
            .toList();
  }

  public Path directory() {
    return directory;
  }

  /**
   * Stages an upload.
   *
   * @param fieldName form field the file arrived under, used as the staged name prefix
   * @param originalName client-supplied file name
   * @param mimeType client-declared MIME type
   * @param content upload body; not closed by this method
   */
  public StagedFile stage(
      String fieldName, String originalName, String mimeType, InputStream content) {
    String normalizedType = MimeTypes.normalize(mimeType);
    if (!allowedTypes.contains(normalizedType)) {
      throw new UnsupportedArtifactTypeException(mimeType, allowedTypes);
    }

    Path target;
    try {
      Files.createDirectories(directory);
      target = directory.resolve(stagedName(fieldName, originalName));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to prepare staging directory", e);
    }

    long written = 0;
    try (OutputStream out = Files.newOutputStream(target)) {
      byte[] buf = new byte[8192];
      int n;
      while ((n = content.read(buf)) != -1) {
        written += n;
        if (written > maxBytes) {
          throw new ArtifactTooLargeException(maxBytes, written);
        }
        out.write(buf, 0, n);
      }
    } catch (ArtifactTooLargeException e) {
      deleteQuietly(target);
      throw e;
    } catch (IOException e) {
      deleteQuietly(target);
      throw new UncheckedIOException("Failed to stage upload", e);
    }

    log.debug("Staged upload {} ({} bytes, {})", target.getFileName(), written, normalizedType);
    return StagedFile.acquire(target, originalName, normalizedType);
  }

  static String stagedName(String fieldName, String originalName) {
    String prefix =
        fieldName == null || fieldName.isBlank()
            ? "file"
            : fieldName.replaceAll("[^A-Za-z0-9_-]", "_");
    String suffix =
        System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1_000_000_000);
    return prefix + "-" + suffix + extensionOf(originalName);
  }

  private static String extensionOf(String originalName) {
    if (originalName == null) {
      return "";
    }
    int dot = originalName.lastIndexOf('.');
    if (dot < 0) {
      return "";
    }
    String ext = originalName.substring(dot);
    return SAFE_EXTENSION.matcher(ext).matches() ? ext.toLowerCase(Locale.ROOT) : "";
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to remove rejected upload {}: {}", path.getFileName(), e.getMessage());
    }
  }
}
