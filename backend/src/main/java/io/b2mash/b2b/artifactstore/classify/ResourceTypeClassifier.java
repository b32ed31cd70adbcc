package io.b2mash.b2b.artifactstore.classify;

import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.artifact.UsageHint;
import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides how an upload is stored. Documents go to the raw resource type without transforms;
 * images get the configured transform options. Unknown or generic MIME types are sniffed from the
 * staged bytes, and anything still unrecognised is stored as a generic binary document.
 */
@Component
public class ResourceTypeClassifier {

  private static final Logger log = LoggerFactory.getLogger(ResourceTypeClassifier.class);

  private static final Set<String> DOCUMENT_TYPES =
      Set.of(
          "application/pdf",
          "application/x-pdf",
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "text/plain");

  private static final Set<String> IMAGE_TYPES =
      Set.of(
          "image/jpeg", "image/jpg", "image/pjpeg", "image/png", "image/gif", "image/webp",
          "image/bmp");

  private final Tika tika;
  private final String folder;
  private final String accessMode;
  private final ImageTransformOptions imageTransform;

  @Autowired
  public ResourceTypeClassifier(ArtifactStoreProperties properties) {
    this(
        new Tika(),
        properties.folder(),
        properties.accessMode(),
        new ImageTransformOptions(properties.image().quality(), properties.image().fetchFormat()));
  }

  ResourceTypeClassifier(
      Tika tika, String folder, String accessMode, ImageTransformOptions imageTransform) {
    this.tika = tika;
    this.folder = folder;
    this.accessMode = accessMode;
    this.imageTransform = imageTransform;
  }

  /**
   * Classifies an upload.
   *
   * @param declaredMimeType declared MIME type, may be null or generic
   * @param hint what the upload is for
   * @param content staged file used for sniffing when the declared type is not conclusive; may be
   *     null
   */
  public StoreOptions classify(String declaredMimeType, UsageHint hint, Path content) {
    String mimeType = effectiveMimeType(declaredMimeType, content);
    ResourceType type = resourceTypeFor(mimeType, hint);
    log.debug(
        "Classified upload as {} (declared={}, effective={})", type, declaredMimeType, mimeType);

    return switch (type) {
      case IMAGE -> StoreOptions.image(folderFor(hint), accessMode, mimeType, imageTransform);
      case DOCUMENT -> StoreOptions.document(folderFor(hint), accessMode, mimeType);
    };
  }

  /** Maps a MIME type and hint to a resource type without sniffing. */
  public ResourceType resourceTypeFor(String mimeType, UsageHint hint) {
    if (hint == UsageHint.GALLERY_IMAGE) {
      return ResourceType.IMAGE;
    }
    String normalized = MimeTypes.normalize(mimeType);
    if (IMAGE_TYPES.contains(normalized)) {
      return ResourceType.IMAGE;
    }
    return ResourceType.DOCUMENT;
  }

  String effectiveMimeType(String declaredMimeType, Path content) {
    String normalized = MimeTypes.normalize(declaredMimeType);
    if (DOCUMENT_TYPES.contains(normalized) || IMAGE_TYPES.contains(normalized)) {
      return normalized;
    }
    if (content != null) {
      try {
        String detected = MimeTypes.normalize(tika.detect(content));
        if (!MimeTypes.isPlaceholder(detected)) {
          return detected;
        }
      } catch (IOException e) {
        log.warn(
            "Content type detection failed for {}: {}", content.getFileName(), e.getMessage());
      }
    }
    return MimeTypes.isPlaceholder(normalized) ? MimeTypes.GENERIC_BINARY : normalized;
  }

  private String folderFor(UsageHint hint) {
    return hint == UsageHint.GALLERY_IMAGE ? folder + "/gallery" : folder;
  }
}
