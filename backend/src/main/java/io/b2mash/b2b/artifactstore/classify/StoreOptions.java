package io.b2mash.b2b.artifactstore.classify;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Options for one store call. Image transform options can only be attached to {@link
 * ResourceType#IMAGE}; constructing document options with transforms fails.
 *
 * @param folder target folder in the store
 * @param resourceType requested resource type
 * @param accessMode requested access mode ("public")
 * @param contentType content type recorded on the stored object
 * @param imageTransform image-only transforms, null for documents
 */
public record StoreOptions(
    String folder,
    ResourceType resourceType,
    String accessMode,
    String contentType,
    ImageTransformOptions imageTransform) {

  public StoreOptions {
    Objects.requireNonNull(folder, "folder");
    Objects.requireNonNull(resourceType, "resourceType");
    Objects.requireNonNull(accessMode, "accessMode");
    if (imageTransform != null && !resourceType.acceptsTransformOptions()) {
      throw new IllegalArgumentException(
          "Image transform options are not valid for resource type " + resourceType);
    }
  }

  public static StoreOptions document(String folder, String accessMode, String contentType) {
    return new StoreOptions(folder, ResourceType.DOCUMENT, accessMode, contentType, null);
  }

  public static StoreOptions image(
      String folder, String accessMode, String contentType, ImageTransformOptions transform) {
    return new StoreOptions(folder, ResourceType.IMAGE, accessMode, contentType, transform);
  }

  public Optional<ImageTransformOptions> transform() {
    return Optional.ofNullable(imageTransform);
  }

  /** Flat parameter view of the options, as sent to the store. */
  public Map<String, String> toParameters() {
    var params = new LinkedHashMap<String, String>();
    params.put("folder", folder);
    params.put("resource_type", resourceType.pathSegment());
    params.put("type", "upload");
    params.put("access_mode", accessMode);
    if (imageTransform != null) {
      params.put("quality", imageTransform.quality());
      params.put("fetch_format", imageTransform.fetchFormat());
    }
    return Collections.unmodifiableMap(params);
  }
}
