package io.b2mash.b2b.artifactstore.artifact;

import java.util.Locale;
import java.util.Optional;

/**
 * The remote store's classification of a blob. Determines the delivery URL path segment and which
 * store options are valid: only {@link #IMAGE} artifacts accept image transform options.
 */
public enum ResourceType {
  DOCUMENT("raw"),
  IMAGE("image");

  private final String pathSegment;

  ResourceType(String pathSegment) {
    this.pathSegment = pathSegment;
  }

  /** Path segment used in delivery URLs: {@code <base>/<segment>/upload/<folder>/<storeId>}. */
  public String pathSegment() {
    return pathSegment;
  }

  public boolean acceptsTransformOptions() {
    return this == IMAGE;
  }

  /** Maps a store-reported resource type ("raw", "image") back to the enum. */
  public static Optional<ResourceType> fromStoreValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ResourceType type : values()) {
      if (type.pathSegment.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
