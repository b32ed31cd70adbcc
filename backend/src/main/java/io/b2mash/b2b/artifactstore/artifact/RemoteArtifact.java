package io.b2mash.b2b.artifactstore.artifact;

import java.util.Objects;

/**
 * Current format: the object lives in the remote store and is served via its delivery URL. {@code
 * resourceType} is the type the object was stored under, known for fresh uploads and null for
 * descriptors rebuilt from persisted references.
 */
public record RemoteArtifact(
    String storeId,
    String deliveryUrl,
    String originalName,
    long byteSize,
    String mimeType,
    ResourceType resourceType)
    implements ArtifactDescriptor {

  public RemoteArtifact {
    Objects.requireNonNull(deliveryUrl, "deliveryUrl");
    if (deliveryUrl.isBlank()) {
      throw new IllegalArgumentException("deliveryUrl must not be blank");
    }
  }

  public RemoteArtifact(
      String storeId, String deliveryUrl, String originalName, long byteSize, String mimeType) {
    this(storeId, deliveryUrl, originalName, byteSize, mimeType, null);
  }

  /** Builds the descriptor persisted for a fresh upload. */
  public static RemoteArtifact fromUpload(
      UploadResult result, String originalName, String mimeType) {
    return new RemoteArtifact(
        result.storeId(),
        result.deliveryUrl(),
        originalName,
        result.byteSize(),
        mimeType,
        result.resourceType());
  }

  @Override
  public String displayName() {
    return originalName;
  }

  @Override
  public String declaredMimeType() {
    return mimeType;
  }
}
