package io.b2mash.b2b.artifactstore.artifact;

import java.util.Objects;

/**
 * Outcome of one successful store call. The delivery URL has already been normalized for the
 * resource type. Persisting it into the owning record is the caller's job.
 */
public record UploadResult(
    String storeId, String deliveryUrl, ResourceType resourceType, long byteSize) {

  public UploadResult {
    Objects.requireNonNull(storeId, "storeId");
    Objects.requireNonNull(deliveryUrl, "deliveryUrl");
    Objects.requireNonNull(resourceType, "resourceType");
  }
}
