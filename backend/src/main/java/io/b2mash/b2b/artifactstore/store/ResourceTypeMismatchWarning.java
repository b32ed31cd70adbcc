package io.b2mash.b2b.artifactstore.store;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;

/** The store reported a different resource type than requested. Non-fatal. */
public record ResourceTypeMismatchWarning(
    String storeId, ResourceType requested, String reported, String deliveryUrl) {

  public String message() {
    return "Store reported resource type '"
        + reported
        + "' for "
        + storeId
        + " but '"
        + requested.pathSegment()
        + "' was requested";
  }
}
