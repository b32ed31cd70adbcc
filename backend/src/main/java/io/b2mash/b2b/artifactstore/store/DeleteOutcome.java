package io.b2mash.b2b.artifactstore.store;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;

/**
 * Result of a best-effort remote delete. Failures are reported here instead of thrown so record
 * deletion never blocks on the store.
 *
 * @param storeId object that was targeted, null when there was nothing to delete
 * @param resourceType resource type the delete was issued for
 * @param attempted false when no store call was made (no store id)
 * @param deleted true if the store accepted the delete
 * @param failureReason store error message when the delete failed
 */
public record DeleteOutcome(
    String storeId,
    ResourceType resourceType,
    boolean attempted,
    boolean deleted,
    String failureReason) {

  public static DeleteOutcome skipped() {
    return new DeleteOutcome(null, null, false, false, null);
  }

  public static DeleteOutcome deleted(String storeId, ResourceType resourceType) {
    return new DeleteOutcome(storeId, resourceType, true, true, null);
  }

  public static DeleteOutcome failed(String storeId, ResourceType resourceType, String reason) {
    return new DeleteOutcome(storeId, resourceType, true, false, reason);
  }
}
