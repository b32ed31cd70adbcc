package io.b2mash.b2b.artifactstore.event;

import io.b2mash.b2b.artifactstore.store.DeleteOutcome;
import java.time.Instant;

/**
 * A new artifact superseded an old one. {@code previousDelete} records the best-effort delete of
 * the old object, which may have failed without affecting the replacement.
 */
public record ArtifactReplacedEvent(
    String storeId, String previousStoreId, DeleteOutcome previousDelete, Instant occurredAt)
    implements ArtifactEvent {

  @Override
  public String eventType() {
    return "artifact.replaced";
  }
}
