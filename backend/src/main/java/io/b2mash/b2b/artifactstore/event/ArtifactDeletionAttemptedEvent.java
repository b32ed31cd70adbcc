package io.b2mash.b2b.artifactstore.event;

import io.b2mash.b2b.artifactstore.store.DeleteOutcome;
import java.time.Instant;

public record ArtifactDeletionAttemptedEvent(
    String storeId, DeleteOutcome outcome, Instant occurredAt) implements ArtifactEvent {

  @Override
  public String eventType() {
    return "artifact.deletion_attempted";
  }
}
