package io.b2mash.b2b.artifactstore.event;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import java.time.Instant;

public record ArtifactStoredEvent(
    String storeId,
    ResourceType resourceType,
    String originalName,
    long byteSize,
    boolean resourceTypeMismatch,
    Instant occurredAt)
    implements ArtifactEvent {

  @Override
  public String eventType() {
    return "artifact.stored";
  }
}
