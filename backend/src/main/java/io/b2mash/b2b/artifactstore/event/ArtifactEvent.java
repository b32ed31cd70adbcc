package io.b2mash.b2b.artifactstore.event;

import java.time.Instant;

/**
 * Artifact lifecycle events published via Spring {@code ApplicationEventPublisher}. Implementations
 * are records of plain values so listeners can act on them after the publishing call returns.
 */
public sealed interface ArtifactEvent
    permits ArtifactStoredEvent, ArtifactReplacedEvent, ArtifactDeletionAttemptedEvent {

  String eventType();

  String storeId();

  Instant occurredAt();
}
