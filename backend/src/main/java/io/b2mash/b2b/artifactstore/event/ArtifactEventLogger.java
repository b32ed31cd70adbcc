package io.b2mash.b2b.artifactstore.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of artifact lifecycle events. A delete the store did not accept leaves an orphaned
 * object behind, which is logged at warn so it can be cleaned up by hand.
 */
@Component
public class ArtifactEventLogger {

  private static final Logger log = LoggerFactory.getLogger(ArtifactEventLogger.class);

  @EventListener
  public void onArtifactEvent(ArtifactEvent event) {
    log.info("{} storeId={} at {}", event.eventType(), event.storeId(), event.occurredAt());
    if (leftOrphan(event)) {
      log.warn("{} left an orphaned object in the store: {}", event.eventType(), orphanOf(event));
    }
  }

  static boolean leftOrphan(ArtifactEvent event) {
    if (event instanceof ArtifactDeletionAttemptedEvent deletion) {
      return deletion.outcome().attempted() && !deletion.outcome().deleted();
    }
    if (event instanceof ArtifactReplacedEvent replaced) {
      return replaced.previousDelete().attempted() && !replaced.previousDelete().deleted();
    }
    return false;
  }

  private static String orphanOf(ArtifactEvent event) {
    if (event instanceof ArtifactReplacedEvent replaced) {
      return replaced.previousStoreId();
    }
    return event.storeId();
  }
}
