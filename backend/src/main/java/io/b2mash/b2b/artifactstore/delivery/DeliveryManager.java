package io.b2mash.b2b.artifactstore.delivery;

import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import io.b2mash.b2b.artifactstore.exception.DeliveryException;
import io.b2mash.b2b.artifactstore.integrity.ValidatedPayload;
import io.b2mash.b2b.artifactstore.retrieval.HostEnvironment;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Hands validated content to the host's save action. The transient handle is released a short,
 * bounded delay after the host was triggered so the host can finish reading it; if the host fails,
 * the handle is released at once and the failure is reported.
 */
@Component
public class DeliveryManager {

  private static final Logger log = LoggerFactory.getLogger(DeliveryManager.class);

  private final HostEnvironment host;
  private final TaskScheduler scheduler;
  private final Duration releaseDelay;
  private final Clock clock;

  @Autowired
  public DeliveryManager(
      HostEnvironment host, TaskScheduler scheduler, ArtifactStoreProperties properties) {
    this(host, scheduler, properties.delivery().handleReleaseDelay(), Clock.systemUTC());
  }

  DeliveryManager(
      HostEnvironment host, TaskScheduler scheduler, Duration releaseDelay, Clock clock) {
    this.host = host;
    this.scheduler = scheduler;
    this.releaseDelay = releaseDelay;
    this.clock = clock;
  }

  /**
   * Presents the payload to the user.
   *
   * @throws DeliveryException if the host could not present the file
   */
  public DeliveryReceipt deliver(ValidatedPayload payload) {
    String fileName =
        DisplayFileNames.derive(payload.descriptor().displayName(), payload.mimeType());
    var handle = new TransientHandle(payload.content(), payload.mimeType());

    URI location;
    try {
      location = host.presentFile(handle, fileName);
    } catch (RuntimeException e) {
      handle.release();
      log.warn("Could not present {}: {}", fileName, e.getMessage());
      if (e instanceof DeliveryException delivery) {
        throw delivery;
      }
      throw new DeliveryException(fileName, e);
    }

    scheduler.schedule(handle::release, clock.instant().plus(releaseDelay));
    log.info("Delivered {} ({} bytes, {})", fileName, handle.size(), payload.mimeType());
    return new DeliveryReceipt(
        fileName, payload.mimeType(), handle.size(), location, payload.warnings());
  }
}
