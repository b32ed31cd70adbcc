package io.b2mash.b2b.artifactstore.store;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.artifact.UploadResult;
import io.b2mash.b2b.artifactstore.classify.StoreOptions;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adapter the upload path talks to instead of the raw {@link ObjectStoreGateway}. Checks the
 * resource type the store reports against the requested one, normalizes the delivery URL, and turns
 * delete failures into a {@link DeleteOutcome} so they never propagate.
 */
@Component
public class RemoteStoreClient {

  private static final Logger log = LoggerFactory.getLogger(RemoteStoreClient.class);

  private final ObjectStoreGateway gateway;
  private final UrlNormalizer urlNormalizer;

  public RemoteStoreClient(ObjectStoreGateway gateway, UrlNormalizer urlNormalizer) {
    this.gateway = gateway;
    this.urlNormalizer = urlNormalizer;
  }

  /**
   * Uploads a local file and returns the normalized result with any resource type mismatch the
   * store raised.
   *
   * @throws io.b2mash.b2b.artifactstore.exception.StoreUploadException if the store rejects the put
   */
  public StoreReceipt store(Path localFile, StoreOptions options) {
    ResourceType requested = options.resourceType();
    StoredObject stored = gateway.upload(localFile, options);

    ResourceTypeMismatchWarning mismatch = null;
    Optional<ResourceType> reported = ResourceType.fromStoreValue(stored.reportedResourceType());
    if (reported.isEmpty() || reported.get() != requested) {
      mismatch =
          new ResourceTypeMismatchWarning(
              stored.storeId(),
              requested,
              stored.reportedResourceType(),
              UrlNormalizer.redact(stored.deliveryUrl()));
      log.warn("Resource type mismatch: {}", mismatch.message());
    }

    String url = urlNormalizer.normalize(stored.deliveryUrl(), requested, stored.storeId());
    var result = new UploadResult(stored.storeId(), url, requested, stored.byteSize());
    log.info("Stored {} as {} ({} bytes)", stored.storeId(), requested, stored.byteSize());
    return new StoreReceipt(result, mismatch);
  }

  public UploadResult put(Path localFile, StoreOptions options) {
    return store(localFile, options).result();
  }

  /** Best-effort delete. Never throws; the outcome records whether the store accepted it. */
  public DeleteOutcome delete(String storeId, ResourceType resourceType) {
    if (storeId == null || storeId.isBlank()) {
      log.debug("No store id, skipping remote delete");
      return DeleteOutcome.skipped();
    }
    try {
      gateway.destroy(storeId, resourceType);
      log.info("Deleted {} ({}) from remote store", storeId, resourceType);
      return DeleteOutcome.deleted(storeId, resourceType);
    } catch (RuntimeException e) {
      log.warn("Remote delete failed for {} ({}): {}", storeId, resourceType, e.getMessage());
      return DeleteOutcome.failed(storeId, resourceType, e.getMessage());
    }
  }

  public String deliveryUrlFor(String storeId, ResourceType resourceType) {
    return urlNormalizer.deliveryUrlFor(storeId, resourceType);
  }
}
