package io.b2mash.b2b.artifactstore.store;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.classify.StoreOptions;
import java.nio.file.Path;

/**
 * Port to the remote object store. Domain services go through {@link RemoteStoreClient} instead of
 * injecting this directly; vendor SDK types stay inside the implementations.
 */
public interface ObjectStoreGateway {

  /**
   * Uploads a local file.
   *
   * @throws io.b2mash.b2b.artifactstore.exception.StoreUploadException on transport, auth or quota
   *     failures
   */
  StoredObject upload(Path localFile, StoreOptions options);

  /** Deletes an object. Implementations may throw; callers decide whether failures matter. */
  void destroy(String storeId, ResourceType resourceType);

  /** Public base that delivery URLs are built from. */
  String deliveryBaseUrl();
}
