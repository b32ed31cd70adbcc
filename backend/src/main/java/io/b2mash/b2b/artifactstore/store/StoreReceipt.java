package io.b2mash.b2b.artifactstore.store;

import io.b2mash.b2b.artifactstore.artifact.UploadResult;
import java.util.Optional;

/** A successful put together with the non-fatal mismatch warning, if the store raised one. */
public record StoreReceipt(UploadResult result, ResourceTypeMismatchWarning mismatch) {

  public Optional<ResourceTypeMismatchWarning> mismatchWarning() {
    return Optional.ofNullable(mismatch);
  }
}
