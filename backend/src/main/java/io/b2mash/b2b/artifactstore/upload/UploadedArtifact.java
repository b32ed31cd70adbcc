package io.b2mash.b2b.artifactstore.upload;

import io.b2mash.b2b.artifactstore.artifact.RemoteArtifact;
import io.b2mash.b2b.artifactstore.artifact.UploadResult;
import io.b2mash.b2b.artifactstore.store.StoreReceipt;

/** A stored upload: the descriptor to persist plus the store receipt it was built from. */
public record UploadedArtifact(RemoteArtifact artifact, StoreReceipt receipt) {

  public UploadResult result() {
    return receipt.result();
  }
}
