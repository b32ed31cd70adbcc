package io.b2mash.b2b.artifactstore.upload;

import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import io.b2mash.b2b.artifactstore.artifact.RemoteArtifact;
import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.artifact.UsageHint;
import io.b2mash.b2b.artifactstore.classify.ResourceTypeClassifier;
import io.b2mash.b2b.artifactstore.classify.StoreOptions;
import io.b2mash.b2b.artifactstore.event.ArtifactDeletionAttemptedEvent;
import io.b2mash.b2b.artifactstore.event.ArtifactReplacedEvent;
import io.b2mash.b2b.artifactstore.event.ArtifactStoredEvent;
import io.b2mash.b2b.artifactstore.staging.StagedFile;
import io.b2mash.b2b.artifactstore.staging.UploadStagingArea;
import io.b2mash.b2b.artifactstore.store.DeleteOutcome;
import io.b2mash.b2b.artifactstore.store.RemoteStoreClient;
import io.b2mash.b2b.artifactstore.store.StoreReceipt;
import io.b2mash.b2b.artifactstore.store.UrlNormalizer;
import java.io.InputStream;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Write path: stage, classify, store, normalize, release. The staged file is released on every exit
 * from an upload, whether the store call succeeded or not.
 */
@Service
public class ArtifactUploadService {

  private static final Logger log = LoggerFactory.getLogger(ArtifactUploadService.class);

  private final UploadStagingArea stagingArea;
  private final ResourceTypeClassifier classifier;
  private final RemoteStoreClient storeClient;
  private final ApplicationEventPublisher eventPublisher;

  public ArtifactUploadService(
      UploadStagingArea stagingArea,
      ResourceTypeClassifier classifier,
      RemoteStoreClient storeClient,
      ApplicationEventPublisher eventPublisher) {
    this.stagingArea = stagingArea;
    this.classifier = classifier;
    this.storeClient = storeClient;
    this.eventPublisher = eventPublisher;
  }

  /** Stages an incoming upload body and stores it. */
  public UploadedArtifact upload(
      String fieldName,
      String originalName,
      String mimeType,
      InputStream content,
      UsageHint hint) {
    StagedFile staged = stagingArea.stage(fieldName, originalName, mimeType, content);
    return upload(staged, hint);
  }

  /**
   * Stores an already staged file. Ownership of {@code staged} passes to this method; it is
   * released before returning or throwing.
   */
  public UploadedArtifact upload(StagedFile staged, UsageHint hint) {
    try {
      StoreOptions options = classifier.classify(staged.declaredMimeType(), hint, staged.path());
      StoreReceipt receipt = storeClient.store(staged.path(), options);
      var artifact =
          RemoteArtifact.fromUpload(receipt.result(), staged.originalName(), options.contentType());

      eventPublisher.publishEvent(
          new ArtifactStoredEvent(
              artifact.storeId(),
              receipt.result().resourceType(),
              artifact.originalName(),
              artifact.byteSize(),
              receipt.mismatchWarning().isPresent(),
              Instant.now()));
      return new UploadedArtifact(artifact, receipt);
    } finally {
      staged.release();
    }
  }

  /**
   * Uploads a replacement and only then deletes the previous object. If the new upload fails the
   * previous artifact is left untouched; a failed delete of the previous object does not fail the
   * replacement.
   */
  public Replacement replace(RemoteArtifact existing, StagedFile staged, UsageHint hint) {
    UploadedArtifact uploaded = upload(staged, hint);

    DeleteOutcome previousDelete = DeleteOutcome.skipped();
    if (existing != null) {
      previousDelete = storeClient.delete(existing.storeId(), resourceTypeOf(existing));
      if (previousDelete.attempted() && !previousDelete.deleted()) {
        log.warn(
            "Replaced {} but the previous object {} is still in the store",
            uploaded.artifact().storeId(),
            existing.storeId());
      }
    }

    eventPublisher.publishEvent(
        new ArtifactReplacedEvent(
            uploaded.artifact().storeId(),
            existing != null ? existing.storeId() : null,
            previousDelete,
            Instant.now()));
    return new Replacement(uploaded, previousDelete);
  }

  /**
   * Best-effort remote delete accompanying deletion of the owning record. Never throws, so record
   * deletion is never blocked by the store.
   */
  public DeleteOutcome discard(RemoteArtifact artifact) {
    if (artifact == null) {
      return DeleteOutcome.skipped();
    }
    DeleteOutcome outcome = storeClient.delete(artifact.storeId(), resourceTypeOf(artifact));
    eventPublisher.publishEvent(
        new ArtifactDeletionAttemptedEvent(artifact.storeId(), outcome, Instant.now()));
    return outcome;
  }

  /**
   * Resource type an existing artifact was stored under. A recorded type wins. Otherwise the
   * declared MIME type decides, and the delivery URL segment is only consulted when the MIME type
   * says nothing, since stale URLs may carry the image segment for documents.
   */
  ResourceType resourceTypeOf(RemoteArtifact artifact) {
    if (artifact.resourceType() != null) {
      return artifact.resourceType();
    }
    if (!MimeTypes.isPlaceholder(artifact.mimeType())) {
      return classifier.resourceTypeFor(artifact.mimeType(), UsageHint.ATTACHMENT);
    }
    return UrlNormalizer.hasSegment(artifact.deliveryUrl(), ResourceType.IMAGE)
        ? ResourceType.IMAGE
        : ResourceType.DOCUMENT;
  }
}
