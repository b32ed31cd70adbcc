package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.artifact.ArtifactDescriptor;
import io.b2mash.b2b.artifactstore.artifact.StoredFileReference;
import io.b2mash.b2b.artifactstore.delivery.DeliveryManager;
import io.b2mash.b2b.artifactstore.delivery.DeliveryReceipt;
import io.b2mash.b2b.artifactstore.integrity.IntegrityValidator;
import io.b2mash.b2b.artifactstore.integrity.ValidatedPayload;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/**
 * Read path: resolve, fetch, validate, deliver. The fetch is the only asynchronous step; each call
 * is independent, with no caching or de-duplication of concurrent downloads.
 */
@Service
public class ArtifactRetrievalService {

  private static final Logger log = LoggerFactory.getLogger(ArtifactRetrievalService.class);

  private final ArtifactDescriptorResolver resolver;
  private final ContentFetcher fetcher;
  private final IntegrityValidator validator;
  private final DeliveryManager deliveryManager;
  private final HostEnvironment host;

  public ArtifactRetrievalService(
      ArtifactDescriptorResolver resolver,
      ContentFetcher fetcher,
      IntegrityValidator validator,
      DeliveryManager deliveryManager,
      HostEnvironment host) {
    this.resolver = resolver;
    this.fetcher = fetcher;
    this.validator = validator;
    this.deliveryManager = deliveryManager;
    this.host = host;
  }

  /**
   * Downloads the referenced file to the user. On failure the user is notified with the reason and
   * the returned future completes exceptionally with the underlying exception.
   */
  public CompletableFuture<DeliveryReceipt> download(StoredFileReference reference) {
    ArtifactDescriptor descriptor;
    try {
      descriptor = resolver.resolve(reference);
    } catch (RuntimeException e) {
      return failed(e);
    }
    return download(descriptor);
  }

  public CompletableFuture<DeliveryReceipt> download(ArtifactDescriptor descriptor) {
    CompletableFuture<ArtifactPayload> fetched;
    try {
      fetched = fetcher.fetch(descriptor, RetrievalPurpose.DOWNLOAD);
    } catch (RuntimeException e) {
      return failed(e);
    }
    return settle(fetched.thenApply(validator::validate).thenApply(deliveryManager::deliver));
  }

  /** Fetches and validates content without presenting it. */
  public CompletableFuture<ValidatedPayload> fetchContent(StoredFileReference reference) {
    ArtifactDescriptor descriptor;
    try {
      descriptor = resolver.resolve(reference);
    } catch (RuntimeException e) {
      return failed(e);
    }
    CompletableFuture<ArtifactPayload> fetched;
    try {
      fetched = fetcher.fetch(descriptor, RetrievalPurpose.VIEW);
    } catch (RuntimeException e) {
      return failed(e);
    }
    return settle(fetched.thenApply(validator::validate));
  }

  /** URL for opening or printing the file in place. Inline files resolve to their data URI. */
  public String viewUrl(StoredFileReference reference) {
    return fetcher.locate(resolver.resolve(reference), RetrievalPurpose.VIEW);
  }

  public boolean isValid(StoredFileReference reference) {
    return resolver.isValid(reference);
  }

  private <T> CompletableFuture<T> settle(CompletableFuture<T> pipeline) {
    var result = new CompletableFuture<T>();
    pipeline.whenComplete(
        (value, error) -> {
          if (error == null) {
            result.complete(value);
          } else {
            Throwable cause = unwrap(error);
            notifyFailure(cause);
            result.completeExceptionally(cause);
          }
        });
    return result;
  }

  private <T> CompletableFuture<T> failed(Throwable error) {
    notifyFailure(error);
    return CompletableFuture.failedFuture(error);
  }

  private void notifyFailure(Throwable error) {
    log.warn("Download failed: {}", error.getMessage());
    host.notifyUser("Download failed: " + userDetail(error));
  }

  static String userDetail(Throwable error) {
    if (error instanceof ErrorResponseException response
        && response.getBody().getDetail() != null) {
      return response.getBody().getDetail();
    }
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
