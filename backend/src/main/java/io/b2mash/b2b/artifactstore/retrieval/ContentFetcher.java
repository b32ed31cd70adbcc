package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.artifact.ArtifactDescriptor;
import io.b2mash.b2b.artifactstore.artifact.InlineArtifact;
import io.b2mash.b2b.artifactstore.artifact.LegacyServerArtifact;
import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import io.b2mash.b2b.artifactstore.artifact.RemoteArtifact;
import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import io.b2mash.b2b.artifactstore.exception.EmptyPayloadException;
import io.b2mash.b2b.artifactstore.exception.FetchException;
import io.b2mash.b2b.artifactstore.store.UrlNormalizer;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Retrieves artifact bytes. Remote and legacy artifacts are fetched with a single GET through the
 * {@link HostEnvironment}; inline artifacts are decoded without any network call. Nothing is
 * retried.
 */
@Component
public class ContentFetcher {

  private static final Logger log = LoggerFactory.getLogger(ContentFetcher.class);

  private final HostEnvironment host;
  private final UrlNormalizer urlNormalizer;
  private final String legacyBaseUrl;

  @Autowired
  public ContentFetcher(
      HostEnvironment host, UrlNormalizer urlNormalizer, ArtifactStoreProperties properties) {
    this(host, urlNormalizer, properties.legacy().baseUrl());
  }

  public ContentFetcher(
      HostEnvironment host, UrlNormalizer urlNormalizer, String legacyBaseUrl) {
    this.host = host;
    this.urlNormalizer = urlNormalizer;
    this.legacyBaseUrl = legacyBaseUrl;
  }

  /**
   * Fetches the artifact's content. The future fails with {@link FetchException} on a non-2xx
   * status or transport failure, and with {@link EmptyPayloadException} on a zero-length body.
   */
  public CompletableFuture<ArtifactPayload> fetch(
      ArtifactDescriptor descriptor, RetrievalPurpose purpose) {
    if (descriptor instanceof InlineArtifact inline) {
      try {
        DataUri data = DataUri.parse(inline.dataUri());
        if (data.content().length == 0) {
          return CompletableFuture.failedFuture(new EmptyPayloadException());
        }
        return CompletableFuture.completedFuture(
            new ArtifactPayload(descriptor, data.content(), data.mimeType(), "data:"));
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }
    }

    String url;
    try {
      url = locate(descriptor, purpose);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    String source = UrlNormalizer.redact(url);
    log.debug("Fetching {} for {}", source, purpose);

    CompletableFuture<FetchResponse> request;
    try {
      request = host.fetchBytes(toUri(url));
    } catch (RuntimeException e) {
      log.warn("Fetch of {} could not be started: {}", source, e.toString());
      return CompletableFuture.failedFuture(
          new FetchException("Network error while downloading file", e));
    }
    return request
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = error instanceof CompletionException ? error.getCause() : error;
                log.warn("Fetch of {} failed: {}", source, cause.toString());
                throw new FetchException("Network error while downloading file", cause);
              }
              if (!response.isSuccessful()) {
                log.warn("Fetch of {} returned status {}", source, response.statusCode());
                throw new FetchException(response.statusCode());
              }
              if (response.body().length == 0) {
                log.warn("Fetch of {} returned an empty body", source);
                throw new EmptyPayloadException();
              }
              return new ArtifactPayload(
                  descriptor, response.body(), response.contentType(), source);
            });
  }

  /**
   * URL the artifact is served from. Remote URLs get the document segment correction, and the
   * attachment flag when downloading. Inline artifacts resolve to their data URI.
   */
  public String locate(ArtifactDescriptor descriptor, RetrievalPurpose purpose) {
    if (descriptor instanceof RemoteArtifact remote) {
      String url =
          urlNormalizer.normalize(remote.deliveryUrl(), intendedType(remote), remote.storeId());
      return purpose == RetrievalPurpose.DOWNLOAD ? UrlNormalizer.withAttachmentFlag(url) : url;
    }
    if (descriptor instanceof LegacyServerArtifact legacy) {
      return legacyUrl(legacy);
    }
    if (descriptor instanceof InlineArtifact inline) {
      return inline.dataUri();
    }
    throw new IllegalArgumentException("Unknown descriptor " + descriptor);
  }

  /** Parses a located URL. Only http and https are fetched. */
  static URI toUri(String url) {
    URI uri = URI.create(url);
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("Unsupported URL scheme: " + scheme);
    }
    return uri;
  }

  String legacyUrl(LegacyServerArtifact legacy) {
    if (legacyBaseUrl == null || legacyBaseUrl.isBlank()) {
      throw new IllegalStateException("artifacts.legacy.base-url is not configured");
    }
    String base =
        legacyBaseUrl.endsWith("/")
            ? legacyBaseUrl.substring(0, legacyBaseUrl.length() - 1)
            : legacyBaseUrl;
    String key = URLEncoder.encode(legacy.fileKey(), StandardCharsets.UTF_8).replace("+", "%20");
    return base + "/files/" + key;
  }

  /**
   * Resource type the remote artifact should be served as. A recorded store type wins. Images keep
   * whatever URL they have; anything recognisably not an image is a document. With nothing to go
   * on, the URL's own segment is trusted.
   */
  static ResourceType intendedType(RemoteArtifact remote) {
    if (remote.resourceType() != null) {
      return remote.resourceType();
    }
    String mimeType = MimeTypes.normalize(remote.mimeType());
    if (mimeType.startsWith("image/")) {
      return ResourceType.IMAGE;
    }
    if (!MimeTypes.isPlaceholder(mimeType)) {
      return ResourceType.DOCUMENT;
    }
    String name = remote.originalName();
    if (name != null && name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      return ResourceType.DOCUMENT;
    }
    return UrlNormalizer.hasSegment(remote.deliveryUrl(), ResourceType.IMAGE)
        ? ResourceType.IMAGE
        : ResourceType.DOCUMENT;
  }
}
