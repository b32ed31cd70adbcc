package io.b2mash.b2b.artifactstore.store;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Repairs delivery URLs whose type segment disagrees with the artifact's resource type. Delivery
 * URLs have the shape {@code <base>/<segment>/upload/<storeId>[.ext]}; documents must never be
 * served through the {@code image} segment.
 */
@Component
public class UrlNormalizer {

  private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

  /** Query flag asking the delivery edge to serve the object as an attachment. */
  public static final String ATTACHMENT_FLAG = "fl_attachment";

  private static final String IMAGE_PATH = "/" + ResourceType.IMAGE.pathSegment() + "/upload/";
  private static final String RAW_PATH = "/" + ResourceType.DOCUMENT.pathSegment() + "/upload/";

  private static final Pattern DELIVERY_PATH = Pattern.compile("^(.+?)/([a-z]+)/upload/");
  private static final Pattern STORE_ID_EXTENSION =
      Pattern.compile("\\.(pdf|jpg|jpeg|png|gif)$", Pattern.CASE_INSENSITIVE);

  private final String fallbackBaseUrl;

  @Autowired
  public UrlNormalizer(ArtifactStoreProperties properties) {
    this(properties.deliveryBaseUrl());
  }

  public UrlNormalizer(String fallbackBaseUrl) {
    this.fallbackBaseUrl = stripTrailingSlash(fallbackBaseUrl);
  }

  /**
   * Returns a URL whose type segment matches {@code intended}. Image URLs are returned unchanged.
   * For documents, the image segment is rewritten to the raw segment; if the URL belongs to the
   * store but still does not carry the raw segment, it is rebuilt from the store base and {@code
   * storeId}.
   */
  public String normalize(String url, ResourceType intended, String storeId) {
    if (url == null || intended != ResourceType.DOCUMENT) {
      return url;
    }

    String normalized = url;
    if (normalized.contains(IMAGE_PATH)) {
      normalized = normalized.replace(IMAGE_PATH, RAW_PATH);
      log.debug("Rewrote image delivery URL to raw: {}", redact(normalized));
    }

    if (!hasSegment(normalized, ResourceType.DOCUMENT) && storeId != null && !storeId.isBlank()) {
      Optional<String> base = storeBaseOf(normalized);
      if (base.isPresent()) {
        normalized = buildDeliveryUrl(base.get(), ResourceType.DOCUMENT, storeId);
        log.debug("Rebuilt delivery URL from store id: {}", normalized);
      }
    }
    return normalized;
  }

  /** Builds {@code <base>/<segment>/upload/<storeId>}, stripping any file extension from the id. */
  public static String buildDeliveryUrl(String baseUrl, ResourceType type, String storeId) {
    String cleanId = STORE_ID_EXTENSION.matcher(storeId).replaceFirst("");
    while (cleanId.startsWith("/")) {
      cleanId = cleanId.substring(1);
    }
    return stripTrailingSlash(baseUrl) + "/" + type.pathSegment() + "/upload/" + cleanId;
  }

  /** Builds a delivery URL under the configured store base. */
  public String deliveryUrlFor(String storeId, ResourceType type) {
    if (fallbackBaseUrl == null) {
      throw new IllegalStateException("artifacts.delivery-base-url is not configured");
    }
    return buildDeliveryUrl(fallbackBaseUrl, type, storeId);
  }

  public static boolean hasSegment(String url, ResourceType type) {
    return url != null && url.contains("/" + type.pathSegment() + "/upload/");
  }

  /** Appends the attachment flag unless already present. */
  public static String withAttachmentFlag(String url) {
    if (url.contains(ATTACHMENT_FLAG)) {
      return url;
    }
    String separator = url.contains("?") ? "&" : "?";
    return url + separator + ATTACHMENT_FLAG;
  }

  /** URL without query string, for logs. */
  public static String redact(String url) {
    if (url == null) {
      return null;
    }
    int query = url.indexOf('?');
    return query >= 0 ? url.substring(0, query) : url;
  }

  /**
   * Base of a URL served by the store: the part before {@code /<segment>/upload/}, or the
   * configured base when the URL starts with it. Foreign URLs have no store base.
   */
  private Optional<String> storeBaseOf(String url) {
    Matcher matcher = DELIVERY_PATH.matcher(url);
    if (matcher.find()) {
      return Optional.of(matcher.group(1));
    }
    if (fallbackBaseUrl != null && url.startsWith(fallbackBaseUrl + "/")) {
      return Optional.of(fallbackBaseUrl);
    }
    return Optional.empty();
  }

  private static String stripTrailingSlash(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    String result = url.trim();
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
