package io.b2mash.b2b.artifactstore.store.s3;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.classify.StoreOptions;
import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import io.b2mash.b2b.artifactstore.config.S3Config.S3Properties;
import io.b2mash.b2b.artifactstore.exception.StoreUploadException;
import io.b2mash.b2b.artifactstore.store.ObjectStoreGateway;
import io.b2mash.b2b.artifactstore.store.StoredObject;
import io.b2mash.b2b.artifactstore.store.UrlNormalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * S3 implementation of {@link ObjectStoreGateway}. All AWS SDK types are confined to this class.
 *
 * <p>Objects are keyed {@code <segment>/upload/<storeId>} with {@code storeId =
 * <folder>/<uuid>}, so {@code artifacts.delivery-base-url} pointed at the bucket (or a CDN in front
 * of it) yields delivery URLs of the usual shape.
 */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3", matchIfMissing = true)
public class S3ObjectStoreGateway implements ObjectStoreGateway {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreGateway.class);

  private static final Pattern FOLDER_PATTERN =
      Pattern.compile("^[A-Za-z0-9_-]+(/[A-Za-z0-9_-]+)*$");

  private final S3Client s3Client;
  private final String bucketName;
  private final String deliveryBaseUrl;
  private final Supplier<String> idGenerator;

  @Autowired
  public S3ObjectStoreGateway(
      S3Client s3Client, S3Properties s3Properties, ArtifactStoreProperties properties) {
    this(
        s3Client,
        s3Properties.bucketName(),
        properties.deliveryBaseUrl(),
        () -> UUID.randomUUID().toString());
  }

  S3ObjectStoreGateway(
      S3Client s3Client, String bucketName, String deliveryBaseUrl, Supplier<String> idGenerator) {
    this.s3Client = s3Client;
    this.bucketName = bucketName;
    this.deliveryBaseUrl = deliveryBaseUrl;
    this.idGenerator = idGenerator;
  }

  @Override
  public StoredObject upload(Path localFile, StoreOptions options) {
    validateFolder(options.folder());
    String baseUrl = deliveryBaseUrl();
    String storeId = options.folder() + "/" + idGenerator.get();
    String key = key(storeId, options.resourceType());

    long size;
    try {
      size = Files.size(localFile);
    } catch (IOException e) {
      throw new UncheckedIOException("Staged file is not readable", e);
    }

    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(options.contentType())
            .contentLength(size)
            .metadata(metadata(options))
            .build();
    try {
      s3Client.putObject(putRequest, RequestBody.fromFile(localFile));
    } catch (SdkException e) {
      log.warn("S3 upload failed for key={}: {}", key, e.getMessage());
      throw new StoreUploadException("Failed to upload file to storage", e);
    }

    String url = UrlNormalizer.buildDeliveryUrl(baseUrl, options.resourceType(), storeId);
    return new StoredObject(storeId, url, options.resourceType().pathSegment(), size);
  }

  @Override
  public void destroy(String storeId, ResourceType resourceType) {
    var deleteRequest =
        DeleteObjectRequest.builder().bucket(bucketName).key(key(storeId, resourceType)).build();
    s3Client.deleteObject(deleteRequest);
  }

  @Override
  public String deliveryBaseUrl() {
    if (deliveryBaseUrl == null || deliveryBaseUrl.isBlank()) {
      throw new IllegalStateException("artifacts.delivery-base-url is not configured");
    }
    return deliveryBaseUrl;
  }

  static String key(String storeId, ResourceType resourceType) {
    return resourceType.pathSegment() + "/upload/" + storeId;
  }

  /** Store parameters as user metadata. Keys use hyphens, which survive as HTTP header names. */
  static Map<String, String> metadata(StoreOptions options) {
    var metadata = new LinkedHashMap<String, String>();
    options.toParameters().forEach((name, value) -> metadata.put(name.replace('_', '-'), value));
    options.transform().ifPresent(t -> metadata.put("transform", t.directive()));
    return metadata;
  }

  private static void validateFolder(String folder) {
    if (folder == null || !FOLDER_PATTERN.matcher(folder).matches()) {
      throw new IllegalArgumentException("Invalid storage folder");
    }
  }
}
