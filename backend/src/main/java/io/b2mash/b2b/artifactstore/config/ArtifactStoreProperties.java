package io.b2mash.b2b.artifactstore.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Configuration for artifact storage and retrieval.
 *
 * @param folder folder segment every stored object is placed under
 * @param deliveryBaseUrl public base of delivery URLs, e.g. {@code https://cdn.example.com/acme}
 * @param accessMode access mode requested for stored objects
 * @param legacy legacy application file-serving settings
 * @param staging upload staging settings
 * @param fetch read-path HTTP settings
 * @param delivery host delivery settings
 * @param image transform options attached to image uploads
 */
@ConfigurationProperties(prefix = "artifacts")
public record ArtifactStoreProperties(
    String folder,
    String deliveryBaseUrl,
    String accessMode,
    Legacy legacy,
    Staging staging,
    Fetch fetch,
    Delivery delivery,
    Image image) {

  public ArtifactStoreProperties {
    folder = folder == null || folder.isBlank() ? "artifacts" : folder;
    accessMode = accessMode == null || accessMode.isBlank() ? "public" : accessMode;
    legacy = legacy != null ? legacy : new Legacy(null);
    staging = staging != null ? staging : new Staging(null, null, null, null);
    fetch = fetch != null ? fetch : new Fetch(null, null);
    delivery = delivery != null ? delivery : new Delivery(null, null, null);
    image = image != null ? image : new Image(null, null);
  }

  /** @param baseUrl base of the legacy file-serving path; files live under {@code /files/<id>} */
  public record Legacy(String baseUrl) {}

  public record Staging(
      Path directory, DataSize maxSize, List<String> allowedTypes, Duration maxAge) {

    public Staging {
      directory =
          directory != null
              ? directory
              : Path.of(System.getProperty("java.io.tmpdir"), "artifact-staging");
      maxSize = maxSize != null ? maxSize : DataSize.ofMegabytes(10);
      allowedTypes =
          allowedTypes != null && !allowedTypes.isEmpty()
              ? List.copyOf(allowedTypes)
              : List.of("application/pdf", "image/jpeg", "image/jpg", "image/png", "image/gif");
      maxAge = maxAge != null ? maxAge : Duration.ofHours(1);
    }
  }

  public record Fetch(Duration connectTimeout, Duration requestTimeout) {

    public Fetch {
      connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
      requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(60);
    }
  }

  public record Delivery(Path directory, Duration handleReleaseDelay, Duration retention) {

    public Delivery {
      directory =
          directory != null
              ? directory
              : Path.of(System.getProperty("java.io.tmpdir"), "artifact-downloads");
      handleReleaseDelay = handleReleaseDelay != null ? handleReleaseDelay : Duration.ofSeconds(1);
      retention = retention != null ? retention : Duration.ofHours(24);
    }
  }

  public record Image(String quality, String fetchFormat) {

    public Image {
      quality = quality == null || quality.isBlank() ? "auto" : quality;
      fetchFormat = fetchFormat == null || fetchFormat.isBlank() ? "auto" : fetchFormat;
    }
  }
}
