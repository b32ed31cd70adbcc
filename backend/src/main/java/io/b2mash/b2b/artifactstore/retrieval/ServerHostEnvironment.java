package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import io.b2mash.b2b.artifactstore.delivery.TransientHandle;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link HostEnvironment} for a server process: plain JDK HTTP client for fetches (no
 * authenticator, no cookies), the log for user notifications, and the delivery directory for
 * presented files.
 */
@Component
public class ServerHostEnvironment implements HostEnvironment {

  private static final Logger log = LoggerFactory.getLogger(ServerHostEnvironment.class);

  private final HttpClient httpClient;
  private final Duration requestTimeout;
  private final Path deliveryDirectory;

  @Autowired
  public ServerHostEnvironment(ArtifactStoreProperties properties) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(properties.fetch().connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        properties.fetch().requestTimeout(),
        properties.delivery().directory());
  }

  ServerHostEnvironment(HttpClient httpClient, Duration requestTimeout, Path deliveryDirectory) {
    this.httpClient = httpClient;
    this.requestTimeout = requestTimeout;
    this.deliveryDirectory = deliveryDirectory;
  }

  @Override
  public CompletableFuture<FetchResponse> fetchBytes(URI uri) {
    var request =
        HttpRequest.newBuilder(uri).GET().header("Accept", "*/*").timeout(requestTimeout).build();
    return httpClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
        .thenApply(
            response ->
                new FetchResponse(
                    response.statusCode(),
                    response.headers().firstValue("Content-Type").orElse(null),
                    response.body()));
  }

  @Override
  public void notifyUser(String message) {
    log.info("User notification: {}", message);
  }

  /** Writes the content to {@code <delivery-dir>/<random>/<fileName>}. */
  @Override
  public URI presentFile(TransientHandle handle, String fileName) {
    try {
      Path dir = Files.createDirectories(deliveryDirectory.resolve(UUID.randomUUID().toString()));
      Path target = dir.resolve(fileName).normalize();
      if (!target.getParent().equals(dir)) {
        throw new IllegalArgumentException("File name escapes the delivery directory");
      }
      Files.write(target, handle.content());
      return target.toUri();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + fileName, e);
    }
  }
}
