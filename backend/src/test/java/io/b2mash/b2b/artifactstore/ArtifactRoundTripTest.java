package io.b2mash.b2b.artifactstore;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpServer;
import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.artifact.StoredFileReference;
import io.b2mash.b2b.artifactstore.artifact.UsageHint;
import io.b2mash.b2b.artifactstore.classify.ResourceTypeClassifier;
import io.b2mash.b2b.artifactstore.classify.StoreOptions;
import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import io.b2mash.b2b.artifactstore.delivery.DeliveryManager;
import io.b2mash.b2b.artifactstore.event.ArtifactStoredEvent;
import io.b2mash.b2b.artifactstore.integrity.IntegrityValidator;
import io.b2mash.b2b.artifactstore.retrieval.ArtifactDescriptorResolver;
import io.b2mash.b2b.artifactstore.retrieval.ArtifactRetrievalService;
import io.b2mash.b2b.artifactstore.retrieval.ContentFetcher;
import io.b2mash.b2b.artifactstore.retrieval.ServerHostEnvironment;
import io.b2mash.b2b.artifactstore.staging.UploadStagingArea;
import io.b2mash.b2b.artifactstore.store.ObjectStoreGateway;
import io.b2mash.b2b.artifactstore.store.RemoteStoreClient;
import io.b2mash.b2b.artifactstore.store.StoredObject;
import io.b2mash.b2b.artifactstore.store.UrlNormalizer;
import io.b2mash.b2b.artifactstore.upload.ArtifactUploadService;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Upload through a store that misreports resource types, then download what it serves. */
class ArtifactRoundTripTest {

  @TempDir Path tempDir;

  private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
  private final List<Object> events = new CopyOnWriteArrayList<>();
  private ExecutorService serverExecutor;
  private HttpServer httpServer;
  private ThreadPoolTaskScheduler scheduler;
  private ArtifactStoreProperties properties;

  @BeforeEach
  void setUp() throws IOException {
    serverExecutor = Executors.newSingleThreadExecutor();
    httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    httpServer.createContext(
        "/store/",
        exchange -> {
          byte[] body = objects.get(exchange.getRequestURI().getPath().substring(7));
          if (body == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
          }
          exchange.getResponseHeaders().add("Content-Type", "application/octet-stream");
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    httpServer.setExecutor(serverExecutor);
    httpServer.start();
    String storeBase = "http://127.0.0.1:" + httpServer.getAddress().getPort() + "/store";

    properties =
        new ArtifactStoreProperties(
            "artifacts",
            storeBase,
            "public",
            null,
            new ArtifactStoreProperties.Staging(tempDir.resolve("staging"), null, null, null),
            null,
            new ArtifactStoreProperties.Delivery(tempDir.resolve("downloads"), null, null),
            null);

    scheduler = new ThreadPoolTaskScheduler();
    scheduler.initialize();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
    httpServer.stop(0);
    serverExecutor.shutdownNow();
  }

  /** Keeps objects under the requested segment but always claims to have stored an image. */
  private ObjectStoreGateway misreportingStore(String baseUrl) {
    return new ObjectStoreGateway() {
      @Override
      public StoredObject upload(Path localFile, StoreOptions options) {
        String storeId = options.folder() + "/obj-" + objects.size();
        try {
          byte[] content = Files.readAllBytes(localFile);
          objects.put(options.resourceType().pathSegment() + "/upload/" + storeId, content);
          return new StoredObject(
              storeId, baseUrl + "/image/upload/" + storeId, "image", content.length);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }

      @Override
      public void destroy(String storeId, ResourceType resourceType) {
        objects.remove(resourceType.pathSegment() + "/upload/" + storeId);
      }

      @Override
      public String deliveryBaseUrl() {
        return baseUrl;
      }
    };
  }

  @Test
  void uploadedDocumentDownloadsWithPdfSignature() throws Exception {
    var normalizer = new UrlNormalizer(properties);
    var uploadService =
        new ArtifactUploadService(
            new UploadStagingArea(properties),
            new ResourceTypeClassifier(properties),
            new RemoteStoreClient(misreportingStore(properties.deliveryBaseUrl()), normalizer),
            events::add);
    var host = new ServerHostEnvironment(properties);
    var retrievalService =
        new ArtifactRetrievalService(
            new ArtifactDescriptorResolver(),
            new ContentFetcher(host, normalizer, properties),
            new IntegrityValidator(),
            new DeliveryManager(host, scheduler, properties),
            host);

    byte[] pdf = "%PDF-1.4\n1 0 obj <<>> endobj\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);
    var uploaded =
        uploadService.upload(
            "notice",
            "Board: notice",
            "application/pdf",
            new ByteArrayInputStream(pdf),
            UsageHint.ATTACHMENT);

    assertThat(uploaded.result().deliveryUrl()).doesNotContain("/image/upload/");
    assertThat(events).singleElement().isInstanceOf(ArtifactStoredEvent.class);
    try (Stream<Path> staged = Files.list(properties.staging().directory())) {
      assertThat(staged).isEmpty();
    }

    var artifact = uploaded.artifact();
    var reference =
        StoredFileReference.remote(
            artifact.deliveryUrl(),
            artifact.storeId(),
            artifact.originalName(),
            artifact.byteSize(),
            artifact.mimeType());
    var receipt = retrievalService.download(reference).get(10, TimeUnit.SECONDS);

    assertThat(receipt.fileName()).isEqualTo("Board_ notice.pdf");
    assertThat(receipt.mimeType()).isEqualTo("application/pdf");
    assertThat(receipt.warnings()).isEmpty();
    byte[] delivered = Files.readAllBytes(Path.of(receipt.location()));
    assertThat(Arrays.copyOf(delivered, 4)).isEqualTo("%PDF".getBytes(StandardCharsets.US_ASCII));
    assertThat(delivered).isEqualTo(pdf);
  }
}
