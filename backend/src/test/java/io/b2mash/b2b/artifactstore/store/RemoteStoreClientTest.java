package io.b2mash.b2b.artifactstore.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.classify.ImageTransformOptions;
import io.b2mash.b2b.artifactstore.classify.StoreOptions;
import io.b2mash.b2b.artifactstore.exception.StoreUploadException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RemoteStoreClientTest {

  private static final String BASE = "https://cdn.example.com/acme";
  private static final Path FILE = Path.of("staged.pdf");
  private static final StoreOptions DOCUMENT =
      StoreOptions.document("artifacts", "public", "application/pdf");
  private static final StoreOptions IMAGE =
      StoreOptions.image(
          "artifacts", "public", "image/png", new ImageTransformOptions("auto", "auto"));

  @Mock private ObjectStoreGateway gateway;

  private RemoteStoreClient client;

  @BeforeEach
  void setUp() {
    client = new RemoteStoreClient(gateway, new UrlNormalizer(BASE));
  }

  @Test
  void store_matchingResourceTypeHasNoWarning() {
    when(gateway.upload(FILE, DOCUMENT))
        .thenReturn(
            new StoredObject("artifacts/abc", BASE + "/raw/upload/artifacts/abc", "raw", 2048));

    var receipt = client.store(FILE, DOCUMENT);

    assertThat(receipt.mismatchWarning()).isEmpty();
    assertThat(receipt.result().storeId()).isEqualTo("artifacts/abc");
    assertThat(receipt.result().deliveryUrl()).isEqualTo(BASE + "/raw/upload/artifacts/abc");
    assertThat(receipt.result().resourceType()).isEqualTo(ResourceType.DOCUMENT);
    assertThat(receipt.result().byteSize()).isEqualTo(2048);
  }

  @Test
  void store_mismatchIsReportedAndUrlNormalized() {
    when(gateway.upload(FILE, DOCUMENT))
        .thenReturn(
            new StoredObject(
                "artifacts/abc", BASE + "/image/upload/artifacts/abc.pdf", "image", 2048));

    var receipt = client.store(FILE, DOCUMENT);

    assertThat(receipt.mismatchWarning())
        .hasValueSatisfying(
            warning -> {
              assertThat(warning.requested()).isEqualTo(ResourceType.DOCUMENT);
              assertThat(warning.reported()).isEqualTo("image");
              assertThat(warning.message()).contains("artifacts/abc");
            });
    assertThat(receipt.result().resourceType()).isEqualTo(ResourceType.DOCUMENT);
    assertThat(receipt.result().deliveryUrl())
        .doesNotContain("/image/upload/")
        .isEqualTo(BASE + "/raw/upload/artifacts/abc.pdf");
  }

  @Test
  void store_unknownReportedTypeCountsAsMismatch() {
    when(gateway.upload(FILE, IMAGE))
        .thenReturn(
            new StoredObject("artifacts/p1", BASE + "/image/upload/artifacts/p1", null, 10));

    var receipt = client.store(FILE, IMAGE);

    assertThat(receipt.mismatchWarning()).isPresent();
    assertThat(receipt.result().deliveryUrl()).isEqualTo(BASE + "/image/upload/artifacts/p1");
  }

  @Test
  void put_propagatesStoreFailure() {
    when(gateway.upload(any(), any()))
        .thenThrow(new StoreUploadException("Failed to upload file to storage", null));

    assertThatThrownBy(() -> client.put(FILE, DOCUMENT))
        .isInstanceOf(StoreUploadException.class);
  }

  @Test
  void delete_successIsRecorded() {
    var outcome = client.delete("artifacts/abc", ResourceType.DOCUMENT);

    verify(gateway).destroy("artifacts/abc", ResourceType.DOCUMENT);
    assertThat(outcome.attempted()).isTrue();
    assertThat(outcome.deleted()).isTrue();
  }

  @Test
  void delete_failureIsSwallowedButObservable() {
    doThrow(new IllegalStateException("store unavailable"))
        .when(gateway)
        .destroy("artifacts/abc", ResourceType.DOCUMENT);

    var outcome = client.delete("artifacts/abc", ResourceType.DOCUMENT);

    assertThat(outcome.attempted()).isTrue();
    assertThat(outcome.deleted()).isFalse();
    assertThat(outcome.failureReason()).isEqualTo("store unavailable");
  }

  @Test
  void delete_withoutStoreIdIsSkipped() {
    var outcome = client.delete(" ", ResourceType.DOCUMENT);

    assertThat(outcome.attempted()).isFalse();
    verify(gateway, never()).destroy(anyString(), any());
  }
}
