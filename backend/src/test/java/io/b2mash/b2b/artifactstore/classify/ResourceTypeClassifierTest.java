package io.b2mash.b2b.artifactstore.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import io.b2mash.b2b.artifactstore.artifact.ResourceType;
import io.b2mash.b2b.artifactstore.artifact.UsageHint;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResourceTypeClassifierTest {

  private static final ImageTransformOptions AUTO = new ImageTransformOptions("auto", "auto");

  @TempDir Path tempDir;

  private final ResourceTypeClassifier classifier =
      new ResourceTypeClassifier(new Tika(), "artifacts", "public", AUTO);

  @Test
  void classify_pdfIsDocumentWithoutTransforms() {
    var options = classifier.classify("application/pdf", UsageHint.ATTACHMENT, null);

    assertThat(options.resourceType()).isEqualTo(ResourceType.DOCUMENT);
    assertThat(options.transform()).isEmpty();
    assertThat(options.contentType()).isEqualTo("application/pdf");
    assertThat(options.folder()).isEqualTo("artifacts");
    assertThat(options.toParameters())
        .containsEntry("resource_type", "raw")
        .doesNotContainKeys("quality", "fetch_format");
  }

  @Test
  void classify_pngIsImageWithTransforms() {
    var options = classifier.classify("image/png", UsageHint.ATTACHMENT, null);

    assertThat(options.resourceType()).isEqualTo(ResourceType.IMAGE);
    assertThat(options.transform()).contains(AUTO);
    assertThat(options.toParameters())
        .containsEntry("resource_type", "image")
        .containsEntry("quality", "auto")
        .containsEntry("fetch_format", "auto");
  }

  @Test
  void classify_declaredTypeIsNormalized() {
    var options =
        classifier.classify("Application/PDF; charset=binary", UsageHint.ATTACHMENT, null);

    assertThat(options.resourceType()).isEqualTo(ResourceType.DOCUMENT);
    assertThat(options.contentType()).isEqualTo("application/pdf");
  }

  @Test
  void classify_galleryHintAlwaysStoresImageUnderGalleryFolder() {
    var options = classifier.classify(null, UsageHint.GALLERY_IMAGE, null);

    assertThat(options.resourceType()).isEqualTo(ResourceType.IMAGE);
    assertThat(options.folder()).isEqualTo("artifacts/gallery");
    assertThat(options.transform()).isPresent();
  }

  @Test
  void classify_genericTypeIsSniffedFromContent() throws IOException {
    Path file = tempDir.resolve("staged-pdf");
    Files.write(file, "%PDF-1.4\n1 0 obj\n<<>>\nendobj\n".getBytes(StandardCharsets.US_ASCII));

    var options = classifier.classify("application/octet-stream", UsageHint.ATTACHMENT, file);

    assertThat(options.contentType()).isEqualTo("application/pdf");
    assertThat(options.resourceType()).isEqualTo(ResourceType.DOCUMENT);
  }

  @Test
  void classify_sniffedImageGetsTransforms() throws IOException {
    Path file = tempDir.resolve("upload");
    Files.write(
        file,
        new byte[] {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D, 'I', 'H'});

    var options = classifier.classify(null, UsageHint.ATTACHMENT, file);

    assertThat(options.contentType()).isEqualTo("image/png");
    assertThat(options.resourceType()).isEqualTo(ResourceType.IMAGE);
    assertThat(options.transform()).isPresent();
  }

  @Test
  void classify_unrecognisedContentDefaultsToGenericBinaryDocument() throws IOException {
    Path file = tempDir.resolve("blob");
    Files.write(file, new byte[] {0x00, 0x01, 0x02, (byte) 0xFE, 0x00, 0x7F});

    var options = classifier.classify("", UsageHint.ATTACHMENT, file);

    assertThat(options.contentType()).isEqualTo(MimeTypes.GENERIC_BINARY);
    assertThat(options.resourceType()).isEqualTo(ResourceType.DOCUMENT);
    assertThat(options.transform()).isEmpty();
  }

  @Test
  void resourceTypeFor_unknownTypeIsDocument() {
    assertThat(classifier.resourceTypeFor("application/zip", UsageHint.ATTACHMENT))
        .isEqualTo(ResourceType.DOCUMENT);
    assertThat(classifier.resourceTypeFor("image/jpeg", UsageHint.ATTACHMENT))
        .isEqualTo(ResourceType.IMAGE);
  }

  @Test
  void storeOptions_rejectTransformsForDocuments() {
    assertThatThrownBy(
            () ->
                new StoreOptions(
                    "artifacts", ResourceType.DOCUMENT, "public", "application/pdf", AUTO))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("DOCUMENT");
  }

  @Test
  void imageTransformOptions_directiveCombinesQualityAndFormat() {
    assertThat(new ImageTransformOptions("auto:good", "webp").directive())
        .isEqualTo("q_auto:good,f_webp");
  }
}
