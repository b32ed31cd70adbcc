package io.b2mash.b2b.artifactstore.integrity;

import io.b2mash.b2b.artifactstore.artifact.ArtifactDescriptor;
import io.b2mash.b2b.artifactstore.artifact.MimeTypes;
import io.b2mash.b2b.artifactstore.retrieval.ArtifactPayload;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks fetched content against the signature expected from its file name or declared type, and
 * settles the MIME type the content is delivered with. A signature mismatch is a warning only:
 * some stores alter leading bytes in transit, so delivery always proceeds.
 */
@Component
public class IntegrityValidator {

  private static final Logger log = LoggerFactory.getLogger(IntegrityValidator.class);

  public ValidatedPayload validate(ArtifactPayload payload) {
    ArtifactDescriptor descriptor = payload.descriptor();
    String fileName = descriptor.displayName();
    byte[] content = payload.content();
    String reported = MimeTypes.normalize(payload.reportedMimeType());

    Optional<FileSignature> expected = expectedSignature(descriptor);
    List<ValidationWarning> warnings = new ArrayList<>();
    String mimeType;

    if (expected.isPresent()) {
      FileSignature signature = expected.get();
      boolean matches = signature.matches(content);
      if (!matches) {
        var warning =
            new ValidationWarning(
                fileName,
                signature,
                "Content does not start with the " + signature.name() + " signature");
        log.warn("Integrity check for {}: {}", fileName, warning.message());
        warnings.add(warning);
      }
      // placeholders always take the expected type; other reported types only when bytes agree
      mimeType = MimeTypes.isPlaceholder(reported) || matches ? signature.mimeType() : reported;
    } else if (MimeTypes.isPlaceholder(reported)) {
      mimeType =
          FileSignature.detect(content)
              .map(FileSignature::mimeType)
              .orElse(MimeTypes.GENERIC_BINARY);
    } else {
      mimeType = reported;
    }

    if (!mimeType.equals(reported)) {
      log.debug("Reconciled content type of {} from '{}' to '{}'", fileName, reported, mimeType);
    }
    return new ValidatedPayload(descriptor, content, mimeType, warnings);
  }

  /** File name extension first, declared MIME type second. */
  static Optional<FileSignature> expectedSignature(ArtifactDescriptor descriptor) {
    Optional<FileSignature> byName = FileSignature.forExtension(descriptor.displayName());
    return byName.isPresent() ? byName : FileSignature.forMimeType(descriptor.declaredMimeType());
  }
}
