package io.b2mash.b2b.artifactstore.integrity;

import io.b2mash.b2b.artifactstore.artifact.ArtifactDescriptor;
import java.util.List;

/**
 * Payload after integrity checks. {@code mimeType} is the reconciled type; {@code warnings} lists
 * checks that failed without stopping delivery.
 */
public record ValidatedPayload(
    ArtifactDescriptor descriptor,
    byte[] content,
    String mimeType,
    List<ValidationWarning> warnings) {

  public ValidatedPayload {
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
