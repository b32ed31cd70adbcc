package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.artifact.ArtifactDescriptor;
import io.b2mash.b2b.artifactstore.artifact.InlineArtifact;
import io.b2mash.b2b.artifactstore.artifact.LegacyServerArtifact;
import io.b2mash.b2b.artifactstore.artifact.RemoteArtifact;
import io.b2mash.b2b.artifactstore.artifact.StoredFileReference;
import io.b2mash.b2b.artifactstore.exception.InvalidDescriptorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the retrieval strategy for a persisted file reference. First match wins: delivery URL, then
 * legacy file name or id, then embedded data. Records migrated to the remote store may still carry
 * their legacy fields, so the remote shape always takes priority.
 */
@Component
public class ArtifactDescriptorResolver {

  private static final Logger log = LoggerFactory.getLogger(ArtifactDescriptorResolver.class);

  public ArtifactDescriptor resolve(StoredFileReference reference) {
    if (reference == null) {
      throw new InvalidDescriptorException();
    }

    if (present(reference.deliveryUrl())) {
      log.debug("Resolved file reference to remote retrieval");
      return new RemoteArtifact(
          reference.storeId(),
          reference.deliveryUrl(),
          firstPresent(reference.originalName(), reference.name(), reference.fileName()),
          reference.size() != null ? reference.size() : 0L,
          reference.mimeType());
    }
    if (present(reference.fileName()) || present(reference.fileId())) {
      log.debug("Resolved file reference to legacy server retrieval");
      return new LegacyServerArtifact(reference.fileName(), reference.fileId());
    }
    if (present(reference.dataUri())) {
      log.debug("Resolved file reference to inline retrieval");
      return new InlineArtifact(
          reference.dataUri(), firstPresent(reference.name(), reference.originalName()));
    }
    throw new InvalidDescriptorException();
  }

  /** True when at least one retrieval strategy applies to the reference. */
  public boolean isValid(StoredFileReference reference) {
    return reference != null
        && (present(reference.deliveryUrl())
            || present(reference.fileName())
            || present(reference.fileId())
            || present(reference.dataUri()));
  }

  private static boolean present(String value) {
    return value != null && !value.isBlank();
  }

  private static String firstPresent(String... values) {
    for (String value : values) {
      if (present(value)) {
        return value;
      }
    }
    return null;
  }
}
