package io.b2mash.b2b.artifactstore.artifact;

import java.util.Objects;

/** Oldest format: the content is embedded as a {@code data:} URI. No network fetch is needed. */
public record InlineArtifact(String dataUri, String displayName) implements ArtifactDescriptor {

  public InlineArtifact {
    Objects.requireNonNull(dataUri, "dataUri");
    if (dataUri.isBlank()) {
      throw new IllegalArgumentException("dataUri must not be blank");
    }
  }

  @Override
  public String declaredMimeType() {
    int colon = dataUri.indexOf(':');
    int end = dataUri.indexOf(';');
    if (end < 0) {
      end = dataUri.indexOf(',');
    }
    if (colon < 0 || end <= colon + 1) {
      return null;
    }
    return dataUri.substring(colon + 1, end);
  }
}
