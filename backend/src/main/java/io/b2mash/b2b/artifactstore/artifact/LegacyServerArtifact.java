package io.b2mash.b2b.artifactstore.artifact;

/**
 * Historical format: the object is served from the application-managed file path. At least one of
 * {@code fileName} and {@code fileId} is present.
 */
public record LegacyServerArtifact(String fileName, String fileId) implements ArtifactDescriptor {

  public LegacyServerArtifact {
    if (isBlank(fileName) && isBlank(fileId)) {
      throw new IllegalArgumentException("fileName or fileId is required");
    }
  }

  /** Identifier used in the file-serving path. The id wins over the name when both are set. */
  public String fileKey() {
    return isBlank(fileId) ? fileName : fileId;
  }

  @Override
  public String displayName() {
    return isBlank(fileName) ? null : fileName;
  }

  @Override
  public String declaredMimeType() {
    return null;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
