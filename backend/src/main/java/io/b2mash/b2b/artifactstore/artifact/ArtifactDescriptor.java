package io.b2mash.b2b.artifactstore.artifact;

/**
 * Reference to a stored file in one of the three supported shapes. Exactly one shape exists per
 * instance; callers holding persisted records with loose optional fields go through {@code
 * ArtifactDescriptorResolver}, which picks the shape in the fixed Remote, Legacy, Inline order.
 */
public sealed interface ArtifactDescriptor
    permits RemoteArtifact, LegacyServerArtifact, InlineArtifact {

  /** Best available name for display, before extension inference and sanitization. */
  String displayName();

  /** Declared MIME type, or null when the shape does not carry one. */
  String declaredMimeType();
}
