package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.artifact.ArtifactDescriptor;

/**
 * Fetched content of an artifact, before integrity checks.
 *
 * @param descriptor the artifact the bytes belong to
 * @param content the bytes, never empty
 * @param reportedMimeType MIME type reported by the source (response header or data URI header)
 * @param source where the bytes came from, without query string; {@code data:} for inline content
 */
public record ArtifactPayload(
    ArtifactDescriptor descriptor, byte[] content, String reportedMimeType, String source) {}
