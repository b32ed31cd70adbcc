package io.b2mash.b2b.artifactstore.upload;

import io.b2mash.b2b.artifactstore.store.DeleteOutcome;

public record Replacement(UploadedArtifact uploaded, DeleteOutcome previousDelete) {}
