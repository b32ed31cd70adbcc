package io.b2mash.b2b.artifactstore.artifact;

/** Caller-supplied hint about what an upload is for. */
public enum UsageHint {
  /** A downloadable attachment (notice PDF, form submission). Classified from its MIME type. */
  ATTACHMENT,
  /** A gallery picture. Always stored as an image. */
  GALLERY_IMAGE
}
