package io.b2mash.b2b.artifactstore.retrieval;

public enum RetrievalPurpose {
  /** Open in place. */
  VIEW,
  /** Save to disk; remote URLs get the attachment flag. */
  DOWNLOAD
}
