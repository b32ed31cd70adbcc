package io.b2mash.b2b.artifactstore.delivery;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Short-lived, exclusively owned reference to in-memory content, used for exactly one delivery. The
 * download call that creates a handle also releases it; content is unreadable afterwards.
 */
public final class TransientHandle {

  private final String mimeType;
  private final long size;
  private final AtomicReference<byte[]> content;

  public TransientHandle(byte[] content, String mimeType) {
    this.content = new AtomicReference<>(content);
    this.mimeType = mimeType;
    this.size = content.length;
  }

  /**
   * @throws IllegalStateException if the handle was already released
   */
  public byte[] content() {
    byte[] bytes = content.get();
    if (bytes == null) {
      throw new IllegalStateException("Transient handle already released");
    }
    return bytes;
  }

  public String mimeType() {
    return mimeType;
  }

  public long size() {
    return size;
  }

  public boolean isReleased() {
    return content.get() == null;
  }

  /** Drops the content. Safe to call more than once. */
  public void release() {
    content.set(null);
  }
}
