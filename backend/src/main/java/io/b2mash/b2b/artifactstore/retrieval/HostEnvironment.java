package io.b2mash.b2b.artifactstore.retrieval;

import io.b2mash.b2b.artifactstore.delivery.TransientHandle;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Host capabilities the read path depends on. Production binds them to the network and the local
 * filesystem; tests bind them to in-memory fakes.
 */
public interface HostEnvironment {

  /**
   * Issues a single unauthenticated GET. The future completes with any response status; it only
   * completes exceptionally when no response was received.
   */
  CompletableFuture<FetchResponse> fetchBytes(URI uri);

  /** Shows a message to the user who started the operation. */
  void notifyUser(String message);

  /**
   * Presents the handle's content to the user as a file named {@code fileName}.
   *
   * @return where the file was presented
   * @throws RuntimeException if the host could not present the file
   */
  URI presentFile(TransientHandle handle, String fileName);
}
