package io.b2mash.b2b.artifactstore.retrieval;

/**
 * Raw response of a read-side GET. {@code contentType} is the response header as sent and is only
 * advisory.
 */
public record FetchResponse(int statusCode, String contentType, byte[] body) {

  public FetchResponse {
    body = body != null ? body : new byte[0];
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
