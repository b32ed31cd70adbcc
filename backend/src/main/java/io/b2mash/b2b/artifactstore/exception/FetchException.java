package io.b2mash.b2b.artifactstore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Retrieval returned a non-2xx status, or the transport failed before a status was received (status
 * code 0). Never retried.
 */
public class FetchException extends ErrorResponseException {

  private final int upstreamStatus;

  public FetchException(int statusCode) {
    super(
        HttpStatus.BAD_GATEWAY,
        createProblem(statusCode, "HTTP error, status: " + statusCode),
        null);
    this.upstreamStatus = statusCode;
  }

  public FetchException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(0, detail), cause);
    this.upstreamStatus = 0;
  }

  /** Status returned by the remote host, or 0 when no response was received. */
  public int getUpstreamStatus() {
    return upstreamStatus;
  }

  private static ProblemDetail createProblem(int statusCode, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Download failed");
    problem.setDetail(detail);
    if (statusCode > 0) {
      problem.setProperty("statusCode", statusCode);
    }
    return problem;
  }
}
