package io.b2mash.b2b.artifactstore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The remote store rejected or failed a put (network, auth, quota). The detail never carries store
 * credentials or local staging paths.
 */
public class StoreUploadException extends ErrorResponseException {

  public StoreUploadException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Upload failed");
    problem.setDetail(detail);
    return problem;
  }
}
