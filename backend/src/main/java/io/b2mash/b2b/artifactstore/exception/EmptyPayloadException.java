package io.b2mash.b2b.artifactstore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The fetch succeeded but the body had zero length. Treated like a failed fetch. */
public class EmptyPayloadException extends ErrorResponseException {

  public EmptyPayloadException() {
    super(HttpStatus.BAD_GATEWAY, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Download failed");
    problem.setDetail("Downloaded file is empty");
    return problem;
  }
}
