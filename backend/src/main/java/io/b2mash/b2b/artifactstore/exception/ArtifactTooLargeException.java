package io.b2mash.b2b.artifactstore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ArtifactTooLargeException extends ErrorResponseException {

  public ArtifactTooLargeException(long maxBytes, long actualBytes) {
    super(HttpStatus.PAYLOAD_TOO_LARGE, createProblem(maxBytes, actualBytes), null);
  }

  private static ProblemDetail createProblem(long maxBytes, long actualBytes) {
    var problem = ProblemDetail.forStatus(HttpStatus.PAYLOAD_TOO_LARGE);
    problem.setTitle("File too large");
    problem.setDetail(
        "File too large: " + actualBytes + " bytes exceeds maximum of " + maxBytes + " bytes");
    problem.setProperty("maxBytes", maxBytes);
    problem.setProperty("actualBytes", actualBytes);
    return problem;
  }
}
