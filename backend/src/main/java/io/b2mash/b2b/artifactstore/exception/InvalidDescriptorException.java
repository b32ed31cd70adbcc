package io.b2mash.b2b.artifactstore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidDescriptorException extends ErrorResponseException {

  public InvalidDescriptorException() {
    this("File reference has no delivery URL, file name, file id or embedded data");
  }

  public InvalidDescriptorException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid file reference");
    problem.setDetail(detail);
    return problem;
  }
}
