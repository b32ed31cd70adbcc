package io.b2mash.b2b.artifactstore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class DeliveryException extends ErrorResponseException {

  public DeliveryException(String fileName, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(fileName, cause), cause);
  }

  private static ProblemDetail createProblem(String fileName, Throwable cause) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Delivery failed");
    problem.setDetail(
        "Could not present file "
            + fileName
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""));
    problem.setProperty("fileName", fileName);
    return problem;
  }
}
