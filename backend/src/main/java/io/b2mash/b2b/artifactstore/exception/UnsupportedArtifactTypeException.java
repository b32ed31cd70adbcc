package io.b2mash.b2b.artifactstore.exception;

import java.util.Collection;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class UnsupportedArtifactTypeException extends ErrorResponseException {

  public UnsupportedArtifactTypeException(String mimeType, Collection<String> allowedTypes) {
    super(HttpStatus.UNSUPPORTED_MEDIA_TYPE, createProblem(mimeType, allowedTypes), null);
  }

  private static ProblemDetail createProblem(String mimeType, Collection<String> allowedTypes) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    problem.setTitle("Unsupported file type");
    problem.setDetail("Only PDF and image files are allowed");
    problem.setProperty("mimeType", mimeType);
    problem.setProperty("allowedTypes", allowedTypes);
    return problem;
  }
}
