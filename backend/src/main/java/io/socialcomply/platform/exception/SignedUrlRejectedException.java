package io.socialcomply.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SignedUrlRejectedException extends ErrorResponseException {

  public SignedUrlRejectedException(String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Signed URL rejected");
    problem.setDetail(detail);
    return problem;
  }
}
