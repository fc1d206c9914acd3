package io.retailassist.access.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The role of a principal could not be determined (storage failure or deadline exceeded). Retry
 * safe. Must never be treated as "no role".
 */
public class RoleResolutionException extends ErrorResponseException {

  public RoleResolutionException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Role resolution unavailable");
    problem.setDetail(detail);
    problem.setProperty("code", AccessError.RESOLUTION_ERROR);
    return problem;
  }
}
