package io.retailassist.access.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The authenticated subject is not linked to any user (no principal bound for the request). */
public class UnknownPrincipalException extends ErrorResponseException {

  public UnknownPrincipalException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Unknown principal");
    problem.setDetail("The authenticated subject is not linked to a user");
    problem.setProperty("code", AccessError.UNKNOWN_PRINCIPAL);
    return problem;
  }
}
