package io.retailassist.access.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The external identity provider rejected or failed an account operation. */
public class IdentityProviderException extends ErrorResponseException {

  public IdentityProviderException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Identity provider error");
    problem.setDetail(detail);
    problem.setProperty("code", AccessError.IDENTITY_PROVIDER_UNAVAILABLE);
    return problem;
  }
}
