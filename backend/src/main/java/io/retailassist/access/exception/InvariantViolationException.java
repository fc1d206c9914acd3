package io.retailassist.access.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A write would break a role invariant (dual role, second workspace, identity relink). Never
 * expected in normal flow; always aborts the enclosing transaction.
 */
public class InvariantViolationException extends ErrorResponseException {

  private final AccessError code;

  public InvariantViolationException(AccessError code, String detail) {
    super(HttpStatus.CONFLICT, createProblem(code, detail), null);
    this.code = code;
  }

  public AccessError getCode() {
    return code;
  }

  private static ProblemDetail createProblem(AccessError code, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Role invariant violation");
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
