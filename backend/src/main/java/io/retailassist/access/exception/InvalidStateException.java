package io.retailassist.access.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A state transition was requested from a state that does not allow it. */
public class InvalidStateException extends ErrorResponseException {

  private final AccessError code;

  public InvalidStateException(AccessError code, String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(code, title, detail), null);
    this.code = code;
  }

  public AccessError getCode() {
    return code;
  }

  private static ProblemDetail createProblem(AccessError code, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
