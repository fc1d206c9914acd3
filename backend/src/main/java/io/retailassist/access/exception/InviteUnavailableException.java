package io.retailassist.access.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * An invitation cannot be previewed or accepted. The response body is identical for every reason
 * so the public endpoints do not reveal whether a token exists, was used, was revoked or expired;
 * {@link #getReason()} keeps the precise cause for logs.
 */
public class InviteUnavailableException extends ErrorResponseException {

  public static final String GENERIC_DETAIL = "This invitation is invalid or has expired.";

  private final AccessError reason;

  public InviteUnavailableException(AccessError reason) {
    super(HttpStatus.GONE, createProblem(), null);
    this.reason = reason;
  }

  public AccessError getReason() {
    return reason;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle("Invitation unavailable");
    problem.setDetail(GENERIC_DETAIL);
    problem.setProperty("code", AccessError.INVITE_UNAVAILABLE);
    return problem;
  }
}
