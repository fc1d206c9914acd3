package io.retailassist.access.exception;

/**
 * Machine-readable error codes. Exposed as the {@code code} property of problem responses, except
 * for the invite terminal states which collapse to {@link #INVITE_UNAVAILABLE} on the wire and keep
 * their precise code only in logs.
 */
public enum AccessError {
  RESOLUTION_ERROR,
  FORBIDDEN,
  NOT_FOUND,
  WORKSPACE_MISMATCH,
  INVITE_UNAVAILABLE,
  INVALID_TOKEN,
  ALREADY_USED_OR_REVOKED,
  EXPIRED,
  EMAIL_MISMATCH,
  NOT_PENDING,
  DUAL_ROLE_VIOLATION,
  ALREADY_EMPLOYEE_ELSEWHERE,
  IDENTITY_CONFLICT,
  IDENTITY_PROVIDER_UNAVAILABLE,
  UNKNOWN_PRINCIPAL
}
