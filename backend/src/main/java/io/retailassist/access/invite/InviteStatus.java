package io.retailassist.access.invite;

/** Invite states. {@code PENDING} is the only non-terminal state; transitions never revert. */
public enum InviteStatus {
  PENDING,
  ACCEPTED,
  REVOKED,
  EXPIRED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
