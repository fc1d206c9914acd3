package io.retailassist.access.scope;

import io.retailassist.access.exception.AccessError;

/** Result of a workspace scope check. */
public sealed interface ScopeDecision permits ScopeDecision.Allow, ScopeDecision.Deny {

  static ScopeDecision allow() {
    return new Allow();
  }

  static ScopeDecision deny() {
    return new Deny(AccessError.WORKSPACE_MISMATCH);
  }

  default boolean isAllowed() {
    return this instanceof Allow;
  }

  record Allow() implements ScopeDecision {}

  record Deny(AccessError reason) implements ScopeDecision {}
}
