package io.retailassist.access.gate;

import io.retailassist.access.role.Resolution;
import java.util.Objects;

/** Outcome of {@link RouteAuthorizationGate#authorize}. */
public sealed interface GateDecision
    permits GateDecision.Allow, GateDecision.Redirect, GateDecision.Deny {

  /** The path is within the caller's route set. */
  record Allow(Resolution resolution) implements GateDecision {
    public Allow {
      Objects.requireNonNull(resolution, "resolution");
    }
  }

  /** The caller belongs elsewhere: their home path, or the login entry point. */
  record Redirect(String target) implements GateDecision {
    public Redirect {
      Objects.requireNonNull(target, "target");
    }
  }

  /** The decision could not be made; never followed by access. */
  record Deny(int status) implements GateDecision {}
}
