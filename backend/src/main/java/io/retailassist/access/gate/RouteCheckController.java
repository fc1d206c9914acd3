package io.retailassist.access.gate;

import io.retailassist.access.role.Role;
import io.retailassist.access.security.RequestPrincipal;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Lets an edge runtime that serves the pages itself ask the gate for a decision. */
@RestController
@RequestMapping("/api/access")
public class RouteCheckController {

  private final RouteAuthorizationGate gate;

  public RouteCheckController(RouteAuthorizationGate gate) {
    this.gate = gate;
  }

  @GetMapping("/route-check")
  public ResponseEntity<RouteCheckResponse> check(@RequestParam String path) {
    var decision = gate.authorize(RequestPrincipal.requireUserId(), path);
    if (decision instanceof GateDecision.Allow allow) {
      return ResponseEntity.ok(
          new RouteCheckResponse(
              "ALLOW",
              null,
              null,
              allow.resolution().role(),
              allow.resolution().workspaceId()));
    }
    if (decision instanceof GateDecision.Redirect redirect) {
      return ResponseEntity.ok(
          new RouteCheckResponse("REDIRECT", redirect.target(), null, null, null));
    }
    var deny = (GateDecision.Deny) decision;
    return ResponseEntity.status(deny.status())
        .body(new RouteCheckResponse("DENY", null, deny.status(), null, null));
  }

  public record RouteCheckResponse(
      String decision, String target, Integer status, Role role, UUID workspaceId) {}
}
