package io.retailassist.access.role;

import io.retailassist.access.security.RequestPrincipal;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** The role resolution query for the current principal. */
@RestController
@RequestMapping("/api/access")
public class AccessController {

  private final RoleResolver roleResolver;

  public AccessController(RoleResolver roleResolver) {
    this.roleResolver = roleResolver;
  }

  /** Returns the caller's role and workspace; both are null when the caller has no role. */
  @GetMapping("/me")
  public ResponseEntity<AccessResponse> me() {
    UUID userId = RequestPrincipal.requireUserId();
    Resolution resolution = roleResolver.resolve(userId);
    return ResponseEntity.ok(
        new AccessResponse(userId, resolution.role(), resolution.workspaceId()));
  }

  public record AccessResponse(UUID userId, Role role, UUID workspaceId) {}
}
