package io.retailassist.access.identity;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Identity provider callbacks and operator actions on users. API-key protected. */
@RestController
@RequestMapping("/internal/users")
public class UserSyncController {

  private static final Logger log = LoggerFactory.getLogger(UserSyncController.class);

  private final IdentityService identityService;

  public UserSyncController(IdentityService identityService) {
    this.identityService = identityService;
  }

  @PostMapping("/sync")
  public ResponseEntity<SyncUserResponse> syncUser(@Valid @RequestBody SyncUserRequest request) {
    log.info("Received user sync: externalAuthId={}", request.externalAuthId());

    var link =
        identityService.syncUser(request.externalAuthId(), request.email(), request.fullName());
    var response =
        new SyncUserResponse(
            link.userId(), request.externalAuthId(), link.created() ? "created" : "linked");

    if (link.created()) {
      return ResponseEntity.created(URI.create("/internal/users/" + link.userId())).body(response);
    }
    return ResponseEntity.ok(response);
  }

  @PostMapping("/{id}/deactivate")
  public ResponseEntity<Void> deactivate(@PathVariable UUID id) {
    log.info("Received user deactivation for {}", id);
    identityService.deactivateUser(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/super-admin")
  public ResponseEntity<Void> promoteToSuperAdmin(@PathVariable UUID id) {
    log.info("Received super admin promotion for {}", id);
    identityService.promoteToSuperAdmin(id);
    return ResponseEntity.noContent().build();
  }

  public record SyncUserRequest(
      @NotBlank(message = "externalAuthId is required") String externalAuthId,
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      String fullName) {}

  public record SyncUserResponse(UUID userId, String externalAuthId, String action) {}
}
