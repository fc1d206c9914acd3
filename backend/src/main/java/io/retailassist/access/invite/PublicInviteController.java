package io.retailassist.access.invite;

import io.retailassist.access.role.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated invite endpoints used by the acceptance page. Every unusable token answers with
 * the same 410 body. Acceptance does not sign the caller in; the page sends the new user to the
 * login flow with the returned role and workspace.
 */
@RestController
@RequestMapping("/api/public/invites")
public class PublicInviteController {

  private final InviteService inviteService;

  public PublicInviteController(InviteService inviteService) {
    this.inviteService = inviteService;
  }

  @GetMapping("/preview")
  public ResponseEntity<InvitePreviewResponse> preview(@RequestParam String token) {
    var preview = inviteService.previewInvite(token);
    return ResponseEntity.ok(
        new InvitePreviewResponse(
            preview.email(),
            preview.targetRole(),
            preview.workspaceId(),
            preview.workspaceName(),
            preview.expiresAt()));
  }

  @PostMapping("/accept")
  public ResponseEntity<AcceptInviteResponse> accept(
      @Valid @RequestBody AcceptInviteRequest request) {
    var accepted =
        inviteService.acceptInvite(
            new InviteService.AcceptRequest(
                request.token(),
                request.email(),
                request.fullName(),
                request.phone(),
                request.password()));
    return ResponseEntity.ok(
        new AcceptInviteResponse(accepted.userId(), accepted.role(), accepted.workspaceId()));
  }

  public record AcceptInviteRequest(
      @NotBlank(message = "token is required") String token,
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      @Size(max = 255) String fullName,
      @Size(max = 32) String phone,
      @NotBlank(message = "password is required")
          @Size(min = 8, max = 128, message = "password must be 8 to 128 characters")
          String password) {}

  public record AcceptInviteResponse(UUID userId, Role role, UUID workspaceId) {}

  public record InvitePreviewResponse(
      String email, Role targetRole, UUID workspaceId, String workspaceName, Instant expiresAt) {}
}
