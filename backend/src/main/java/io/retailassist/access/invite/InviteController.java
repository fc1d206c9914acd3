package io.retailassist.access.invite;

import io.retailassist.access.role.Role;
import io.retailassist.access.security.RequestPrincipal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invites")
public class InviteController {

  private final InviteService inviteService;

  public InviteController(InviteService inviteService) {
    this.inviteService = inviteService;
  }

  /** Creates an invite. The response carries the raw token; it cannot be fetched again. */
  @PostMapping
  public ResponseEntity<CreateInviteResponse> create(
      @Valid @RequestBody CreateInviteRequest request) {
    var created =
        inviteService.createInvite(
            RequestPrincipal.requireUserId(),
            request.email(),
            request.targetRole(),
            request.workspaceId());
    var response =
        new CreateInviteResponse(
            created.id(),
            created.token(),
            created.workspaceId(),
            created.targetRole(),
            created.expiresAt());
    return ResponseEntity.created(URI.create("/api/invites/" + created.id())).body(response);
  }

  @GetMapping
  public ResponseEntity<List<InviteResponse>> listPending(
      @RequestParam(required = false) UUID workspaceId) {
    var invites = inviteService.listPending(RequestPrincipal.requireUserId(), workspaceId);
    return ResponseEntity.ok(invites.stream().map(InviteResponse::from).toList());
  }

  @PostMapping("/{id}/revoke")
  public ResponseEntity<Void> revoke(@PathVariable UUID id) {
    inviteService.revokeInvite(id, RequestPrincipal.requireUserId());
    return ResponseEntity.noContent().build();
  }

  public record CreateInviteRequest(
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      @NotNull(message = "targetRole is required") Role targetRole,
      UUID workspaceId) {}

  public record CreateInviteResponse(
      UUID id, String token, UUID workspaceId, Role targetRole, Instant expiresAt) {}

  public record InviteResponse(
      UUID id,
      String email,
      Role targetRole,
      UUID workspaceId,
      UUID invitedBy,
      InviteStatus status,
      Instant createdAt,
      Instant expiresAt) {

    static InviteResponse from(Invite invite) {
      return new InviteResponse(
          invite.getId(),
          invite.getEmail(),
          invite.getTargetRole(),
          invite.getWorkspaceId(),
          invite.getInvitedBy(),
          invite.getStatus(),
          invite.getCreatedAt(),
          invite.getExpiresAt());
    }
  }
}
