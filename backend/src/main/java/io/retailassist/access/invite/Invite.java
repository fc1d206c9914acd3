package io.retailassist.access.invite;

import io.retailassist.access.role.Role;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded, single-use offer of a grant. Only the SHA-256 hash of the token is stored; the
 * raw token is handed to the inviter once at creation.
 *
 * <p>Status changes are written through the conditional updates on {@link InviteRepository} so
 * that only one caller can move an invite out of {@code PENDING}.
 */
@Entity
@Table(name = "invites")
public class Invite {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workspace_id", updatable = false)
  private UUID workspaceId;

  @Column(name = "email", nullable = false, updatable = false, length = 320)
  private String email;

  @Column(name = "invited_by", nullable = false, updatable = false)
  private UUID invitedBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "target_role", nullable = false, updatable = false, length = 32)
  private Role targetRole;

  @Column(name = "token_hash", nullable = false, unique = true, updatable = false, length = 64)
  private String tokenHash;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private InviteStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "expires_at", nullable = false, updatable = false)
  private Instant expiresAt;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "revoked_at")
  private Instant revokedAt;

  protected Invite() {}

  public Invite(
      UUID workspaceId,
      String email,
      UUID invitedBy,
      Role targetRole,
      String tokenHash,
      Instant expiresAt) {
    this.workspaceId = workspaceId;
    this.email = email;
    this.invitedBy = invitedBy;
    this.targetRole = targetRole;
    this.tokenHash = tokenHash;
    this.status = InviteStatus.PENDING;
    this.createdAt = Instant.now();
    this.expiresAt = expiresAt;
  }

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean isPending() {
    return status == InviteStatus.PENDING;
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public String getEmail() {
    return email;
  }

  public UUID getInvitedBy() {
    return invitedBy;
  }

  public Role getTargetRole() {
    return targetRole;
  }

  public String getTokenHash() {
    return tokenHash;
  }

  public InviteStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }
}
