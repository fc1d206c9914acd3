package io.retailassist.access.grant;

import io.retailassist.access.role.Role;
import io.retailassist.access.workspace.Workspaces;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Binds a user to a workspace as admin, platform staff or super admin. The role fixes the shape of
 * {@code workspaceId}: null for super admin, the platform workspace for platform staff, any other
 * workspace for admin. Grants are never updated in place; revocation deletes the row.
 */
@Entity
@Table(name = "admin_grants")
public class AdminGrant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "workspace_id", updatable = false)
  private UUID workspaceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, updatable = false, length = 32)
  private Role role;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AdminGrant() {}

  private AdminGrant(UUID userId, UUID workspaceId, Role role) {
    this.userId = Objects.requireNonNull(userId, "userId");
    this.workspaceId = workspaceId;
    this.role = role;
    this.createdAt = Instant.now();
  }

  public static AdminGrant admin(UUID userId, UUID workspaceId) {
    if (workspaceId == null || Workspaces.isPlatform(workspaceId)) {
      throw new IllegalArgumentException(
          "Admin grants require a customer workspace, got " + workspaceId);
    }
    return new AdminGrant(userId, workspaceId, Role.ADMIN);
  }

  public static AdminGrant platformStaff(UUID userId) {
    return new AdminGrant(userId, Workspaces.PLATFORM_WORKSPACE_ID, Role.PLATFORM_STAFF);
  }

  public static AdminGrant superAdmin(UUID userId) {
    return new AdminGrant(userId, null, Role.SUPER_ADMIN);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public Role getRole() {
    return role;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
