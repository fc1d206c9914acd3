package io.retailassist.access.grant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Binds a user to exactly one workspace as employee. {@code user_id} is unique on its own, so a
 * user holds at most one assignment across all workspaces. Assignments are soft-deactivated, never
 * deleted.
 */
@Entity
@Table(name = "employee_assignments")
public class EmployeeAssignment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "workspace_id", nullable = false, updatable = false)
  private UUID workspaceId;

  @Column(name = "full_name", length = 255)
  private String fullName;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmployeeAssignment() {}

  public EmployeeAssignment(UUID userId, UUID workspaceId, String fullName, String phone) {
    this.userId = Objects.requireNonNull(userId, "userId");
    this.workspaceId = Objects.requireNonNull(workspaceId, "workspaceId");
    this.fullName = fullName;
    this.phone = phone;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Applies profile changes; null arguments leave the field unchanged. */
  public void updateProfile(String fullName, String phone, Boolean active) {
    if (fullName != null) {
      this.fullName = fullName;
    }
    if (phone != null) {
      this.phone = phone;
    }
    if (active != null) {
      this.active = active;
    }
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
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

  public String getFullName() {
    return fullName;
  }

  public String getPhone() {
    return phone;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
