package io.retailassist.access.identity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A principal. Roles other than super admin are never stored here; they are derived from admin
 * grants and employee assignments at resolution time.
 *
 * <p>{@code externalAuthId} links the user to the identity provider. It may be null until the
 * first successful external authentication and is immutable once set. Users are deactivated,
 * never deleted.
 */
@Entity
@Table(name = "app_users")
public class User {

  /** Legacy role flag value. The only value ever written to {@code app_users.role}. */
  public static final String SUPER_ADMIN_FLAG = "super_admin";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "external_auth_id", length = 255)
  private String externalAuthId;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "full_name", length = 255)
  private String fullName;

  @Column(name = "role", length = 32)
  private String role;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected User() {}

  public User(String email, String externalAuthId) {
    this.email = normalizeEmail(email);
    this.externalAuthId = externalAuthId;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Lower-cases and trims an email address; stored emails are always normalized. */
  public static String normalizeEmail(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Links the identity provider subject. Re-linking the same id is a no-op; a different id is
   * rejected because the link is immutable.
   *
   * @throws IllegalStateException if a different external id is already linked
   */
  public void linkExternalAuthId(String externalAuthId) {
    if (this.externalAuthId != null) {
      if (!this.externalAuthId.equals(externalAuthId)) {
        throw new IllegalStateException("External auth id already linked for user " + id);
      }
      return;
    }
    this.externalAuthId = externalAuthId;
    this.updatedAt = Instant.now();
  }

  public void markSuperAdmin() {
    this.role = SUPER_ADMIN_FLAG;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public void updateProfile(String fullName) {
    this.fullName = fullName;
    this.updatedAt = Instant.now();
  }

  public boolean isSuperAdmin() {
    return SUPER_ADMIN_FLAG.equals(role);
  }

  public UUID getId() {
    return id;
  }

  public String getExternalAuthId() {
    return externalAuthId;
  }

  public String getEmail() {
    return email;
  }

  public String getFullName() {
    return fullName;
  }

  public String getRole() {
    return role;
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
