package io.retailassist.access.role;

import io.retailassist.access.workspace.Workspaces;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of role resolution for one principal. Each variant fixes whether a workspace is present:
 * super admin never has one, platform staff always has the platform workspace, admin and employee
 * always have a customer workspace. {@link NoRole} is a legitimate outcome, not an error.
 */
public sealed interface Resolution
    permits Resolution.SuperAdmin,
        Resolution.PlatformStaff,
        Resolution.Admin,
        Resolution.Employee,
        Resolution.NoRole {

  /** The resolved role, or null for {@link NoRole}. */
  Role role();

  /** The scoped workspace, or null for super admins and {@link NoRole}. */
  UUID workspaceId();

  default boolean hasRole() {
    return role() != null;
  }

  static Resolution superAdmin() {
    return new SuperAdmin();
  }

  static Resolution platformStaff() {
    return new PlatformStaff();
  }

  static Resolution admin(UUID workspaceId) {
    return new Admin(workspaceId);
  }

  static Resolution employee(UUID workspaceId) {
    return new Employee(workspaceId);
  }

  static Resolution noRole() {
    return new NoRole();
  }

  record SuperAdmin() implements Resolution {
    @Override
    public Role role() {
      return Role.SUPER_ADMIN;
    }

    @Override
    public UUID workspaceId() {
      return null;
    }
  }

  record PlatformStaff() implements Resolution {
    @Override
    public Role role() {
      return Role.PLATFORM_STAFF;
    }

    @Override
    public UUID workspaceId() {
      return Workspaces.PLATFORM_WORKSPACE_ID;
    }
  }

  record Admin(UUID workspaceId) implements Resolution {
    public Admin {
      Objects.requireNonNull(workspaceId, "workspaceId");
      if (Workspaces.isPlatform(workspaceId)) {
        throw new IllegalArgumentException("Admins cannot be scoped to the platform workspace");
      }
    }

    @Override
    public Role role() {
      return Role.ADMIN;
    }
  }

  record Employee(UUID workspaceId) implements Resolution {
    public Employee {
      Objects.requireNonNull(workspaceId, "workspaceId");
    }

    @Override
    public Role role() {
      return Role.EMPLOYEE;
    }
  }

  record NoRole() implements Resolution {
    @Override
    public Role role() {
      return null;
    }

    @Override
    public UUID workspaceId() {
      return null;
    }
  }
}
