package io.retailassist.access.workspace;

import io.retailassist.access.audit.AuditEventBuilder;
import io.retailassist.access.audit.AuditService;
import io.retailassist.access.exception.AccessError;
import io.retailassist.access.exception.InvariantViolationException;
import io.retailassist.access.exception.ResourceNotFoundException;
import io.retailassist.access.grant.AdminGrant;
import io.retailassist.access.grant.AdminGrantRepository;
import io.retailassist.access.grant.EmployeeAssignmentRepository;
import io.retailassist.access.identity.UserRepository;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Signup side of workspace creation: creates the workspace and its owner's first admin grant in
 * one transaction. The owner's row lock serializes this with invite acceptance for the same user.
 */
@Service
public class WorkspaceProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceProvisioningService.class);

  private final WorkspaceRepository workspaceRepository;
  private final UserRepository userRepository;
  private final AdminGrantRepository adminGrantRepository;
  private final EmployeeAssignmentRepository employeeRepository;
  private final AuditService auditService;

  public WorkspaceProvisioningService(
      WorkspaceRepository workspaceRepository,
      UserRepository userRepository,
      AdminGrantRepository adminGrantRepository,
      EmployeeAssignmentRepository employeeRepository,
      AuditService auditService) {
    this.workspaceRepository = workspaceRepository;
    this.userRepository = userRepository;
    this.adminGrantRepository = adminGrantRepository;
    this.employeeRepository = employeeRepository;
    this.auditService = auditService;
  }

  public record ProvisioningResult(UUID workspaceId, boolean alreadyProvisioned) {}

  /**
   * Creates a workspace owned by the given user. An owner who already owns a workspace gets that
   * workspace back with {@code alreadyProvisioned = true}.
   *
   * @throws InvariantViolationException if the owner is an employee, platform staff or a super
   *     admin
   */
  @Transactional
  public ProvisioningResult provisionWorkspace(UUID ownerUserId, String name) {
    var owner =
        userRepository
            .findByIdForUpdate(ownerUserId)
            .orElseThrow(() -> new ResourceNotFoundException("User", ownerUserId));

    var existing = workspaceRepository.findByOwnerUserId(ownerUserId);
    if (!existing.isEmpty()) {
      log.info("Workspace already provisioned for owner {}", ownerUserId);
      return new ProvisioningResult(existing.get(0).getId(), true);
    }

    if (employeeRepository.existsByUserId(ownerUserId)) {
      throw dualRole(ownerUserId, "is an employee");
    }
    // Platform staff and super admins hold admin-family grants outside any owned workspace.
    if (owner.isSuperAdmin() || adminGrantRepository.existsByUserId(ownerUserId)) {
      throw dualRole(ownerUserId, "already holds an admin grant");
    }

    var workspace = workspaceRepository.saveAndFlush(new Workspace(ownerUserId, name));
    adminGrantRepository.save(AdminGrant.admin(ownerUserId, workspace.getId()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("workspace.provisioned")
            .entityType("workspace")
            .entityId(workspace.getId())
            .workspaceId(workspace.getId())
            .details(Map.of("ownerUserId", ownerUserId.toString(), "name", name))
            .build());

    log.info("Provisioned workspace {} for owner {}", workspace.getId(), ownerUserId);
    return new ProvisioningResult(workspace.getId(), false);
  }

  private static InvariantViolationException dualRole(UUID ownerUserId, String reason) {
    log.error(
        "security.invariant_violation code={} user={} action=provision_workspace",
        AccessError.DUAL_ROLE_VIOLATION,
        ownerUserId);
    return new InvariantViolationException(
        AccessError.DUAL_ROLE_VIOLATION,
        "User " + ownerUserId + " " + reason + " and cannot own a workspace");
  }
}
