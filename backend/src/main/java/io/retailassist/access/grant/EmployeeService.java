package io.retailassist.access.grant;

import io.retailassist.access.audit.AuditEventBuilder;
import io.retailassist.access.audit.AuditService;
import io.retailassist.access.exception.ForbiddenException;
import io.retailassist.access.exception.ResourceNotFoundException;
import io.retailassist.access.role.Resolution;
import io.retailassist.access.role.RoleResolver;
import io.retailassist.access.scope.WorkspaceScopeEnforcer;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Employee management inside one workspace. Every call runs the workspace scope check against the
 * caller's fresh resolution before touching rows, and an assignment outside the requested
 * workspace is reported as not found.
 *
 * <p>Super admins may read any workspace's employees; only the workspace's own admin may change
 * them.
 */
@Service
public class EmployeeService {

  private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);
  private static final String RESOURCE = "Employee";

  private final EmployeeAssignmentRepository employeeRepository;
  private final RoleResolver roleResolver;
  private final WorkspaceScopeEnforcer scopeEnforcer;
  private final AuditService auditService;

  public EmployeeService(
      EmployeeAssignmentRepository employeeRepository,
      RoleResolver roleResolver,
      WorkspaceScopeEnforcer scopeEnforcer,
      AuditService auditService) {
    this.employeeRepository = employeeRepository;
    this.roleResolver = roleResolver;
    this.scopeEnforcer = scopeEnforcer;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<EmployeeAssignment> listEmployees(UUID callerId, UUID workspaceId) {
    Resolution caller = roleResolver.resolve(callerId);
    scopeEnforcer.requireRouteScope(caller, workspaceId, true);
    requireAdminOrSuperAdmin(caller);
    return employeeRepository.findByWorkspaceIdOrderByCreatedAtAsc(workspaceId);
  }

  @Transactional(readOnly = true)
  public EmployeeAssignment getEmployee(UUID callerId, UUID workspaceId, UUID employeeId) {
    Resolution caller = roleResolver.resolve(callerId);
    scopeEnforcer.requireResourceScope(caller, workspaceId, true, RESOURCE, employeeId);
    requireAdminOrSuperAdmin(caller);
    return findInWorkspace(workspaceId, employeeId);
  }

  /** Updates profile fields; null fields are left unchanged. */
  @Transactional
  public EmployeeAssignment updateEmployee(
      UUID callerId,
      UUID workspaceId,
      UUID employeeId,
      String fullName,
      String phone,
      Boolean active) {
    Resolution caller = roleResolver.resolve(callerId);
    scopeEnforcer.requireResourceScope(caller, workspaceId, false, RESOURCE, employeeId);
    requireAdmin(caller);

    var assignment = findInWorkspace(workspaceId, employeeId);
    assignment.updateProfile(fullName, phone, active);
    assignment = employeeRepository.save(assignment);

    var details = new HashMap<String, Object>();
    if (fullName != null) {
      details.put("fullName", fullName);
    }
    if (phone != null) {
      details.put("phone", phone);
    }
    if (active != null) {
      details.put("active", active);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("employee.updated")
            .entityType("employee_assignment")
            .entityId(employeeId)
            .workspaceId(workspaceId)
            .details(details)
            .build());

    log.info("Updated employee {} in workspace {}", employeeId, workspaceId);
    return assignment;
  }

  /** Soft-deactivates an employee. The user resolves to no role from the next request on. */
  @Transactional
  public EmployeeAssignment deactivateEmployee(UUID callerId, UUID workspaceId, UUID employeeId) {
    Resolution caller = roleResolver.resolve(callerId);
    scopeEnforcer.requireResourceScope(caller, workspaceId, false, RESOURCE, employeeId);
    requireAdmin(caller);

    var assignment = findInWorkspace(workspaceId, employeeId);
    if (!assignment.isActive()) {
      return assignment;
    }
    assignment.deactivate();
    assignment = employeeRepository.save(assignment);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("employee.deactivated")
            .entityType("employee_assignment")
            .entityId(employeeId)
            .workspaceId(workspaceId)
            .build());

    log.info("Deactivated employee {} in workspace {}", employeeId, workspaceId);
    return assignment;
  }

  private EmployeeAssignment findInWorkspace(UUID workspaceId, UUID employeeId) {
    return employeeRepository
        .findById(employeeId)
        .filter(assignment -> assignment.getWorkspaceId().equals(workspaceId))
        .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, employeeId));
  }

  private static void requireAdmin(Resolution caller) {
    if (!(caller instanceof Resolution.Admin)) {
      throw new ForbiddenException(
          "Cannot manage employees", "Only workspace admins can change employees");
    }
  }

  private static void requireAdminOrSuperAdmin(Resolution caller) {
    if (!(caller instanceof Resolution.Admin) && !(caller instanceof Resolution.SuperAdmin)) {
      throw new ForbiddenException(
          "Cannot view employees", "Only workspace admins can view employees");
    }
  }
}
