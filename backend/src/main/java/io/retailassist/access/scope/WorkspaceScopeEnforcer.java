package io.retailassist.access.scope;

import io.retailassist.access.exception.ForbiddenException;
import io.retailassist.access.exception.ResourceNotFoundException;
import io.retailassist.access.role.Resolution;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares a resolved role against the workspace a request targets. Must be called on every
 * data-access path that touches workspace-scoped rows, even when the route gate already allowed
 * the request.
 *
 * <ul>
 *   <li>Super admins are allowed on platform-wide requests ({@code requestedWorkspaceId == null}),
 *       and on a specific workspace only when the endpoint opts into cross-workspace reads.
 *   <li>Platform staff, admins and employees are allowed only on their own workspace, compared by
 *       exact UUID equality.
 *   <li>Everything else, including no role, is denied.
 * </ul>
 */
@Component
public class WorkspaceScopeEnforcer {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceScopeEnforcer.class);

  /** Scope check for endpoints that do not permit cross-workspace reads. */
  public ScopeDecision enforce(Resolution resolution, UUID requestedWorkspaceId) {
    return enforce(resolution, requestedWorkspaceId, false);
  }

  public ScopeDecision enforce(
      Resolution resolution, UUID requestedWorkspaceId, boolean crossWorkspaceReadPermitted) {
    if (resolution instanceof Resolution.SuperAdmin) {
      return requestedWorkspaceId == null || crossWorkspaceReadPermitted
          ? ScopeDecision.allow()
          : ScopeDecision.deny();
    }
    if (!resolution.hasRole() || requestedWorkspaceId == null) {
      return ScopeDecision.deny();
    }
    return requestedWorkspaceId.equals(resolution.workspaceId())
        ? ScopeDecision.allow()
        : ScopeDecision.deny();
  }

  /**
   * Scope check for a request that names a specific resource. A mismatch is rendered as not found
   * so the response does not confirm that another tenant's resource exists.
   *
   * @throws ResourceNotFoundException on a mismatch
   */
  public void requireResourceScope(
      Resolution resolution,
      UUID requestedWorkspaceId,
      boolean crossWorkspaceReadPermitted,
      String resourceType,
      Object resourceId) {
    if (!enforce(resolution, requestedWorkspaceId, crossWorkspaceReadPermitted).isAllowed()) {
      log.warn(
          "security.scope_denied role={} workspace={} requested={} resource={}",
          resolution.role(),
          resolution.workspaceId(),
          requestedWorkspaceId,
          resourceType);
      throw new ResourceNotFoundException(resourceType, resourceId);
    }
  }

  /**
   * Scope check for a route-level request with no specific resource id.
   *
   * @throws ForbiddenException on a mismatch
   */
  public void requireRouteScope(
      Resolution resolution, UUID requestedWorkspaceId, boolean crossWorkspaceReadPermitted) {
    if (!enforce(resolution, requestedWorkspaceId, crossWorkspaceReadPermitted).isAllowed()) {
      log.warn(
          "security.scope_denied role={} workspace={} requested={}",
          resolution.role(),
          resolution.workspaceId(),
          requestedWorkspaceId);
      throw new ForbiddenException(
          "Workspace access denied", "You do not have access to this workspace");
    }
  }
}
