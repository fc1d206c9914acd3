package io.retailassist.access.grant;

import io.retailassist.access.exception.ForbiddenException;
import io.retailassist.access.role.Resolution;
import io.retailassist.access.role.RoleResolver;
import io.retailassist.access.workspace.Workspaces;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PlatformStaffService {

  private final AdminGrantRepository adminGrantRepository;
  private final RoleResolver roleResolver;

  public PlatformStaffService(AdminGrantRepository adminGrantRepository, RoleResolver roleResolver) {
    this.adminGrantRepository = adminGrantRepository;
    this.roleResolver = roleResolver;
  }

  /** Platform staff grants, oldest first. Super admins only. */
  @Transactional(readOnly = true)
  public List<AdminGrant> listPlatformStaff(UUID callerId) {
    if (!(roleResolver.resolve(callerId) instanceof Resolution.SuperAdmin)) {
      throw new ForbiddenException(
          "Cannot list platform staff", "Only super admins can list platform staff");
    }
    return adminGrantRepository.findByWorkspaceIdOrderByCreatedAtAsc(
        Workspaces.PLATFORM_WORKSPACE_ID);
  }
}
