package io.retailassist.access.invite;

import io.retailassist.access.audit.AuditEventBuilder;
import io.retailassist.access.audit.AuditService;
import io.retailassist.access.exception.AccessError;
import io.retailassist.access.exception.ForbiddenException;
import io.retailassist.access.exception.InvalidRequestException;
import io.retailassist.access.exception.InvalidStateException;
import io.retailassist.access.exception.InvariantViolationException;
import io.retailassist.access.exception.InviteUnavailableException;
import io.retailassist.access.exception.ResourceNotFoundException;
import io.retailassist.access.grant.AdminGrant;
import io.retailassist.access.grant.AdminGrantRepository;
import io.retailassist.access.grant.EmployeeAssignment;
import io.retailassist.access.grant.EmployeeAssignmentRepository;
import io.retailassist.access.identity.IdentityProvider;
import io.retailassist.access.identity.IdentityService;
import io.retailassist.access.identity.User;
import io.retailassist.access.identity.UserRepository;
import io.retailassist.access.role.Resolution;
import io.retailassist.access.role.Role;
import io.retailassist.access.role.RoleResolver;
import io.retailassist.access.scope.WorkspaceScopeEnforcer;
import io.retailassist.access.workspace.Workspace;
import io.retailassist.access.workspace.WorkspaceRepository;
import io.retailassist.access.workspace.Workspaces;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Invite state machine: {@code pending -> accepted | revoked | expired}. The only writer of
 * invites and of the grants created from them.
 *
 * <p>Acceptance runs in three steps. The token is checked outside any write transaction; the user
 * is found or created in its own transaction; then a single transaction takes the user row lock,
 * moves the invite out of pending with a conditional update, re-checks the role invariants and
 * inserts the grant. Any failure in that last step rolls all of it back, so a losing concurrent
 * acceptance leaves neither a grant nor a changed invite behind. The unique constraints on
 * {@code employee_assignments.user_id} and {@code admin_grants (user_id, workspace_id)} back up
 * the in-transaction checks.
 */
@Service
public class InviteService {

  private static final Logger log = LoggerFactory.getLogger(InviteService.class);

  private final InviteRepository inviteRepository;
  private final UserRepository userRepository;
  private final WorkspaceRepository workspaceRepository;
  private final AdminGrantRepository adminGrantRepository;
  private final EmployeeAssignmentRepository employeeRepository;
  private final RoleResolver roleResolver;
  private final WorkspaceScopeEnforcer scopeEnforcer;
  private final IdentityService identityService;
  private final IdentityProvider identityProvider;
  private final InviteTokens inviteTokens;
  private final InviteProperties properties;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate requiresNewTx;

  public InviteService(
      InviteRepository inviteRepository,
      UserRepository userRepository,
      WorkspaceRepository workspaceRepository,
      AdminGrantRepository adminGrantRepository,
      EmployeeAssignmentRepository employeeRepository,
      RoleResolver roleResolver,
      WorkspaceScopeEnforcer scopeEnforcer,
      IdentityService identityService,
      IdentityProvider identityProvider,
      InviteTokens inviteTokens,
      InviteProperties properties,
      AuditService auditService,
      PlatformTransactionManager txManager) {
    this.inviteRepository = inviteRepository;
    this.userRepository = userRepository;
    this.workspaceRepository = workspaceRepository;
    this.adminGrantRepository = adminGrantRepository;
    this.employeeRepository = employeeRepository;
    this.roleResolver = roleResolver;
    this.scopeEnforcer = scopeEnforcer;
    this.identityService = identityService;
    this.identityProvider = identityProvider;
    this.inviteTokens = inviteTokens;
    this.properties = properties;
    this.auditService = auditService;
    this.transactionTemplate = new TransactionTemplate(txManager);
    this.requiresNewTx = new TransactionTemplate(txManager);
    this.requiresNewTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** A new invite. {@code token} is the only copy of the raw secret and is never readable again. */
  public record CreatedInvite(
      UUID id, String token, UUID workspaceId, Role targetRole, Instant expiresAt) {}

  /** Fields supplied by the invitee on the acceptance page. */
  public record AcceptRequest(
      String token, String email, String fullName, String phone, String credential) {}

  public record AcceptedInvite(UUID userId, Role role, UUID workspaceId) {}

  public record InvitePreview(
      UUID id,
      String email,
      Role targetRole,
      UUID workspaceId,
      String workspaceName,
      Instant expiresAt) {}

  /**
   * Creates a pending invite. The target workspace is inferred from the inviter's own resolution
   * when omitted; a supplied one must agree with what the inviter may grant.
   *
   * @throws ForbiddenException if the inviter's role does not permit this invite
   */
  public CreatedInvite createInvite(
      UUID inviterId, String email, Role targetRole, UUID requestedWorkspaceId) {
    Resolution inviter = roleResolver.resolve(inviterId);
    UUID workspaceId = authorizeCreate(inviter, targetRole, requestedWorkspaceId);
    String normalizedEmail = User.normalizeEmail(email);

    String rawToken = inviteTokens.generate();
    Instant expiresAt = Instant.now().plus(properties.ttl());

    Invite invite =
        transactionTemplate.execute(
            status -> {
              if (!workspaceRepository.existsById(workspaceId)) {
                throw new ResourceNotFoundException("Workspace", workspaceId);
              }
              var created =
                  inviteRepository.save(
                      new Invite(
                          workspaceId,
                          normalizedEmail,
                          inviterId,
                          targetRole,
                          inviteTokens.hash(rawToken),
                          expiresAt));
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("invite.created")
                      .entityType("invite")
                      .entityId(created.getId())
                      .workspaceId(workspaceId)
                      .details(Map.of("targetRole", targetRole.wireValue(), "email", normalizedEmail))
                      .build());
              return created;
            });

    log.info(
        "Created {} invite {} for workspace {} by user {}",
        targetRole.wireValue(),
        invite.getId(),
        workspaceId,
        inviterId);
    return new CreatedInvite(invite.getId(), rawToken, workspaceId, targetRole, expiresAt);
  }

  /**
   * Accepts an invite and creates the grant it offers.
   *
   * @throws InviteUnavailableException for an unknown, used, revoked or expired token, or an email
   *     that does not match the invite
   * @throws InvariantViolationException if the invitee already holds a conflicting role
   */
  public AcceptedInvite acceptInvite(AcceptRequest request) {
    Invite invite = findUsableInvite(request.token());
    if (!invite.getEmail().equals(User.normalizeEmail(request.email()))) {
      throw reject(AccessError.EMAIL_MISMATCH, invite.getId());
    }

    String externalAuthId =
        identityProvider.ensureAccount(invite.getEmail(), request.credential());
    UUID userId =
        identityService
            .findOrCreateUser(invite.getEmail(), externalAuthId, request.fullName())
            .userId();

    AcceptedInvite accepted =
        transactionTemplate.execute(status -> grantFromInvite(invite, userId, request));

    log.info(
        "Accepted invite {}: user {} is now {} of workspace {}",
        invite.getId(),
        userId,
        accepted.role().wireValue(),
        accepted.workspaceId());
    return accepted;
  }

  /** Read-only view of a usable invite for the acceptance page. */
  public InvitePreview previewInvite(String token) {
    Invite invite = findUsableInvite(token);
    String workspaceName =
        workspaceRepository.findById(invite.getWorkspaceId()).map(Workspace::getName).orElse(null);
    return new InvitePreview(
        invite.getId(),
        invite.getEmail(),
        invite.getTargetRole(),
        invite.getWorkspaceId(),
        workspaceName,
        invite.getExpiresAt());
  }

  /**
   * Revokes a pending invite. Permitted for the user who created it and for super admins.
   *
   * @throws InvalidStateException with {@code NOT_PENDING} if the invite already reached a
   *     terminal state
   */
  public void revokeInvite(UUID inviteId, UUID byUserId) {
    Invite invite =
        inviteRepository
            .findById(inviteId)
            .orElseThrow(() -> new ResourceNotFoundException("Invite", inviteId));

    Resolution actor = roleResolver.resolve(byUserId);
    if (!(actor instanceof Resolution.SuperAdmin) && !invite.getInvitedBy().equals(byUserId)) {
      throw new ForbiddenException(
          "Cannot revoke invite", "Only the inviter or a super admin can revoke this invite");
    }

    if (invite.isPending() && invite.isExpiredAt(Instant.now())) {
      expireLazily(invite);
      throw notPending(inviteId);
    }

    Integer updated =
        transactionTemplate.execute(
            status -> {
              int rows = inviteRepository.markRevoked(inviteId, Instant.now());
              if (rows == 1) {
                auditService.log(
                    AuditEventBuilder.builder()
                        .eventType("invite.revoked")
                        .entityType("invite")
                        .entityId(inviteId)
                        .workspaceId(invite.getWorkspaceId())
                        .build());
              }
              return rows;
            });
    if (updated == null || updated == 0) {
      throw notPending(inviteId);
    }
    log.info("Revoked invite {} by user {}", inviteId, byUserId);
  }

  /**
   * Pending invites visible to the caller. Admins see their own workspace only; super admins see
   * a named workspace (cross-workspace read) or every pending invite when none is named.
   */
  public List<Invite> listPending(UUID callerId, UUID requestedWorkspaceId) {
    Resolution caller = roleResolver.resolve(callerId);
    if (caller instanceof Resolution.SuperAdmin) {
      return requestedWorkspaceId == null
          ? inviteRepository.findByStatusOrderByCreatedAtDesc(InviteStatus.PENDING)
          : inviteRepository.findByWorkspaceIdAndStatusOrderByCreatedAtDesc(
              requestedWorkspaceId, InviteStatus.PENDING);
    }
    if (!(caller instanceof Resolution.Admin)) {
      throw new ForbiddenException("Cannot list invites", "Only admins can list invites");
    }
    UUID workspaceId = requestedWorkspaceId != null ? requestedWorkspaceId : caller.workspaceId();
    scopeEnforcer.requireRouteScope(caller, workspaceId, false);
    return inviteRepository.findByWorkspaceIdAndStatusOrderByCreatedAtDesc(
        workspaceId, InviteStatus.PENDING);
  }

  /**
   * Checks that the inviter's role permits the invite and returns the workspace it targets.
   * Package-private for tests.
   */
  UUID authorizeCreate(Resolution inviter, Role targetRole, UUID requestedWorkspaceId) {
    switch (targetRole) {
      case PLATFORM_STAFF -> {
        if (!(inviter instanceof Resolution.SuperAdmin)) {
          throw forbidden("Only super admins can invite platform staff");
        }
        if (requestedWorkspaceId != null && !Workspaces.isPlatform(requestedWorkspaceId)) {
          throw forbidden("Platform staff invites must target the platform workspace");
        }
        return Workspaces.PLATFORM_WORKSPACE_ID;
      }
      case EMPLOYEE -> {
        if (inviter instanceof Resolution.Admin admin) {
          if (requestedWorkspaceId != null && !requestedWorkspaceId.equals(admin.workspaceId())) {
            throw forbidden("Admins can only invite employees into their own workspace");
          }
          return admin.workspaceId();
        }
        if (inviter instanceof Resolution.SuperAdmin) {
          if (requestedWorkspaceId == null) {
            throw new InvalidRequestException(
                "Workspace required", "Super admins must name the workspace for employee invites");
          }
          if (Workspaces.isPlatform(requestedWorkspaceId)) {
            throw forbidden("Employees cannot be invited into the platform workspace");
          }
          return requestedWorkspaceId;
        }
        throw forbidden("Only admins and super admins can invite employees");
      }
      default -> throw forbidden("Role " + targetRole.wireValue() + " cannot be granted by invite");
    }
  }

  private AcceptedInvite grantFromInvite(Invite invite, UUID userId, AcceptRequest request) {
    userRepository
        .findByIdForUpdate(userId)
        .orElseThrow(() -> new IllegalStateException("User vanished during acceptance: " + userId));

    if (inviteRepository.markAccepted(invite.getId(), Instant.now()) == 0) {
      throw reject(AccessError.ALREADY_USED_OR_REVOKED, invite.getId());
    }

    if (adminGrantRepository.existsByUserId(userId)) {
      throw violation(AccessError.DUAL_ROLE_VIOLATION, userId, invite);
    }

    Role role = invite.getTargetRole();
    try {
      if (role == Role.EMPLOYEE) {
        if (employeeRepository.existsByUserId(userId)) {
          throw violation(AccessError.ALREADY_EMPLOYEE_ELSEWHERE, userId, invite);
        }
        employeeRepository.saveAndFlush(
            new EmployeeAssignment(
                userId, invite.getWorkspaceId(), request.fullName(), request.phone()));
      } else if (role == Role.PLATFORM_STAFF) {
        if (employeeRepository.existsByUserId(userId)) {
          throw violation(AccessError.DUAL_ROLE_VIOLATION, userId, invite);
        }
        adminGrantRepository.saveAndFlush(AdminGrant.platformStaff(userId));
      } else {
        throw new IllegalStateException("Invite " + invite.getId() + " targets role " + role);
      }
    } catch (DataIntegrityViolationException e) {
      AccessError code =
          role == Role.EMPLOYEE
              ? AccessError.ALREADY_EMPLOYEE_ELSEWHERE
              : AccessError.DUAL_ROLE_VIOLATION;
      throw violation(code, userId, invite);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite.accepted")
            .entityType("invite")
            .entityId(invite.getId())
            .actorId(userId)
            .workspaceId(invite.getWorkspaceId())
            .details(Map.of("role", role.wireValue()))
            .build());
    return new AcceptedInvite(userId, role, invite.getWorkspaceId());
  }

  /**
   * Looks up a token and rejects it unless the invite is pending and unexpired. Expiry is checked
   * first so that an invite past its deadline reports expired whatever its stored status.
   */
  private Invite findUsableInvite(String rawToken) {
    if (rawToken == null || rawToken.isBlank()) {
      throw reject(AccessError.INVALID_TOKEN, null);
    }
    Invite invite =
        inviteRepository
            .findByTokenHash(inviteTokens.hash(rawToken))
            .orElseThrow(() -> reject(AccessError.INVALID_TOKEN, null));

    if (invite.isExpiredAt(Instant.now())) {
      if (invite.isPending()) {
        expireLazily(invite);
      }
      throw reject(AccessError.EXPIRED, invite.getId());
    }
    if (!invite.isPending()) {
      throw reject(AccessError.ALREADY_USED_OR_REVOKED, invite.getId());
    }
    return invite;
  }

  private void expireLazily(Invite invite) {
    requiresNewTx.executeWithoutResult(
        status -> {
          if (inviteRepository.markExpired(invite.getId()) == 1) {
            auditService.log(
                AuditEventBuilder.builder()
                    .eventType("invite.expired")
                    .entityType("invite")
                    .entityId(invite.getId())
                    .workspaceId(invite.getWorkspaceId())
                    .build());
            log.info("Expired invite {} on lookup", invite.getId());
          }
        });
  }

  private static InviteUnavailableException reject(AccessError reason, UUID inviteId) {
    log.warn("invite.rejected reason={} invite={}", reason, inviteId);
    return new InviteUnavailableException(reason);
  }

  private static InvariantViolationException violation(
      AccessError code, UUID userId, Invite invite) {
    log.error(
        "security.invariant_violation code={} user={} invite={} workspace={}",
        code,
        userId,
        invite.getId(),
        invite.getWorkspaceId());
    return new InvariantViolationException(
        code, "Invite " + invite.getId() + " conflicts with an existing role of the invitee");
  }

  private static InvalidStateException notPending(UUID inviteId) {
    return new InvalidStateException(
        AccessError.NOT_PENDING, "Invite not pending", "Invite " + inviteId + " is not pending");
  }

  private static ForbiddenException forbidden(String detail) {
    return new ForbiddenException("Cannot create invite", detail);
  }
}
