package io.retailassist.access.identity;

import io.retailassist.access.audit.AuditEventBuilder;
import io.retailassist.access.audit.AuditService;
import io.retailassist.access.exception.AccessError;
import io.retailassist.access.exception.InvariantViolationException;
import io.retailassist.access.exception.ResourceNotFoundException;
import io.retailassist.access.grant.AdminGrant;
import io.retailassist.access.grant.AdminGrantRepository;
import io.retailassist.access.grant.EmployeeAssignmentRepository;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns writes to {@link User}. Users are created on first external authentication (identity sync)
 * or on invite acceptance, linked to their identity provider subject once, and deactivated rather
 * than deleted.
 */
@Service
public class IdentityService {

  private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

  private final UserRepository userRepository;
  private final AdminGrantRepository adminGrantRepository;
  private final EmployeeAssignmentRepository employeeRepository;
  private final AuditService auditService;
  private final TransactionTemplate requiresNewTx;

  public IdentityService(
      UserRepository userRepository,
      AdminGrantRepository adminGrantRepository,
      EmployeeAssignmentRepository employeeRepository,
      AuditService auditService,
      PlatformTransactionManager txManager) {
    this.userRepository = userRepository;
    this.adminGrantRepository = adminGrantRepository;
    this.employeeRepository = employeeRepository;
    this.auditService = auditService;
    this.requiresNewTx = new TransactionTemplate(txManager);
    this.requiresNewTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** Outcome of a find-or-create; {@code created} is false when an existing user was reused. */
  public record UserLink(UUID userId, boolean created) {}

  /**
   * Finds the user for this email or external subject, creating it when neither exists. Commits
   * in its own transaction so the user survives a later failure of the caller. A concurrent
   * creation of the same user is detected through the unique constraints and resolved by reading
   * the winner's row.
   *
   * @param externalAuthId identity provider subject, or null when not yet known
   * @throws InvariantViolationException if the user is already linked to a different subject
   */
  public UserLink findOrCreateUser(String email, String externalAuthId, String fullName) {
    String normalized = User.normalizeEmail(email);
    try {
      return requiresNewTx.execute(status -> upsert(normalized, externalAuthId, fullName));
    } catch (DataIntegrityViolationException e) {
      log.debug("Concurrent creation of user {}, re-reading", normalized);
      return requiresNewTx.execute(status -> upsert(normalized, externalAuthId, fullName));
    }
  }

  /**
   * Handles an identity provider sync for a subject. Same semantics as {@link #findOrCreateUser}
   * with a mandatory subject.
   */
  public UserLink syncUser(String externalAuthId, String email, String fullName) {
    if (externalAuthId == null || externalAuthId.isBlank()) {
      throw new IllegalArgumentException("externalAuthId is required for identity sync");
    }
    var link = findOrCreateUser(email, externalAuthId, fullName);
    log.info(
        "Synced identity {} to user {} (created={})", externalAuthId, link.userId(), link.created());
    return link;
  }

  @Transactional(readOnly = true)
  public Optional<UUID> findUserIdByExternalAuthId(String externalAuthId) {
    return userRepository.findByExternalAuthId(externalAuthId).map(User::getId);
  }

  @Transactional(readOnly = true)
  public User getUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  /** Deactivates a user. A deactivated user resolves to no role on the next request. */
  @Transactional
  public void deactivateUser(UUID userId) {
    var user =
        userRepository
            .findByIdForUpdate(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    if (!user.isActive()) {
      return;
    }
    user.deactivate();
    userRepository.save(user);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("user.deactivated")
            .entityType("user")
            .entityId(userId)
            .build());
    log.info("Deactivated user {}", userId);
  }

  /**
   * Sets the legacy super admin flag and records a matching super admin grant. Refused for a user
   * holding an employee assignment, since employees may never hold an admin-family grant.
   */
  @Transactional
  public void promoteToSuperAdmin(UUID userId) {
    var user =
        userRepository
            .findByIdForUpdate(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));

    if (employeeRepository.existsByUserId(userId)) {
      log.error(
          "security.invariant_violation code={} user={} action=promote_super_admin",
          AccessError.DUAL_ROLE_VIOLATION,
          userId);
      throw new InvariantViolationException(
          AccessError.DUAL_ROLE_VIOLATION, "User " + userId + " is an employee");
    }
    if (user.isSuperAdmin()) {
      return;
    }

    user.markSuperAdmin();
    userRepository.save(user);
    if (!adminGrantRepository.existsByUserIdAndWorkspaceIdIsNull(userId)) {
      adminGrantRepository.save(AdminGrant.superAdmin(userId));
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("user.promoted_super_admin")
            .entityType("user")
            .entityId(userId)
            .build());
    log.info("Promoted user {} to super admin", userId);
  }

  private UserLink upsert(String email, String externalAuthId, String fullName) {
    if (externalAuthId != null) {
      var bySubject = userRepository.findByExternalAuthId(externalAuthId);
      if (bySubject.isPresent()) {
        return new UserLink(bySubject.get().getId(), false);
      }
    }

    var byEmail = userRepository.findByEmail(email);
    if (byEmail.isPresent()) {
      var user = byEmail.get();
      if (externalAuthId != null) {
        try {
          user.linkExternalAuthId(externalAuthId);
        } catch (IllegalStateException e) {
          log.error(
              "security.invariant_violation code={} user={} subject={}",
              AccessError.IDENTITY_CONFLICT,
              user.getId(),
              externalAuthId);
          throw new InvariantViolationException(
              AccessError.IDENTITY_CONFLICT,
              "User is already linked to a different identity provider account");
        }
        userRepository.save(user);
      }
      return new UserLink(user.getId(), false);
    }

    var user = new User(email, externalAuthId);
    if (fullName != null && !fullName.isBlank()) {
      user.updateProfile(fullName);
    }
    user = userRepository.saveAndFlush(user);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("user.created")
            .entityType("user")
            .entityId(user.getId())
            .details(Map.of("email", email))
            .build());
    log.info("Created user {} for {}", user.getId(), email);
    return new UserLink(user.getId(), true);
  }
}
