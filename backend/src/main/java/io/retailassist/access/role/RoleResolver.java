package io.retailassist.access.role;

import io.retailassist.access.exception.RoleResolutionException;
import io.retailassist.access.grant.AdminGrantRepository;
import io.retailassist.access.grant.EmployeeAssignment;
import io.retailassist.access.grant.EmployeeAssignmentRepository;
import io.retailassist.access.identity.User;
import io.retailassist.access.identity.UserRepository;
import io.retailassist.access.workspace.Workspaces;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Decides the single role and workspace of a principal. Read-only, uncached and safe to call
 * concurrently; it runs on every authenticated request.
 *
 * <p>Checks in strict priority order and returns the first match:
 *
 * <ol>
 *   <li>legacy {@code super_admin} flag on the user
 *   <li>an admin grant on the platform workspace (platform staff)
 *   <li>an admin grant on a customer workspace (admin)
 *   <li>an active employee assignment (employee)
 *   <li>otherwise no role
 * </ol>
 *
 * Each resolution runs under a deadline. Storage failures, timeouts and interruptions surface as
 * {@link RoleResolutionException} and are never reported as {@link Resolution.NoRole}.
 */
@Service
public class RoleResolver {

  private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

  private final UserRepository userRepository;
  private final AdminGrantRepository adminGrantRepository;
  private final EmployeeAssignmentRepository employeeRepository;
  private final TransactionTemplate readOnlyTx;
  private final ExecutorService executor;
  private final Duration timeout;

  @Autowired
  public RoleResolver(
      UserRepository userRepository,
      AdminGrantRepository adminGrantRepository,
      EmployeeAssignmentRepository employeeRepository,
      PlatformTransactionManager txManager,
      RoleResolverProperties properties) {
    this(
        userRepository,
        adminGrantRepository,
        employeeRepository,
        txManager,
        Executors.newFixedThreadPool(properties.poolSize(), new ResolverThreadFactory()),
        properties.timeout());
  }

  RoleResolver(
      UserRepository userRepository,
      AdminGrantRepository adminGrantRepository,
      EmployeeAssignmentRepository employeeRepository,
      PlatformTransactionManager txManager,
      ExecutorService executor,
      Duration timeout) {
    this.userRepository = userRepository;
    this.adminGrantRepository = adminGrantRepository;
    this.employeeRepository = employeeRepository;
    this.readOnlyTx = new TransactionTemplate(txManager);
    this.readOnlyTx.setReadOnly(true);
    this.executor = executor;
    this.timeout = timeout;
  }

  /**
   * Resolves the role of the given user.
   *
   * @return exactly one resolution; {@link Resolution.NoRole} when the user has no grant
   * @throws RoleResolutionException if storage could not be read within the deadline
   */
  public Resolution resolve(UUID userId) {
    Future<Resolution> pending;
    try {
      pending = executor.submit(() -> readOnlyTx.execute(status -> resolveNow(userId)));
    } catch (RejectedExecutionException e) {
      throw new RoleResolutionException("Role resolution capacity exhausted", e);
    }

    try {
      return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      pending.cancel(true);
      log.warn("Role resolution for user {} exceeded deadline of {}", userId, timeout);
      throw new RoleResolutionException("Role resolution exceeded its deadline", e);
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new RoleResolutionException("Role resolution was interrupted", e);
    } catch (ExecutionException e) {
      log.warn("Role resolution for user {} failed: {}", userId, e.getCause().getMessage());
      throw new RoleResolutionException("Role resolution failed", e.getCause());
    }
  }

  private Resolution resolveNow(UUID userId) {
    User user = userRepository.findById(userId).orElse(null);
    if (user == null || !user.isActive()) {
      return Resolution.noRole();
    }

    if (user.isSuperAdmin()) {
      return Resolution.superAdmin();
    }

    if (adminGrantRepository.existsByUserIdAndWorkspaceId(
        userId, Workspaces.PLATFORM_WORKSPACE_ID)) {
      return Resolution.platformStaff();
    }

    var adminGrant =
        adminGrantRepository
            .findFirstByUserIdAndWorkspaceIdIsNotNullAndWorkspaceIdNotOrderByCreatedAtAsc(
                userId, Workspaces.PLATFORM_WORKSPACE_ID);
    if (adminGrant.isPresent()) {
      return Resolution.admin(adminGrant.get().getWorkspaceId());
    }

    return employeeRepository
        .findByUserId(userId)
        .filter(EmployeeAssignment::isActive)
        .map(assignment -> Resolution.employee(assignment.getWorkspaceId()))
        .orElseGet(Resolution::noRole);
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }

  private static final class ResolverThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      var thread = new Thread(runnable, "role-resolver-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
