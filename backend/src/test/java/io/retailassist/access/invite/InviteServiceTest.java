package io.retailassist.access.invite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.retailassist.access.audit.AuditService;
import io.retailassist.access.exception.AccessError;
import io.retailassist.access.exception.ForbiddenException;
import io.retailassist.access.exception.InvalidRequestException;
import io.retailassist.access.exception.InvariantViolationException;
import io.retailassist.access.exception.InviteUnavailableException;
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
import io.retailassist.access.workspace.WorkspaceRepository;
import io.retailassist.access.workspace.Workspaces;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class InviteServiceTest {

  private static final UUID W1 = UUID.randomUUID();
  private static final UUID W2 = UUID.randomUUID();
  private static final UUID INVITER_ID = UUID.randomUUID();
  private static final UUID INVITEE_ID = UUID.randomUUID();
  private static final String EMAIL = "cashier@example.com";

  @Mock private InviteRepository inviteRepository;
  @Mock private UserRepository userRepository;
  @Mock private WorkspaceRepository workspaceRepository;
  @Mock private AdminGrantRepository adminGrantRepository;
  @Mock private EmployeeAssignmentRepository employeeRepository;
  @Mock private RoleResolver roleResolver;
  @Mock private IdentityService identityService;
  @Mock private IdentityProvider identityProvider;
  @Mock private AuditService auditService;

  private final InviteTokens inviteTokens = new InviteTokens();

  private InviteService service;

  @BeforeEach
  void setUp() {
    service =
        new InviteService(
            inviteRepository,
            userRepository,
            workspaceRepository,
            adminGrantRepository,
            employeeRepository,
            roleResolver,
            new WorkspaceScopeEnforcer(),
            identityService,
            identityProvider,
            inviteTokens,
            new InviteProperties(Duration.ofDays(30)),
            auditService,
            mock(PlatformTransactionManager.class));
  }

  // --- authorizeCreate ---

  static Stream<Resolution> nonSuperAdminResolutions() {
    return Stream.of(
        Resolution.admin(W1),
        Resolution.employee(W1),
        Resolution.platformStaff(),
        Resolution.noRole());
  }

  @ParameterizedTest
  @MethodSource("nonSuperAdminResolutions")
  void platformStaffInvite_forbiddenForAnyoneButSuperAdmin(Resolution inviter) {
    assertThatThrownBy(() -> service.authorizeCreate(inviter, Role.PLATFORM_STAFF, null))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void platformStaffInvite_bySuperAdmin_targetsPlatformWorkspace() {
    assertThat(service.authorizeCreate(Resolution.superAdmin(), Role.PLATFORM_STAFF, null))
        .isEqualTo(Workspaces.PLATFORM_WORKSPACE_ID);
  }

  @Test
  void platformStaffInvite_intoCustomerWorkspace_isForbidden() {
    assertThatThrownBy(
            () -> service.authorizeCreate(Resolution.superAdmin(), Role.PLATFORM_STAFF, W1))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void employeeInvite_byAdmin_infersOwnWorkspace() {
    assertThat(service.authorizeCreate(Resolution.admin(W1), Role.EMPLOYEE, null)).isEqualTo(W1);
  }

  @Test
  void employeeInvite_byAdmin_intoOtherWorkspace_isForbidden() {
    assertThatThrownBy(() -> service.authorizeCreate(Resolution.admin(W1), Role.EMPLOYEE, W2))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void employeeInvite_bySuperAdmin_requiresWorkspace() {
    assertThatThrownBy(() -> service.authorizeCreate(Resolution.superAdmin(), Role.EMPLOYEE, null))
        .isInstanceOf(InvalidRequestException.class);
    assertThat(service.authorizeCreate(Resolution.superAdmin(), Role.EMPLOYEE, W2)).isEqualTo(W2);
  }

  @Test
  void employeeInvite_intoPlatformWorkspace_isForbidden() {
    assertThatThrownBy(
            () ->
                service.authorizeCreate(
                    Resolution.superAdmin(), Role.EMPLOYEE, Workspaces.PLATFORM_WORKSPACE_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void employeeInvite_byEmployee_isForbidden() {
    assertThatThrownBy(() -> service.authorizeCreate(Resolution.employee(W1), Role.EMPLOYEE, W1))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void adminAndSuperAdminRoles_cannotBeInvited() {
    assertThatThrownBy(() -> service.authorizeCreate(Resolution.superAdmin(), Role.ADMIN, W1))
        .isInstanceOf(ForbiddenException.class);
    assertThatThrownBy(
            () -> service.authorizeCreate(Resolution.superAdmin(), Role.SUPER_ADMIN, null))
        .isInstanceOf(ForbiddenException.class);
  }

  // --- createInvite ---

  @Test
  void createInvite_storesOnlyTheTokenHash() {
    when(roleResolver.resolve(INVITER_ID)).thenReturn(Resolution.admin(W1));
    when(workspaceRepository.existsById(W1)).thenReturn(true);
    when(inviteRepository.save(any(Invite.class)))
        .thenAnswer(invocation -> withId(invocation.getArgument(0)));

    var created = service.createInvite(INVITER_ID, "  Cashier@Example.com ", Role.EMPLOYEE, null);

    var captor = ArgumentCaptor.forClass(Invite.class);
    verify(inviteRepository).save(captor.capture());
    var saved = captor.getValue();
    assertThat(saved.getTokenHash()).isEqualTo(inviteTokens.hash(created.token()));
    assertThat(saved.getTokenHash()).isNotEqualTo(created.token());
    assertThat(saved.getEmail()).isEqualTo(EMAIL);
    assertThat(saved.getStatus()).isEqualTo(InviteStatus.PENDING);
    assertThat(created.workspaceId()).isEqualTo(W1);
    assertThat(created.expiresAt()).isAfter(Instant.now().plus(Duration.ofDays(29)));
    verify(auditService).log(any());
  }

  // --- acceptInvite: token checks ---

  @Test
  void accept_blankToken_isInvalid() {
    assertRejected(acceptRequest(" ", EMAIL), AccessError.INVALID_TOKEN);
    verifyNoInteractions(inviteRepository);
  }

  @Test
  void accept_unknownToken_isInvalid() {
    when(inviteRepository.findByTokenHash(anyString())).thenReturn(Optional.empty());

    assertRejected(acceptRequest("no-such-token", EMAIL), AccessError.INVALID_TOKEN);
  }

  @Test
  void accept_expiredPendingInvite_isExpiredAndMarked() {
    var invite = storedInvite("tok", Instant.now().minusSeconds(1), InviteStatus.PENDING);
    when(inviteRepository.markExpired(invite.getId())).thenReturn(1);

    assertRejected(acceptRequest("tok", EMAIL), AccessError.EXPIRED);
    verify(inviteRepository).markExpired(invite.getId());
    verify(auditService).log(any());
  }

  @Test
  void accept_expiredAcceptedInvite_reportsExpiredWithoutRewriting() {
    var invite = storedInvite("tok", Instant.now().minusSeconds(1), InviteStatus.ACCEPTED);

    assertRejected(acceptRequest("tok", EMAIL), AccessError.EXPIRED);
    verify(inviteRepository, never()).markExpired(invite.getId());
  }

  @Test
  void accept_revokedInvite_isAlreadyUsedOrRevoked() {
    storedInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.REVOKED);

    assertRejected(acceptRequest("tok", EMAIL), AccessError.ALREADY_USED_OR_REVOKED);
  }

  @Test
  void accept_emailMismatch_neverTouchesIdentityProvider() {
    storedInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.PENDING);

    assertRejected(acceptRequest("tok", "someone-else@example.com"), AccessError.EMAIL_MISMATCH);
    verifyNoInteractions(identityProvider, identityService);
  }

  // --- acceptInvite: grant step ---

  @Test
  void accept_employeeInvite_createsAssignment() {
    var invite = storedInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.PENDING);
    stubInviteeAccount();
    when(inviteRepository.markAccepted(eq(invite.getId()), any())).thenReturn(1);
    when(adminGrantRepository.existsByUserId(INVITEE_ID)).thenReturn(false);
    when(employeeRepository.existsByUserId(INVITEE_ID)).thenReturn(false);

    var accepted = service.acceptInvite(acceptRequest("tok", "CASHIER@example.com"));

    assertThat(accepted).isEqualTo(new InviteService.AcceptedInvite(INVITEE_ID, Role.EMPLOYEE, W1));
    var captor = ArgumentCaptor.forClass(EmployeeAssignment.class);
    verify(employeeRepository).saveAndFlush(captor.capture());
    assertThat(captor.getValue().getWorkspaceId()).isEqualTo(W1);
    assertThat(captor.getValue().getUserId()).isEqualTo(INVITEE_ID);
  }

  @Test
  void accept_lostRace_isAlreadyUsedAndCreatesNothing() {
    var invite = storedInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.PENDING);
    stubInviteeAccount();
    when(inviteRepository.markAccepted(eq(invite.getId()), any())).thenReturn(0);

    assertRejected(acceptRequest("tok", EMAIL), AccessError.ALREADY_USED_OR_REVOKED);
    verify(employeeRepository, never()).saveAndFlush(any());
  }

  @Test
  void accept_byAdmin_isDualRoleViolation() {
    var invite = storedInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.PENDING);
    stubInviteeAccount();
    when(inviteRepository.markAccepted(eq(invite.getId()), any())).thenReturn(1);
    when(adminGrantRepository.existsByUserId(INVITEE_ID)).thenReturn(true);

    assertThatThrownBy(() -> service.acceptInvite(acceptRequest("tok", EMAIL)))
        .isInstanceOfSatisfying(
            InvariantViolationException.class,
            e -> assertThat(e.getCode()).isEqualTo(AccessError.DUAL_ROLE_VIOLATION));
    verify(employeeRepository, never()).saveAndFlush(any());
  }

  @Test
  void accept_byExistingEmployee_isAlreadyEmployeeElsewhere() {
    var invite = storedInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.PENDING);
    stubInviteeAccount();
    when(inviteRepository.markAccepted(eq(invite.getId()), any())).thenReturn(1);
    when(adminGrantRepository.existsByUserId(INVITEE_ID)).thenReturn(false);
    when(employeeRepository.existsByUserId(INVITEE_ID)).thenReturn(true);

    assertThatThrownBy(() -> service.acceptInvite(acceptRequest("tok", EMAIL)))
        .isInstanceOfSatisfying(
            InvariantViolationException.class,
            e -> assertThat(e.getCode()).isEqualTo(AccessError.ALREADY_EMPLOYEE_ELSEWHERE));
  }

  // --- revokeInvite ---

  @Test
  void revoke_byDifferentAdmin_isForbidden() {
    var invite = newInvite("tok", Instant.now().plusSeconds(3600), InviteStatus.PENDING);
    var otherAdmin = UUID.randomUUID();
    when(inviteRepository.findById(invite.getId())).thenReturn(Optional.of(invite));
    when(roleResolver.resolve(otherAdmin)).thenReturn(Resolution.admin(W1));

    assertThatThrownBy(() -> service.revokeInvite(invite.getId(), otherAdmin))
        .isInstanceOf(ForbiddenException.class);
    verify(inviteRepository, never()).markRevoked(any(), any());
  }

  private void assertRejected(InviteService.AcceptRequest request, AccessError reason) {
    assertThatThrownBy(() -> service.acceptInvite(request))
        .isInstanceOfSatisfying(
            InviteUnavailableException.class, e -> assertThat(e.getReason()).isEqualTo(reason));
  }

  private void stubInviteeAccount() {
    when(identityProvider.ensureAccount(EMAIL, "s3cret-pass")).thenReturn("user_invitee");
    when(identityService.findOrCreateUser(EMAIL, "user_invitee", "Pat Cashier"))
        .thenReturn(new IdentityService.UserLink(INVITEE_ID, true));
    when(userRepository.findByIdForUpdate(INVITEE_ID))
        .thenReturn(Optional.of(new User(EMAIL, "user_invitee")));
  }

  private Invite storedInvite(String rawToken, Instant expiresAt, InviteStatus status) {
    var invite = newInvite(rawToken, expiresAt, status);
    when(inviteRepository.findByTokenHash(inviteTokens.hash(rawToken)))
        .thenReturn(Optional.of(invite));
    return invite;
  }

  private Invite newInvite(String rawToken, Instant expiresAt, InviteStatus status) {
    var invite =
        withId(
            new Invite(
                W1, EMAIL, INVITER_ID, Role.EMPLOYEE, inviteTokens.hash(rawToken), expiresAt));
    ReflectionTestUtils.setField(invite, "status", status);
    return invite;
  }

  private static Invite withId(Invite invite) {
    ReflectionTestUtils.setField(invite, "id", UUID.randomUUID());
    return invite;
  }

  private static InviteService.AcceptRequest acceptRequest(String token, String email) {
    return new InviteService.AcceptRequest(token, email, "Pat Cashier", "+15550100", "s3cret-pass");
  }
}
