package io.retailassist.access.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.retailassist.access.exception.RoleResolutionException;
import io.retailassist.access.role.Resolution;
import io.retailassist.access.role.RoleResolver;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RouteAuthorizationGateTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final UUID W1 = UUID.randomUUID();

  @Mock private RoleResolver roleResolver;

  private RouteAuthorizationGate gate;

  @BeforeEach
  void setUp() {
    var properties =
        new GateProperties("/login", List.of("/", "/invite", "/onboarding"), 2, Duration.ZERO);
    gate = new RouteAuthorizationGate(roleResolver, properties);
  }

  @Test
  void unauthenticated_redirectsToLogin() {
    assertThat(gate.authorize(null, "/dashboard"))
        .isEqualTo(new GateDecision.Redirect("/login"));
    verifyNoInteractions(roleResolver);
  }

  @Test
  void noRole_redirectsToLoginEvenOnSharedRoute() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.noRole());

    assertThat(gate.authorize(USER_ID, "/onboarding"))
        .isEqualTo(new GateDecision.Redirect("/login"));
  }

  @Test
  void admin_allowedOnDashboard() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.admin(W1));

    assertThat(gate.authorize(USER_ID, "/dashboard/settings"))
        .isEqualTo(new GateDecision.Allow(Resolution.admin(W1)));
  }

  @Test
  void employeeOnAdminDashboard_redirectsToEmployeeHome() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.employee(W1));

    assertThat(gate.authorize(USER_ID, "/dashboard"))
        .isEqualTo(new GateDecision.Redirect("/employees/dashboard"));
  }

  @Test
  void superAdminOnSupportArea_redirectsToAdminHome() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.superAdmin());

    assertThat(gate.authorize(USER_ID, "/admin/support/queue"))
        .isEqualTo(new GateDecision.Redirect("/admin"));
  }

  @Test
  void platformStaffOnAdminRoot_redirectsToSupportHome() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.platformStaff());

    assertThat(gate.authorize(USER_ID, "/admin"))
        .isEqualTo(new GateDecision.Redirect("/admin/support"));
  }

  @Test
  void sharedRoutes_allowedForEveryResolvedRole() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.employee(W1));

    assertThat(gate.authorize(USER_ID, "/invite/abc")).isInstanceOf(GateDecision.Allow.class);
    assertThat(gate.authorize(USER_ID, "/")).isInstanceOf(GateDecision.Allow.class);
  }

  @Test
  void dotSegmentPath_redirectsHome() {
    when(roleResolver.resolve(USER_ID)).thenReturn(Resolution.admin(W1));

    assertThat(gate.authorize(USER_ID, "/dashboard/../admin"))
        .isEqualTo(new GateDecision.Redirect("/dashboard"));
  }

  @Test
  void transientFailure_isRetriedThenSucceeds() {
    when(roleResolver.resolve(USER_ID))
        .thenThrow(new RoleResolutionException("timeout", null))
        .thenReturn(Resolution.admin(W1));

    assertThat(gate.authorize(USER_ID, "/dashboard")).isInstanceOf(GateDecision.Allow.class);
    verify(roleResolver, times(2)).resolve(USER_ID);
  }

  @Test
  void persistentFailure_deniesWithServiceUnavailable() {
    when(roleResolver.resolve(USER_ID)).thenThrow(new RoleResolutionException("down", null));

    assertThat(gate.authorize(USER_ID, "/dashboard")).isEqualTo(new GateDecision.Deny(503));
    verify(roleResolver, times(3)).resolve(USER_ID);
  }
}
