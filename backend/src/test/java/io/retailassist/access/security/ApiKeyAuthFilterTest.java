package io.retailassist.access.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class ApiKeyAuthFilterTest {

  private static final String EXPECTED_KEY = "sync-service-key";

  private ApiKeyAuthFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private boolean filterChainCalled;

  private final FilterChain filterChain = (req, res) -> filterChainCalled = true;

  @BeforeEach
  void setUp() {
    filter = new ApiKeyAuthFilter(EXPECTED_KEY);
    request = new MockHttpServletRequest("POST", "/internal/users/sync");
    response = new MockHttpServletResponse();
    filterChainCalled = false;
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validKey_authenticatesInternalService() throws ServletException, IOException {
    request.addHeader("X-API-KEY", EXPECTED_KEY);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    var auth = SecurityContextHolder.getContext().getAuthentication();
    assertThat(auth).isNotNull();
    assertThat(auth.isAuthenticated()).isTrue();
    assertThat(auth.getPrincipal()).isEqualTo("internal-service");
  }

  @Test
  void wrongKey_returns401() throws ServletException, IOException {
    request.addHeader("X-API-KEY", "sync-service-kez");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
  }

  @Test
  void missingHeader_returns401() throws ServletException, IOException {
    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void blankConfiguredKey_failsAtStartup() {
    assertThatThrownBy(() -> new ApiKeyAuthFilter(" "))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void onlyInternalPathsAreFiltered() {
    assertThat(filter.shouldNotFilter(request)).isFalse();

    request.setRequestURI("/api/invites");
    assertThat(filter.shouldNotFilter(request)).isTrue();
  }
}
