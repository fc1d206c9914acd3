package io.retailassist.access.security;

import io.retailassist.access.exception.InvariantViolationException;
import io.retailassist.access.identity.IdentityService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Maps the validated JWT subject to the internal user id and binds it to {@link
 * RequestPrincipal} for the rest of the request. A subject seen for the first time is linked or
 * created from the token's email claim. Requests without a JWT continue unbound.
 */
@Component
public class PrincipalFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(PrincipalFilter.class);

  private final IdentityService identityService;

  public PrincipalFilter(IdentityService identityService) {
    this.identityService = identityService;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    UUID userId;
    try {
      userId = resolvePrincipal();
    } catch (DataAccessException e) {
      log.warn("Failed to resolve principal for {}: {}", request.getRequestURI(), e.getMessage());
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
      return;
    }

    if (userId == null) {
      filterChain.doFilter(request, response);
      return;
    }

    RequestPrincipal.bind(userId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestPrincipal.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/")
        || path.startsWith("/actuator/")
        || path.startsWith("/api/public/");
  }

  private UUID resolvePrincipal() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }

    Jwt jwt = jwtAuth.getToken();
    String subject = jwt.getSubject();
    if (subject == null) {
      return null;
    }

    var known = identityService.findUserIdByExternalAuthId(subject);
    if (known.isPresent()) {
      return known.get();
    }

    String email = JwtClaims.extractEmail(jwt);
    if (email == null) {
      log.warn("security.unknown_principal subject={} reason=no_email_claim", subject);
      return null;
    }
    try {
      return identityService.syncUser(subject, email, JwtClaims.extractName(jwt)).userId();
    } catch (InvariantViolationException e) {
      log.warn("security.unknown_principal subject={} reason=identity_conflict", subject);
      return null;
    }
  }
}
