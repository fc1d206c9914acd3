package io.retailassist.access.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts request correlation keys in the MDC. {@code role} and {@code workspaceId} are added further
 * down the chain by the route gate once a resolution exists; all keys are removed here.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  public static final String MDC_REQUEST_ID = "requestId";
  public static final String MDC_SUBJECT = "subject";
  public static final String MDC_USER_ID = "userId";
  public static final String MDC_ROLE = "role";
  public static final String MDC_WORKSPACE_ID = "workspaceId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        MDC.put(MDC_SUBJECT, jwtAuth.getToken().getSubject());
      }

      UUID userId = RequestPrincipal.getUserIdOrNull();
      if (userId != null) {
        MDC.put(MDC_USER_ID, userId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID);
      MDC.remove(MDC_SUBJECT);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_ROLE);
      MDC.remove(MDC_WORKSPACE_ID);
    }
  }
}
