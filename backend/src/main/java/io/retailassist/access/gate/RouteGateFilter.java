package io.retailassist.access.gate;

import io.retailassist.access.security.RequestLoggingFilter;
import io.retailassist.access.security.RequestPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the {@link RouteAuthorizationGate} to page routes. Redirects are answered with 302; an
 * allowed request carries its resolution as the {@link #RESOLUTION_ATTRIBUTE} request attribute.
 * API routes are not gated here.
 */
@Component
public class RouteGateFilter extends OncePerRequestFilter {

  public static final String RESOLUTION_ATTRIBUTE = RouteGateFilter.class.getName() + ".resolution";

  private static final Logger log = LoggerFactory.getLogger(RouteGateFilter.class);

  private final RouteAuthorizationGate gate;

  public RouteGateFilter(RouteAuthorizationGate gate) {
    this.gate = gate;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var decision = gate.authorize(RequestPrincipal.getUserIdOrNull(), pathOf(request));

    if (decision instanceof GateDecision.Allow allow) {
      var resolution = allow.resolution();
      request.setAttribute(RESOLUTION_ATTRIBUTE, resolution);
      MDC.put(RequestLoggingFilter.MDC_ROLE, resolution.role().wireValue());
      if (resolution.workspaceId() != null) {
        MDC.put(RequestLoggingFilter.MDC_WORKSPACE_ID, resolution.workspaceId().toString());
      }
      filterChain.doFilter(request, response);
    } else if (decision instanceof GateDecision.Redirect redirect) {
      response.sendRedirect(request.getContextPath() + redirect.target());
    } else if (decision instanceof GateDecision.Deny deny) {
      log.warn("Route gate denied {} with status {}", request.getRequestURI(), deny.status());
      response.sendError(deny.status());
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = RouteTable.normalize(pathOf(request));
    if (path == null) {
      return false;
    }
    if (gate.isShared(path)) {
      return false;
    }
    for (String prefix : gate.routeTable().protectedPrefixes()) {
      if (RouteTable.matchesPrefix(path, prefix)) {
        return false;
      }
    }
    return true;
  }

  private static String pathOf(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    return contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)
        ? uri.substring(contextPath.length())
        : uri;
  }
}
