package io.retailassist.access.gate;

import io.retailassist.access.exception.RoleResolutionException;
import io.retailassist.access.role.Resolution;
import io.retailassist.access.role.RoleResolver;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Edge check run before any page handler: resolves the caller once and compares the requested
 * path against the {@link RouteTable}. A caller outside their route set is sent to their own home
 * rather than refused. This check is advisory for data access; workspace-scoped reads still go
 * through the scope enforcer.
 */
@Component
public class RouteAuthorizationGate {

  private static final Logger log = LoggerFactory.getLogger(RouteAuthorizationGate.class);

  private final RoleResolver roleResolver;
  private final RouteTable routeTable;
  private final GateProperties properties;

  @Autowired
  public RouteAuthorizationGate(RoleResolver roleResolver, GateProperties properties) {
    this(roleResolver, RouteTable.defaultTable(), properties);
  }

  RouteAuthorizationGate(
      RoleResolver roleResolver, RouteTable routeTable, GateProperties properties) {
    this.roleResolver = roleResolver;
    this.routeTable = routeTable;
    this.properties = properties;
  }

  /**
   * @param userId the authenticated principal, or null when the request carries none
   * @param requestedPath the raw request path
   */
  public GateDecision authorize(UUID userId, String requestedPath) {
    if (userId == null) {
      return new GateDecision.Redirect(properties.loginPath());
    }

    Resolution resolution;
    try {
      resolution = resolveWithRetry(userId);
    } catch (RoleResolutionException e) {
      log.warn("security.gate_unavailable user={} path={}", userId, requestedPath);
      return new GateDecision.Deny(HttpStatus.SERVICE_UNAVAILABLE.value());
    }

    if (!resolution.hasRole()) {
      return new GateDecision.Redirect(properties.loginPath());
    }

    String path = RouteTable.normalize(requestedPath);
    if (path != null) {
      if (isShared(path) || routeTable.permits(resolution.role(), path)) {
        return new GateDecision.Allow(resolution);
      }
    }

    String home = routeTable.homeOf(resolution.role());
    log.debug(
        "Redirecting {} from {} to {}", resolution.role().wireValue(), requestedPath, home);
    return new GateDecision.Redirect(home);
  }

  public RouteTable routeTable() {
    return routeTable;
  }

  public boolean isShared(String normalizedPath) {
    for (String shared : properties.sharedPaths()) {
      if (RouteTable.matchesPrefix(normalizedPath, shared)) {
        return true;
      }
    }
    return false;
  }

  private Resolution resolveWithRetry(UUID userId) {
    long backoffMillis = properties.retryBackoff().toMillis();
    int attempt = 0;
    while (true) {
      try {
        return roleResolver.resolve(userId);
      } catch (RoleResolutionException e) {
        if (attempt >= properties.retryAttempts()) {
          throw e;
        }
        attempt++;
        log.debug("Retrying role resolution for user {} (attempt {})", userId, attempt + 1);
        try {
          Thread.sleep(backoffMillis);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          throw e;
        }
        backoffMillis *= 2;
      }
    }
  }
}
