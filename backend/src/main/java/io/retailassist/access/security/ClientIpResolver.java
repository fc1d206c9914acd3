package io.retailassist.access.security;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the client IP address from a servlet request behind a reverse proxy. */
public final class ClientIpResolver {

  private ClientIpResolver() {}

  /** First hop of X-Forwarded-For, then X-Real-IP, then the socket address. */
  public static String resolve(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      return forwardedFor.split(",")[0].trim();
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return request.getRemoteAddr();
  }
}
