package io.retailassist.access.gate;

import io.retailassist.access.role.Role;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static mapping of each role to its home path and permitted path prefixes. Prefixes match whole
 * segments: {@code /admin} covers {@code /admin} and {@code /admin/users} but not
 * {@code /administrator}.
 */
public final class RouteTable {

  record RouteRule(String home, List<String> allowedPrefixes, List<String> excludedPrefixes) {}

  private static final RouteTable DEFAULT =
      new RouteTable(
          Map.of(
              Role.SUPER_ADMIN,
              new RouteRule("/admin", List.of("/admin"), List.of("/admin/support")),
              Role.PLATFORM_STAFF,
              new RouteRule("/admin/support", List.of("/admin/support"), List.of()),
              Role.ADMIN,
              new RouteRule("/dashboard", List.of("/dashboard"), List.of()),
              Role.EMPLOYEE,
              new RouteRule("/employees/dashboard", List.of("/employees/dashboard"), List.of())));

  private final Map<Role, RouteRule> rules;

  RouteTable(Map<Role, RouteRule> rules) {
    this.rules = new EnumMap<>(rules);
    for (Role role : Role.values()) {
      if (!this.rules.containsKey(role)) {
        throw new IllegalArgumentException("Route table has no entry for role " + role);
      }
    }
  }

  public static RouteTable defaultTable() {
    return DEFAULT;
  }

  public String homeOf(Role role) {
    return rules.get(role).home();
  }

  /** Whether {@code path} (already normalized) is inside the role's route set. */
  public boolean permits(Role role, String path) {
    RouteRule rule = rules.get(role);
    for (String excluded : rule.excludedPrefixes()) {
      if (matchesPrefix(path, excluded)) {
        return false;
      }
    }
    for (String allowed : rule.allowedPrefixes()) {
      if (matchesPrefix(path, allowed)) {
        return true;
      }
    }
    return false;
  }

  /** Every prefix any role may reach; the gate filter only runs below these. */
  public List<String> protectedPrefixes() {
    return rules.values().stream()
        .flatMap(rule -> rule.allowedPrefixes().stream())
        .distinct()
        .sorted()
        .toList();
  }

  static boolean matchesPrefix(String path, String prefix) {
    if ("/".equals(prefix)) {
      return "/".equals(path);
    }
    return path.equals(prefix) || path.startsWith(prefix + "/");
  }

  /**
   * Strips query and fragment, collapses repeated slashes and drops a trailing slash. Returns null
   * for paths with dot segments, which never match any prefix.
   */
  static String normalize(String rawPath) {
    if (rawPath == null || rawPath.isBlank()) {
      return "/";
    }
    String path = rawPath.trim();
    int cut = indexOfAny(path, '?', '#');
    if (cut >= 0) {
      path = path.substring(0, cut);
    }
    if (!path.startsWith("/")) {
      path = "/" + path;
    }
    path = path.replaceAll("/{2,}", "/");
    for (String segment : path.split("/")) {
      if (".".equals(segment) || "..".equals(segment)) {
        return null;
      }
    }
    if (path.length() > 1 && path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path;
  }

  private static int indexOfAny(String value, char first, char second) {
    int a = value.indexOf(first);
    int b = value.indexOf(second);
    if (a < 0) {
      return b;
    }
    return b < 0 ? a : Math.min(a, b);
  }
}
