package io.retailassist.access.security;

import io.retailassist.access.exception.UnknownPrincipalException;
import java.util.UUID;

/**
 * Holds the internal user id of the authenticated principal for the current request thread. Bound
 * by {@link PrincipalFilter} from the validated JWT subject and cleared when the request
 * completes. Roles are deliberately not held here: they are resolved on demand so revocations take
 * effect on the next request.
 */
public final class RequestPrincipal {

  private static final ThreadLocal<UUID> CURRENT_USER_ID = new ThreadLocal<>();

  private RequestPrincipal() {}

  static void bind(UUID userId) {
    CURRENT_USER_ID.set(userId);
  }

  static void clear() {
    CURRENT_USER_ID.remove();
  }

  /** Returns the current user id, or null if no principal is bound. */
  public static UUID getUserIdOrNull() {
    return CURRENT_USER_ID.get();
  }

  /** Returns the current user id. Throws if the filter chain did not bind a principal. */
  public static UUID requireUserId() {
    UUID userId = CURRENT_USER_ID.get();
    if (userId == null) {
      throw new UnknownPrincipalException();
    }
    return userId;
  }

  public static boolean isBound() {
    return CURRENT_USER_ID.get() != null;
  }
}
