package io.retailassist.access.workspace;

import java.util.UUID;

/** Well-known workspace identifiers. */
public final class Workspaces {

  /**
   * The reserved platform workspace. Only {@code platform_staff} grants point at it; it is seeded by
   * migration and never owned by a customer.
   */
  public static final UUID PLATFORM_WORKSPACE_ID =
      UUID.fromString("00000000-0000-0000-0000-000000000001");

  public static boolean isPlatform(UUID workspaceId) {
    return PLATFORM_WORKSPACE_ID.equals(workspaceId);
  }

  private Workspaces() {}
}
