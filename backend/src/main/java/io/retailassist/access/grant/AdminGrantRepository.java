package io.retailassist.access.grant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AdminGrantRepository extends JpaRepository<AdminGrant, UUID> {

  boolean existsByUserId(UUID userId);

  boolean existsByUserIdAndWorkspaceId(UUID userId, UUID workspaceId);

  boolean existsByUserIdAndWorkspaceIdIsNull(UUID userId);

  /** Oldest customer-workspace grant of the user; the platform workspace is excluded. */
  Optional<AdminGrant> findFirstByUserIdAndWorkspaceIdIsNotNullAndWorkspaceIdNotOrderByCreatedAtAsc(
      UUID userId, UUID excludedWorkspaceId);

  List<AdminGrant> findByWorkspaceIdOrderByCreatedAtAsc(UUID workspaceId);
}
