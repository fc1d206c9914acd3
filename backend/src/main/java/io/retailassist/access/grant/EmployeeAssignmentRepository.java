package io.retailassist.access.grant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmployeeAssignmentRepository extends JpaRepository<EmployeeAssignment, UUID> {

  Optional<EmployeeAssignment> findByUserId(UUID userId);

  boolean existsByUserId(UUID userId);

  List<EmployeeAssignment> findByWorkspaceIdOrderByCreatedAtAsc(UUID workspaceId);
}
