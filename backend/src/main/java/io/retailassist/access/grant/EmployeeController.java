package io.retailassist.access.grant;

import io.retailassist.access.security.RequestPrincipal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workspaces/{workspaceId}/employees")
public class EmployeeController {

  private final EmployeeService employeeService;

  public EmployeeController(EmployeeService employeeService) {
    this.employeeService = employeeService;
  }

  @GetMapping
  public ResponseEntity<List<EmployeeResponse>> list(@PathVariable UUID workspaceId) {
    var employees = employeeService.listEmployees(RequestPrincipal.requireUserId(), workspaceId);
    return ResponseEntity.ok(employees.stream().map(EmployeeResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<EmployeeResponse> get(
      @PathVariable UUID workspaceId, @PathVariable UUID id) {
    return ResponseEntity.ok(
        EmployeeResponse.from(
            employeeService.getEmployee(RequestPrincipal.requireUserId(), workspaceId, id)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<EmployeeResponse> update(
      @PathVariable UUID workspaceId,
      @PathVariable UUID id,
      @Valid @RequestBody UpdateEmployeeRequest request) {
    var updated =
        employeeService.updateEmployee(
            RequestPrincipal.requireUserId(),
            workspaceId,
            id,
            request.fullName(),
            request.phone(),
            request.active());
    return ResponseEntity.ok(EmployeeResponse.from(updated));
  }

  @PostMapping("/{id}/deactivate")
  public ResponseEntity<EmployeeResponse> deactivate(
      @PathVariable UUID workspaceId, @PathVariable UUID id) {
    return ResponseEntity.ok(
        EmployeeResponse.from(
            employeeService.deactivateEmployee(
                RequestPrincipal.requireUserId(), workspaceId, id)));
  }

  public record UpdateEmployeeRequest(
      @Size(max = 255) String fullName, @Size(max = 32) String phone, Boolean active) {}

  public record EmployeeResponse(
      UUID id,
      UUID userId,
      UUID workspaceId,
      String fullName,
      String phone,
      boolean active,
      Instant createdAt,
      Instant updatedAt) {

    static EmployeeResponse from(EmployeeAssignment assignment) {
      return new EmployeeResponse(
          assignment.getId(),
          assignment.getUserId(),
          assignment.getWorkspaceId(),
          assignment.getFullName(),
          assignment.getPhone(),
          assignment.isActive(),
          assignment.getCreatedAt(),
          assignment.getUpdatedAt());
    }
  }
}
