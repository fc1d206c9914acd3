package io.retailassist.access.workspace;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/workspaces")
public class WorkspaceProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceProvisioningController.class);

  private final WorkspaceProvisioningService provisioningService;

  public WorkspaceProvisioningController(WorkspaceProvisioningService provisioningService) {
    this.provisioningService = provisioningService;
  }

  @PostMapping
  public ResponseEntity<ProvisioningResponse> provisionWorkspace(
      @Valid @RequestBody ProvisioningRequest request) {
    log.info("Received workspace provisioning request for owner {}", request.ownerUserId());

    var result = provisioningService.provisionWorkspace(request.ownerUserId(), request.name());

    if (result.alreadyProvisioned()) {
      return ResponseEntity.status(409)
          .body(new ProvisioningResponse(result.workspaceId(), "Workspace already provisioned"));
    }

    return ResponseEntity.created(URI.create("/internal/workspaces/" + result.workspaceId()))
        .body(new ProvisioningResponse(result.workspaceId(), "Workspace provisioned"));
  }

  public record ProvisioningRequest(
      @NotNull(message = "ownerUserId is required") UUID ownerUserId,
      @NotBlank(message = "name is required") @Size(max = 255) String name) {}

  public record ProvisioningResponse(UUID workspaceId, String message) {}
}
