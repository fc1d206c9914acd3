package io.retailassist.access.grant;

import io.retailassist.access.security.RequestPrincipal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/platform-staff")
public class PlatformStaffController {

  private final PlatformStaffService platformStaffService;

  public PlatformStaffController(PlatformStaffService platformStaffService) {
    this.platformStaffService = platformStaffService;
  }

  @GetMapping
  public ResponseEntity<List<PlatformStaffResponse>> list() {
    var grants = platformStaffService.listPlatformStaff(RequestPrincipal.requireUserId());
    return ResponseEntity.ok(
        grants.stream()
            .map(g -> new PlatformStaffResponse(g.getId(), g.getUserId(), g.getCreatedAt()))
            .toList());
  }

  public record PlatformStaffResponse(UUID grantId, UUID userId, Instant grantedAt) {}
}
