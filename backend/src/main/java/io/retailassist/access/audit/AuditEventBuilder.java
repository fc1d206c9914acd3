package io.retailassist.access.audit;

import io.retailassist.access.security.RequestPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builds an {@link AuditEventRecord}. The actor and request line are taken from the current
 * request unless the actor is set explicitly.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .eventType("invite.revoked")
 *         .entityType("invite")
 *         .entityId(invite.getId())
 *         .workspaceId(invite.getWorkspaceId())
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private UUID workspaceId;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  /** Overrides the request principal, e.g. for the user who has just been linked to an invite. */
  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder workspaceId(UUID workspaceId) {
    this.workspaceId = workspaceId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    UUID resolvedActorId = actorIdExplicitlySet ? actorId : RequestPrincipal.getUserIdOrNull();
    HttpServletRequest request = resolveHttpRequest();
    String requestLine =
        request != null ? request.getMethod() + " " + request.getRequestURI() : null;
    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedActorId, workspaceId, requestLine, details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
