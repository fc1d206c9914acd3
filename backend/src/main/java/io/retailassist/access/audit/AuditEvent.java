package io.retailassist.access.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One row of the access audit trail: a role grant, an invite transition or a refused request.
 * Rows are insert-only.
 */
@Entity
@Table(name = "audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_type", nullable = false, length = 100)
  private String eventType;

  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  @Column(name = "actor_user_id", updatable = false)
  private UUID actorUserId;

  @Column(name = "workspace_id", updatable = false)
  private UUID workspaceId;

  /** {@code METHOD /path} of the triggering request; null for scheduled and internal work. */
  @Column(name = "request_line", length = 300)
  private String requestLine;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details")
  private Map<String, Object> details;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected AuditEvent() {}

  public AuditEvent(AuditEventRecord record) {
    this.eventType = record.eventType();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.actorUserId = record.actorUserId();
    this.workspaceId = record.workspaceId();
    this.requestLine = record.requestLine();
    this.details = record.details();
    this.occurredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEventType() {
    return eventType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public UUID getActorUserId() {
    return actorUserId;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public String getRequestLine() {
    return requestLine;
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}
