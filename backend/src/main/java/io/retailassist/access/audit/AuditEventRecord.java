package io.retailassist.access.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Values of one audit row before it is persisted. Constructed by {@link AuditEventBuilder}.
 *
 * @param eventType {@code {entity}.{action}}, e.g. {@code invite.accepted}
 * @param entityType kind of the affected record: invite, workspace, employee, user or security
 * @param entityId id of the affected record (not a FK)
 * @param actorUserId user who caused the event; null for the expiry sweep and API-key callers
 * @param workspaceId workspace the event belongs to; null for platform-wide events
 * @param requestLine {@code METHOD /path} of the triggering request; null outside HTTP
 * @param details key facts of the change; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorUserId,
    UUID workspaceId,
    String requestLine,
    Map<String, Object> details) {}
