package io.b2mash.b2b.isolation.audit;

import java.util.Map;

/**
 * Payload handed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param action event type following the {@code {entity}.{action}} convention
 * @param entityType "tenant", "schema", "bucket" or "security"
 * @param entityId id or name of the affected entity (not a FK, the entity may be gone)
 * @param tenantId tenant the event belongs to, or "system"
 * @param details additional key/value metadata; never null
 */
public record AuditEventRecord(
    String action,
    String entityType,
    String entityId,
    String tenantId,
    Map<String, Object> details) {}
