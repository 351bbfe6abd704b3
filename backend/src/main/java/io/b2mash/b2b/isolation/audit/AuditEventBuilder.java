package io.b2mash.b2b.isolation.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;

/**
 * Builder that constructs an {@link AuditEventRecord}. The tenant id falls back to the {@code
 * tenantId} MDC entry, then to {@code "system"}.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .action("schema.created")
 *     .entityType("schema")
 *     .entityId(schemaName)
 *     .details(Map.of("durationMs", durationMs))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  public static final String SYSTEM_TENANT = "system";

  private String action;
  private String entityType;
  private String entityId;
  private String tenantId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(String entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId != null ? entityId.toString() : null;
    return this;
  }

  public AuditEventBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public AuditEventBuilder tenantId(UUID tenantId) {
    this.tenantId = tenantId != null ? tenantId.toString() : null;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * @throws IllegalStateException if action, entityType or entityId is missing
   */
  public AuditEventRecord build() {
    if (action == null || entityType == null || entityId == null) {
      throw new IllegalStateException("action, entityType and entityId are required");
    }
    String resolvedTenantId = tenantId;
    if (resolvedTenantId == null) {
      String fromMdc = MDC.get("tenantId");
      resolvedTenantId = fromMdc != null ? fromMdc : SYSTEM_TENANT;
    }
    Map<String, Object> resolvedDetails =
        details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    return new AuditEventRecord(action, entityType, entityId, resolvedTenantId, resolvedDetails);
  }
}
