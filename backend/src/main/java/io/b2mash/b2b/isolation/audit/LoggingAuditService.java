package io.b2mash.b2b.isolation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Default {@link AuditService}: writes each event to the dedicated {@code audit} logger. */
@Service
public class LoggingAuditService implements AuditService {

  private static final Logger auditLog = LoggerFactory.getLogger("audit");

  @Override
  public void log(AuditEventRecord record) {
    if (record.action().startsWith("security.")) {
      auditLog.warn(
          "[AUDIT] {} | {} | {}:{} | {}",
          record.tenantId(),
          record.action(),
          record.entityType(),
          record.entityId(),
          record.details());
    } else {
      auditLog.info(
          "[AUDIT] {} | {} | {}:{} | {}",
          record.tenantId(),
          record.action(),
          record.entityType(),
          record.entityId(),
          record.details());
    }
  }
}
