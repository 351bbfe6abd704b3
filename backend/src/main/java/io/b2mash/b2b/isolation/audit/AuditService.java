package io.b2mash.b2b.isolation.audit;

/**
 * Audit collaborator. Schema and bucket lifecycle events, tenant status changes and isolation
 * violations are reported here; the storage format belongs to the implementation.
 */
public interface AuditService {

  /**
   * Records a single audit event. Implementations must not throw: a failed audit write never
   * fails the operation being audited.
   */
  void log(AuditEventRecord record);
}
