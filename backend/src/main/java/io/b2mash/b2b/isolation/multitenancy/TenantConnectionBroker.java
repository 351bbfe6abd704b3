package io.b2mash.b2b.isolation.multitenancy;

import io.b2mash.b2b.isolation.audit.AuditEventBuilder;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.exception.CleanupFailureException;
import io.b2mash.b2b.isolation.exception.InvalidIdentifierException;
import io.b2mash.b2b.isolation.exception.TenantIsolationViolationException;
import io.b2mash.b2b.isolation.tenant.Tenant;
import io.b2mash.b2b.isolation.tenant.TenantRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Service;

/**
 * Hands out pooled connections scoped to one tenant's schema and guarantees that every connection
 * goes back to the pool on the default namespace, or not at all.
 *
 * <p>For each call: resolve the tenant through the registry, borrow a connection, switch its
 * search path, run the work, then reset and verify the search path whatever the outcome. A
 * connection whose reset cannot be verified is destroyed.
 */
@Service
public class TenantConnectionBroker {

  private static final Logger log = LoggerFactory.getLogger(TenantConnectionBroker.class);

  static final String MDC_TENANT_ID = "tenantId";
  static final String MDC_TENANT_SCHEMA = "tenantSchema";

  private final TenantRegistry tenantRegistry;
  private final TenantConnectionPool pool;
  private final AuditService auditService;
  private final BrokerProperties properties;

  public TenantConnectionBroker(
      TenantRegistry tenantRegistry,
      TenantConnectionPool pool,
      AuditService auditService,
      BrokerProperties properties) {
    this.tenantRegistry = tenantRegistry;
    this.pool = pool;
    this.auditService = auditService;
    this.properties = properties;
  }

  /**
   * Runs {@code work} on a connection whose search path is the tenant's schema followed by the
   * default schema.
   *
   * @param tenantIdentifier tenant id or subdomain
   * @throws TenantIsolationViolationException if the registry does not know the tenant; no
   *     connection is borrowed in that case
   * @throws CleanupFailureException if the work succeeded but the connection could not be reset
   *     (the connection has been destroyed)
   */
  public <T> T withTenantConnection(String tenantIdentifier, TenantWork<T> work) {
    Tenant tenant =
        tenantRegistry
            .resolve(tenantIdentifier)
            .orElseThrow(() -> rejectUnknownTenant(tenantIdentifier, "not registered"));
    TenantSchema schema = schemaFor(tenant, tenantIdentifier);

    var scoped = newScopedConnection();
    try {
      scoped.enterScope(schema);
    } catch (SQLException | RuntimeException e) {
      scoped.markContaminated();
      log.error("Failed to switch connection to schema {}, destroying it", schema, e);
      pool.destroy(scoped.connection());
      throw new DataAccessResourceFailureException(
          "Could not switch connection to schema " + schema, e);
    }

    var handle =
        new TenantHandle(
            tenant.getId(), schema, scoped.connection(), properties.queryTimeoutSeconds());
    String previousTenantId = MDC.get(MDC_TENANT_ID);
    String previousSchema = MDC.get(MDC_TENANT_SCHEMA);
    MDC.put(MDC_TENANT_ID, tenant.getId().toString());
    MDC.put(MDC_TENANT_SCHEMA, schema.name());
    try {
      T result;
      try {
        result = work.execute(handle);
      } catch (Throwable workFailure) {
        Exception cleanupFailure = endTenantScope(scoped, handle);
        if (cleanupFailure != null) {
          workFailure.addSuppressed(cleanupFailure);
        }
        throw workFailure;
      }
      Exception cleanupFailure = endTenantScope(scoped, handle);
      if (cleanupFailure != null) {
        throw new CleanupFailureException(
            "Connection scoped to " + schema + " could not be reset and was destroyed",
            cleanupFailure);
      }
      return result;
    } finally {
      restoreMdc(MDC_TENANT_ID, previousTenantId);
      restoreMdc(MDC_TENANT_SCHEMA, previousSchema);
    }
  }

  /**
   * Runs {@code work} on a connection verified to be on the default namespace, both before the work
   * starts and after it ends. A connection that fails either check is destroyed.
   */
  public <T> T withRegistryConnection(RegistryWork<T> work) {
    var scoped = newScopedConnection();
    try {
      scoped.verifyDefault();
    } catch (SQLException | RuntimeException e) {
      scoped.markContaminated();
      log.error("Pooled connection was not on the default namespace, destroying it", e);
      pool.destroy(scoped.connection());
      throw new DataAccessResourceFailureException(
          "Borrowed connection failed default namespace verification", e);
    }

    var handle = new RegistryHandle(scoped.connection(), properties.queryTimeoutSeconds());
    T result;
    try {
      result = work.execute(handle);
    } catch (Throwable workFailure) {
      Exception cleanupFailure = endRegistryScope(scoped, handle);
      if (cleanupFailure != null) {
        workFailure.addSuppressed(cleanupFailure);
      }
      throw workFailure;
    }
    Exception cleanupFailure = endRegistryScope(scoped, handle);
    if (cleanupFailure != null) {
      throw new CleanupFailureException(
          "Registry connection left the default namespace and was destroyed", cleanupFailure);
    }
    return result;
  }

  /**
   * Records an access attempt for a tenant the registry does not know and returns the exception
   * the caller must throw.
   */
  TenantIsolationViolationException rejectUnknownTenant(String tenantIdentifier, String reason) {
    log.error(
        "Tenant isolation violation: identifier '{}' rejected ({})", tenantIdentifier, reason);
    try {
      auditService.log(
          AuditEventBuilder.builder()
              .action("security.tenant_isolation_violation")
              .entityType("tenant")
              .entityId(String.valueOf(tenantIdentifier))
              .tenantId(AuditEventBuilder.SYSTEM_TENANT)
              .details(Map.of("reason", reason))
              .build());
    } catch (RuntimeException e) {
      log.error("Failed to audit isolation violation for '{}'", tenantIdentifier, e);
    }
    return new TenantIsolationViolationException(tenantIdentifier);
  }

  private TenantSchema schemaFor(Tenant tenant, String tenantIdentifier) {
    try {
      return TenantSchema.forSubdomain(tenant.getSubdomain());
    } catch (InvalidIdentifierException e) {
      throw rejectUnknownTenant(tenantIdentifier, "stored subdomain " + e.getReason());
    }
  }

  private Connection borrow() {
    try {
      return pool.borrow();
    } catch (SQLException e) {
      throw new CannotGetJdbcConnectionException("Failed to borrow connection from pool", e);
    }
  }

  /** Resets the search path, then releases or destroys. Returns the reset failure, if any. */
  private Exception endTenantScope(ScopedConnection scoped, TenantHandle handle) {
    handle.close();
    try {
      scoped.exitScope();
    } catch (SQLException | RuntimeException e) {
      scoped.markContaminated();
      log.error(
          "Failed to reset search_path after work in schema {}, destroying connection",
          handle.schemaName(),
          e);
      pool.destroy(scoped.connection());
      return e;
    }
    pool.release(scoped.connection());
    return null;
  }

  private Exception endRegistryScope(ScopedConnection scoped, RegistryHandle handle) {
    handle.close();
    try {
      scoped.verifyDefault();
    } catch (SQLException | RuntimeException e) {
      scoped.markContaminated();
      log.error("Registry connection left the default namespace, destroying it", e);
      pool.destroy(scoped.connection());
      return e;
    }
    pool.release(scoped.connection());
    return null;
  }

  private ScopedConnection newScopedConnection() {
    return new ScopedConnection(
        borrow(), properties.defaultSchema(), properties.cleanupTimeoutSeconds());
  }

  private static void restoreMdc(String key, String previous) {
    if (previous != null) {
      MDC.put(key, previous);
    } else {
      MDC.remove(key);
    }
  }
}
