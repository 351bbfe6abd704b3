package io.b2mash.b2b.isolation.provisioning;

import io.b2mash.b2b.isolation.audit.AuditEventBuilder;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.exception.InvalidIdentifierException;
import io.b2mash.b2b.isolation.exception.ProvisioningException;
import io.b2mash.b2b.isolation.exception.ResourceConflictException;
import io.b2mash.b2b.isolation.multitenancy.TenantNamespaces;
import io.b2mash.b2b.isolation.storage.StorageBucketProvisioner;
import io.b2mash.b2b.isolation.tenant.Plan;
import io.b2mash.b2b.isolation.tenant.Tenant;
import io.b2mash.b2b.isolation.tenant.TenantRegistry;
import io.b2mash.b2b.isolation.tenant.TenantStatus;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

/**
 * Composes registration, schema creation and bucket creation into one provisioning call.
 *
 * <p>The tenant row is written first as PENDING and only marked ACTIVE once both resources exist.
 * A failed step leaves the row PENDING; calling again with the same subdomain resumes. A schema or
 * bucket that already exists is not recreated but its configuration is applied again, so a
 * resource left half set up is completed. Nothing is retried automatically.
 */
@Service
@Validated
public class TenantProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(TenantProvisioningService.class);

  private final TenantRegistry tenantRegistry;
  private final SchemaLifecycleManager schemaLifecycleManager;
  private final StorageBucketProvisioner storageBucketProvisioner;
  private final AuditService auditService;

  public TenantProvisioningService(
      TenantRegistry tenantRegistry,
      SchemaLifecycleManager schemaLifecycleManager,
      StorageBucketProvisioner storageBucketProvisioner,
      AuditService auditService) {
    this.tenantRegistry = tenantRegistry;
    this.schemaLifecycleManager = schemaLifecycleManager;
    this.storageBucketProvisioner = storageBucketProvisioner;
    this.auditService = auditService;
  }

  /**
   * @throws jakarta.validation.ConstraintViolationException if the request is malformed
   * @throws InvalidIdentifierException if the subdomain fails the format rules
   * @throws ResourceConflictException if the subdomain belongs to a tenant that is not PENDING
   * @throws ProvisioningException if a step fails; the tenant stays PENDING
   */
  public ProvisioningResult provisionTenant(@Valid ProvisioningRequest request) {
    String subdomain =
        request.subdomain() != null ? request.subdomain().trim().toLowerCase(Locale.ROOT) : null;
    var format = QuotaPolicy.checkFormat(subdomain);
    if (!format.available()) {
      throw new InvalidIdentifierException(format.reason());
    }
    Plan plan = request.plan() != null ? request.plan() : Plan.FREE;

    var existing = tenantRegistry.getBySubdomain(subdomain);
    boolean resuming = existing.isPresent();
    if (resuming && existing.get().getStatus() != TenantStatus.PENDING) {
      throw new ResourceConflictException(
          "Subdomain taken", "Subdomain '" + subdomain + "' is already in use");
    }

    Tenant tenant = resuming ? existing.get() : register(subdomain, request.name(), plan);
    UUID tenantId = tenant.getId();
    if (resuming) {
      log.info("Resuming provisioning of pending tenant {} ({})", tenantId, subdomain);
      plan = tenant.getPlan();
    }

    String schemaName = ensureSchema(tenant, resuming);
    String bucketName = ensureBucket(tenant, plan, resuming);
    activate(tenantId);

    var provisionedAt = Instant.now();
    log.info(
        "Provisioned tenant {} ({}) with schema {} and bucket {}",
        tenantId,
        subdomain,
        schemaName,
        bucketName);
    var details = new LinkedHashMap<String, Object>();
    details.put("subdomain", subdomain);
    details.put("plan", plan.slug());
    details.put("schemaName", schemaName);
    details.put("bucketName", bucketName);
    details.put("resumed", resuming);
    if (request.adminEmail() != null) {
      details.put("adminEmail", request.adminEmail());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .action("tenant.provisioned")
            .entityType("tenant")
            .entityId(tenantId)
            .tenantId(tenantId)
            .details(details)
            .build());
    return new ProvisioningResult(tenantId, schemaName, bucketName, provisionedAt);
  }

  private Tenant register(String subdomain, String name, Plan plan) {
    try {
      return tenantRegistry.register(subdomain, name, plan, TenantStatus.PENDING);
    } catch (ResourceConflictException | InvalidIdentifierException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to register tenant {}", subdomain, e);
      throw new ProvisioningException(
          ProvisioningStep.REGISTRATION, "Failed to register tenant '" + subdomain + "'", e);
    }
  }

  private String ensureSchema(Tenant tenant, boolean resuming) {
    String subdomain = tenant.getSubdomain();
    try {
      if (resuming && schemaLifecycleManager.verify(subdomain).exists()) {
        log.info("Schema for {} already exists, completing its configuration", subdomain);
        schemaLifecycleManager.configure(subdomain);
        return TenantNamespaces.schemaName(subdomain);
      }
      return schemaLifecycleManager.create(subdomain).schemaName();
    } catch (RuntimeException e) {
      log.error("Schema step failed for tenant {} ({})", tenant.getId(), subdomain, e);
      throw new ProvisioningException(
          ProvisioningStep.SCHEMA, "Failed to create schema for '" + subdomain + "'", e);
    }
  }

  private String ensureBucket(Tenant tenant, Plan plan, boolean resuming) {
    UUID tenantId = tenant.getId();
    try {
      if (resuming && storageBucketProvisioner.exists(tenantId)) {
        log.info("Bucket for tenant {} already exists, completing its configuration", tenantId);
        storageBucketProvisioner.configure(tenantId, plan);
        return TenantNamespaces.bucketName(tenantId);
      }
      return storageBucketProvisioner.create(tenantId, plan).bucketName();
    } catch (RuntimeException e) {
      log.error("Bucket step failed for tenant {}", tenantId, e);
      throw new ProvisioningException(
          ProvisioningStep.BUCKET, "Failed to create bucket for tenant " + tenantId, e);
    }
  }

  private void activate(UUID tenantId) {
    try {
      tenantRegistry.updateStatus(tenantId, TenantStatus.ACTIVE);
    } catch (RuntimeException e) {
      log.error("Failed to activate tenant {}", tenantId, e);
      throw new ProvisioningException(
          ProvisioningStep.ACTIVATION, "Failed to activate tenant " + tenantId, e);
    }
  }

  public record ProvisioningResult(
      UUID tenantId, String schemaName, String bucketName, Instant provisionedAt) {}
}
