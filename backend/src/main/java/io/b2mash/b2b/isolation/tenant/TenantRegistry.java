package io.b2mash.b2b.isolation.tenant;

import io.b2mash.b2b.isolation.audit.AuditEventBuilder;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.exception.InvalidIdentifierException;
import io.b2mash.b2b.isolation.exception.ResourceConflictException;
import io.b2mash.b2b.isolation.exception.ResourceNotFoundException;
import io.b2mash.b2b.isolation.multitenancy.IdentifierContext;
import io.b2mash.b2b.isolation.multitenancy.IdentifierSanitizer;
import jakarta.persistence.criteria.Predicate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Authoritative store of tenants, backed by {@code public.tenants}. Every lookup here runs on the
 * application pool's default namespace; tenant-scoped connections never see this table.
 */
@Service
public class TenantRegistry {

  private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);
  private static final Duration RECENT_WINDOW = Duration.ofDays(7);

  private final TenantRepository tenantRepository;
  private final AuditService auditService;

  public TenantRegistry(TenantRepository tenantRepository, AuditService auditService) {
    this.tenantRepository = tenantRepository;
    this.auditService = auditService;
  }

  /** True if {@code identifier} matches a tenant id or subdomain, whatever its status. */
  @Transactional(readOnly = true)
  public boolean exists(String identifier) {
    return resolve(identifier).isPresent();
  }

  /**
   * Looks a tenant up by id (when {@code identifier} parses as a UUID) or by subdomain,
   * case-insensitively.
   */
  @Transactional(readOnly = true)
  public Optional<Tenant> resolve(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      return Optional.empty();
    }
    String candidate = identifier.trim();
    Optional<UUID> id = parseUuid(candidate);
    if (id.isPresent()) {
      Optional<Tenant> byId = tenantRepository.findById(id.get());
      if (byId.isPresent()) {
        return byId;
      }
    }
    return tenantRepository.findBySubdomainIgnoreCase(candidate);
  }

  @Transactional(readOnly = true)
  public Optional<Tenant> getBySubdomain(String subdomain) {
    if (subdomain == null || subdomain.isBlank()) {
      return Optional.empty();
    }
    return tenantRepository.findBySubdomainIgnoreCase(subdomain.trim());
  }

  @Transactional(readOnly = true)
  public Optional<Tenant> findById(UUID id) {
    return tenantRepository.findById(id);
  }

  @Transactional
  public Tenant register(String subdomain, String name, Plan plan) {
    return register(subdomain, name, plan, TenantStatus.ACTIVE);
  }

  /**
   * Inserts a new tenant row. The subdomain is stored lower-case and must pass both the DNS and
   * the schema identifier rules, so every registered tenant has a derivable schema.
   *
   * @throws InvalidIdentifierException if the subdomain fails either rule set
   * @throws ResourceConflictException if the subdomain is already registered
   */
  @Transactional
  public Tenant register(String subdomain, String name, Plan plan, TenantStatus status) {
    IdentifierSanitizer.sanitize(subdomain, IdentifierContext.DNS);
    IdentifierSanitizer.sanitize(subdomain, IdentifierContext.SCHEMA);
    String normalized = subdomain.toLowerCase(Locale.ROOT);
    if (tenantRepository.existsBySubdomainIgnoreCase(normalized)) {
      throw subdomainTaken(normalized, null);
    }
    var tenant =
        new Tenant(
            normalized,
            name,
            plan != null ? plan : Plan.FREE,
            status != null ? status : TenantStatus.ACTIVE);
    try {
      tenant = tenantRepository.saveAndFlush(tenant);
    } catch (DataIntegrityViolationException e) {
      // Lost a race against a concurrent registration of the same subdomain
      throw subdomainTaken(normalized, e);
    }
    log.info(
        "Registered tenant {} ({}) on plan {} as {}",
        tenant.getId(),
        normalized,
        tenant.getPlan(),
        tenant.getStatus());
    return tenant;
  }

  @Transactional
  public Tenant updateStatus(UUID id, TenantStatus status) {
    if (status == null) {
      throw new IllegalArgumentException("Tenant status must not be null");
    }
    var tenant = require(id);
    applyStatus(tenant, status);
    return tenantRepository.save(tenant);
  }

  @Transactional
  public Tenant updatePlan(UUID id, Plan plan) {
    if (plan == null) {
      throw new IllegalArgumentException("Tenant plan must not be null");
    }
    var tenant = require(id);
    if (tenant.getPlan() != plan) {
      log.info("Tenant {} plan {} -> {}", id, tenant.getPlan(), plan);
      tenant.updatePlan(plan);
    }
    return tenantRepository.save(tenant);
  }

  /** Applies the non-null fields of {@code update}. */
  @Transactional
  public Tenant updateTenant(UUID id, TenantUpdate update) {
    var tenant = require(id);
    if (update.name() != null && !update.name().equals(tenant.getName())) {
      tenant.rename(update.name());
    }
    if (update.plan() != null && update.plan() != tenant.getPlan()) {
      tenant.updatePlan(update.plan());
    }
    if (update.status() != null) {
      applyStatus(tenant, update.status());
    }
    return tenantRepository.save(tenant);
  }

  /**
   * Removes the registry row only. Schema and bucket are dropped separately by the provisioning
   * side. Active tenants must be suspended first.
   */
  @Transactional
  public TenantDeletionResult delete(UUID id) {
    var tenant = tenantRepository.findById(id);
    if (tenant.isEmpty()) {
      return TenantDeletionResult.refused("Tenant not found");
    }
    if (tenant.get().getStatus() == TenantStatus.ACTIVE) {
      return TenantDeletionResult.refused(
          "Cannot delete active tenant. Suspend first.");
    }
    tenantRepository.delete(tenant.get());
    log.info("Deleted tenant {} ({})", id, tenant.get().getSubdomain());
    return TenantDeletionResult.deleted();
  }

  @Transactional(readOnly = true)
  public Page<Tenant> list(TenantListQuery query) {
    var pageable =
        PageRequest.of(query.page() - 1, query.size(), Sort.by(query.direction(), query.sortBy()));
    return tenantRepository.findAll(toSpecification(query), pageable);
  }

  @Transactional(readOnly = true)
  public TenantStats stats() {
    Map<TenantStatus, Long> byStatus = new EnumMap<>(TenantStatus.class);
    for (TenantStatus status : TenantStatus.values()) {
      byStatus.put(status, tenantRepository.countByStatus(status));
    }
    Map<Plan, Long> byPlan = new EnumMap<>(Plan.class);
    for (Plan plan : Plan.values()) {
      byPlan.put(plan, tenantRepository.countByPlan(plan));
    }
    long recent = tenantRepository.countByCreatedAtAfter(Instant.now().minus(RECENT_WINDOW));
    return new TenantStats(tenantRepository.count(), byStatus, byPlan, recent);
  }

  private void applyStatus(Tenant tenant, TenantStatus status) {
    var previous = tenant.getStatus();
    if (previous == status) {
      return;
    }
    tenant.updateStatus(status);
    log.info("Tenant {} status {} -> {}", tenant.getId(), previous, status);
    auditService.log(
        AuditEventBuilder.builder()
            .action("tenant.status_changed")
            .entityType("tenant")
            .entityId(tenant.getId())
            .tenantId(tenant.getId())
            .details(Map.of("from", previous.name(), "to", status.name()))
            .build());
  }

  private Tenant require(UUID id) {
    return tenantRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Tenant", id));
  }

  private static Specification<Tenant> toSpecification(TenantListQuery query) {
    return (root, cq, cb) -> {
      var predicates = new ArrayList<Predicate>();
      if (query.search() != null && !query.search().isBlank()) {
        String pattern = "%" + query.search().trim().toLowerCase(Locale.ROOT) + "%";
        predicates.add(
            cb.or(
                cb.like(cb.lower(root.get("name")), pattern),
                cb.like(cb.lower(root.get("subdomain")), pattern)));
      }
      if (query.status() != null) {
        predicates.add(cb.equal(root.get("status"), query.status()));
      }
      if (query.plan() != null) {
        predicates.add(cb.equal(root.get("plan"), query.plan()));
      }
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }

  private static ResourceConflictException subdomainTaken(String subdomain, Throwable cause) {
    return new ResourceConflictException(
        "Subdomain taken", "Subdomain '" + subdomain + "' is already registered", cause);
  }

  private static Optional<UUID> parseUuid(String candidate) {
    try {
      return Optional.of(UUID.fromString(candidate));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
