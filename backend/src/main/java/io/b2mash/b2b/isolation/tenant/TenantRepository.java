package io.b2mash.b2b.isolation.tenant;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface TenantRepository
    extends JpaRepository<Tenant, UUID>, JpaSpecificationExecutor<Tenant> {

  Optional<Tenant> findBySubdomainIgnoreCase(String subdomain);

  boolean existsBySubdomainIgnoreCase(String subdomain);

  long countByStatus(TenantStatus status);

  long countByPlan(Plan plan);

  long countByCreatedAtAfter(Instant since);
}
