package io.b2mash.b2b.isolation.tenant;

/**
 * Partial update for {@link TenantRegistry#updateTenant}. Null fields are left untouched. The
 * subdomain is not updatable: schema and bucket names are derived from it.
 */
public record TenantUpdate(String name, Plan plan, TenantStatus status) {}
